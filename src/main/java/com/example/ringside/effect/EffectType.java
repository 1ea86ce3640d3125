package com.example.ringside.effect;

import com.example.ringside.model.Modifier;
import com.example.ringside.model.ModifierTarget;

import java.util.Collections;
import java.util.Map;

/**
 * Catalogue of fight effects. Modifiers are fractions at full intensity
 * (0.15 = +15%). A default duration of 0 means the effect lasts until removed.
 */
public enum EffectType {

    // Buffs
    ADRENALINE_SURGE(Category.BUFF, "Adrenaline Surge", StackPolicy.REFRESH, 1, 20,
        Modifier.effects(ModifierTarget.POWER, 0.15, ModifierTarget.SPEED, 0.10, ModifierTarget.CHIN, 0.10)),
    MOMENTUM(Category.BUFF, "Momentum", StackPolicy.REFRESH, 1, 60,
        Modifier.effects(ModifierTarget.CONFIDENCE, 0.15, ModifierTarget.ACCURACY, 0.05, ModifierTarget.AGGRESSION, 0.15)),
    SECOND_WIND(Category.BUFF, "Second Wind", StackPolicy.UNIQUE, 1, 80,
        Modifier.effects(ModifierTarget.CARDIO, 0.20, ModifierTarget.WORK_RATE, 0.20, ModifierTarget.SPEED, 0.10)),
    KILLER_INSTINCT(Category.BUFF, "Killer Instinct", StackPolicy.REFRESH, 1, 30,
        Modifier.effects(ModifierTarget.AGGRESSION, 0.30, ModifierTarget.POWER, 0.10, ModifierTarget.ACCURACY, 0.05)),
    RHYTHM(Category.BUFF, "In Rhythm", StackPolicy.STACK, 3, 30,
        Modifier.effects(ModifierTarget.ACCURACY, 0.10, ModifierTarget.COMBINATION_SPEED, 0.10, ModifierTarget.HAND_SPEED, 0.05)),
    CROWD_ENERGY(Category.BUFF, "Crowd Energy", StackPolicy.REFRESH, 1, 40,
        Modifier.effects(ModifierTarget.AGGRESSION, 0.10, ModifierTarget.HEART, 0.05)),
    CONFIDENCE_BOOST(Category.BUFF, "Confidence Boost", StackPolicy.STACK, 2, 60,
        Modifier.effects(ModifierTarget.CONFIDENCE, 0.20, ModifierTarget.COMPOSURE, 0.10)),
    FRESH_LEGS(Category.BUFF, "Fresh Legs", StackPolicy.REFRESH, 1, 12,
        Modifier.effects(ModifierTarget.FOOT_SPEED, 0.10, ModifierTarget.FIRST_STEP, 0.10)),
    BIG_FIGHT_MENTALITY(Category.BUFF, "Big Fight Mentality", StackPolicy.UNIQUE, 1, 0,
        Modifier.effects(ModifierTarget.COMPOSURE, 0.15, ModifierTarget.ACCURACY, 0.10,
            ModifierTarget.HEART, 0.10, ModifierTarget.DEFENSE, 0.05)),
    FAST_START(Category.BUFF, "Fast Start", StackPolicy.UNIQUE, 1, 0,
        Modifier.effects(ModifierTarget.FIRST_STEP, 0.15, ModifierTarget.HAND_SPEED, 0.10,
            ModifierTarget.AGGRESSION, 0.20, ModifierTarget.POWER, 0.05)),

    // Debuffs
    CAUTIOUS(Category.DEBUFF, "Cautious", StackPolicy.REFRESH, 1, 30,
        Modifier.effects(ModifierTarget.AGGRESSION, -0.30)),
    RATTLED(Category.DEBUFF, "Rattled", StackPolicy.STACK, 3, 40,
        Modifier.effects(ModifierTarget.COMPOSURE, -0.20, ModifierTarget.DEFENSE, -0.10, ModifierTarget.ACCURACY, -0.10)),
    ARM_WEARY(Category.DEBUFF, "Arm Weary", StackPolicy.REFRESH, 1, 40,
        Modifier.effects(ModifierTarget.POWER, -0.15, ModifierTarget.HAND_SPEED, -0.10)),
    VISION_IMPAIRED(Category.DEBUFF, "Vision Impaired", StackPolicy.REFRESH, 1, 0,
        Modifier.effects(ModifierTarget.VISION, -0.15)),
    DESPERATE(Category.DEBUFF, "Desperate", StackPolicy.REFRESH, 1, 120,
        Modifier.effects(ModifierTarget.AGGRESSION, 0.25, ModifierTarget.DEFENSE, -0.20)),
    DEMORALIZED(Category.DEBUFF, "Demoralized", StackPolicy.REFRESH, 1, 60,
        Modifier.effects(ModifierTarget.CONFIDENCE, -0.25, ModifierTarget.AGGRESSION, -0.20, ModifierTarget.WORK_RATE, -0.10)),
    SHELL_SHOCKED(Category.DEBUFF, "Shell Shocked", StackPolicy.REFRESH, 1, 20,
        Modifier.effects(ModifierTarget.AGGRESSION, -0.40, ModifierTarget.HEAD_MOVEMENT, -0.10, ModifierTarget.REFLEXES, -0.10)),
    GASSED(Category.DEBUFF, "Gassed", StackPolicy.REFRESH, 1, 0,
        Modifier.effects(ModifierTarget.SPEED, -0.20, ModifierTarget.POWER, -0.15, ModifierTarget.DEFENSE, -0.15)),
    FROZEN(Category.DEBUFF, "Frozen", StackPolicy.REFRESH, 1, 180,
        Modifier.effects(ModifierTarget.AGGRESSION, -0.35, ModifierTarget.FIRST_STEP, -0.20, ModifierTarget.CONFIDENCE, -0.15)),
    HURT_HANDS(Category.DEBUFF, "Hurt Hands", StackPolicy.UNIQUE, 1, 0,
        Modifier.effects(ModifierTarget.POWER, -0.20)),
    FOCUS_LAPSE(Category.DEBUFF, "Focus Lapse", StackPolicy.REFRESH, 1, 6,
        Modifier.effects(ModifierTarget.REFLEXES, -0.30, ModifierTarget.DEFENSE, -0.25));

    public enum Category { BUFF, DEBUFF }

    /** What re-applying an active effect does. */
    public enum StackPolicy { STACK, REFRESH, UNIQUE }

    private final Category category;
    private final String displayName;
    private final StackPolicy stackPolicy;
    private final int maxStacks;
    private final int defaultDuration;
    private final Map<ModifierTarget, Double> modifiers;

    EffectType(Category category, String displayName, StackPolicy stackPolicy, int maxStacks,
               int defaultDuration, Map<ModifierTarget, Double> modifiers) {
        this.category = category;
        this.displayName = displayName;
        this.stackPolicy = stackPolicy;
        this.maxStacks = maxStacks;
        this.defaultDuration = defaultDuration;
        this.modifiers = Collections.unmodifiableMap(modifiers);
    }

    public Category getCategory() { return category; }
    public String getDisplayName() { return displayName; }
    public StackPolicy getStackPolicy() { return stackPolicy; }
    public int getMaxStacks() { return maxStacks; }
    public int getDefaultDuration() { return defaultDuration; }
    public Map<ModifierTarget, Double> getModifiers() { return modifiers; }

    public boolean isBuff() {
        return category == Category.BUFF;
    }
}

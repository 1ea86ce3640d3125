package com.example.ringside.effect;

import com.example.ringside.model.Attribute;
import com.example.ringside.model.Corner;
import com.example.ringside.model.Cut;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.InvalidFighterReferenceException;
import com.example.ringside.model.ModifierTarget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Timed psychological and physical effects for both fighters, plus the momentum
 * meter. The orchestrator calls the {@code on...} triggers as things happen in
 * the fight and {@link #tick()} once per tick.
 */
public class FightEffectsEngine {

    private static final double MOMENTUM_LIMIT = 100;
    private static final double MOMENTUM_SHIFT_THRESHOLD = 40;
    private static final int MOMENTUM_COOLDOWN_TICKS = 20;

    private final Map<Corner, Map<EffectType, FightEffect>> effects = new EnumMap<>(Corner.class);
    private final Map<Corner, Double> momentum = new EnumMap<>(Corner.class);
    private final Map<Corner, Integer> consecutiveLanded = new EnumMap<>(Corner.class);
    private final Map<Corner, Double> recentDamage = new EnumMap<>(Corner.class);
    private final Map<Corner, Boolean> secondWindUsed = new EnumMap<>(Corner.class);
    private final Map<Corner, String> fighterIds = new EnumMap<>(Corner.class);
    private final Random rng;
    private int momentumCooldown;

    public FightEffectsEngine(String fighterIdA, String fighterIdB, Random rng) {
        this.rng = rng;
        fighterIds.put(Corner.A, fighterIdA);
        fighterIds.put(Corner.B, fighterIdB);
        for (Corner c : Corner.values()) {
            effects.put(c, new EnumMap<>(EffectType.class));
            momentum.put(c, 0.0);
            consecutiveLanded.put(c, 0);
            recentDamage.put(c, 0.0);
            secondWindUsed.put(c, false);
        }
    }

    /**
     * Resolve a fighter id or corner label to its corner.
     * @throws InvalidFighterReferenceException if it names neither fighter
     */
    public Corner resolve(String fighterId) {
        for (Map.Entry<Corner, String> e : fighterIds.entrySet()) {
            if (e.getValue() != null && e.getValue().equals(fighterId)) return e.getKey();
        }
        return Corner.fromId(fighterId);
    }

    // ===== Core =====

    public FightEffect applyEffect(Corner corner, EffectType type, double intensity, int duration, String source) {
        Map<EffectType, FightEffect> active = effects.get(corner);
        FightEffect existing = active.get(type);
        if (existing != null) {
            if (type.getStackPolicy() != EffectType.StackPolicy.UNIQUE) {
                existing.refresh(intensity, duration);
            }
            return existing;
        }
        if (type == EffectType.MOMENTUM) {
            effects.get(corner.opponent()).remove(EffectType.MOMENTUM);
        }
        FightEffect effect = new FightEffect(type, intensity, duration, source);
        active.put(type, effect);
        return effect;
    }

    public FightEffect applyEffect(Corner corner, EffectType type, double intensity) {
        return applyEffect(corner, type, intensity, type.getDefaultDuration(), null);
    }

    public boolean removeEffect(Corner corner, EffectType type) {
        return effects.get(corner).remove(type) != null;
    }

    public boolean hasEffect(Corner corner, EffectType type) {
        return effects.get(corner).containsKey(type);
    }

    public FightEffect getEffect(Corner corner, EffectType type) {
        return effects.get(corner).get(type);
    }

    public double getEffectIntensity(Corner corner, EffectType type) {
        FightEffect e = effects.get(corner).get(type);
        return e == null ? 0 : e.getEffectiveIntensity();
    }

    public List<FightEffect> getActiveEffects(Corner corner) {
        return Collections.unmodifiableList(new ArrayList<>(effects.get(corner).values()));
    }

    /**
     * Run every effect down one tick, drop the expired ones and let momentum drift back.
     */
    public void tick() {
        for (Corner c : Corner.values()) {
            Iterator<FightEffect> it = effects.get(c).values().iterator();
            while (it.hasNext()) {
                if (it.next().tick()) it.remove();
            }
            double m = momentum.get(c);
            if (m > 0) momentum.put(c, Math.max(0, m - 0.2));
            else if (m < 0) momentum.put(c, Math.min(0, m + 0.2));
            recentDamage.put(c, recentDamage.get(c) * 0.95);
        }
        if (momentumCooldown > 0) momentumCooldown--;
    }

    // ===== Momentum =====

    private void addMomentum(Corner corner, double amount) {
        double v = momentum.get(corner) + amount;
        momentum.put(corner, Math.max(-MOMENTUM_LIMIT, Math.min(MOMENTUM_LIMIT, v)));
    }

    public double getMomentum(Corner corner) {
        return momentum.get(corner);
    }

    /**
     * Hand the MOMENTUM buff to a fighter whose meter is high enough, subject to a cooldown.
     * @return the corner that seized momentum, or null
     */
    public Corner checkMomentumShift() {
        if (momentumCooldown > 0) return null;
        for (Corner c : Corner.values()) {
            if (momentum.get(c) >= MOMENTUM_SHIFT_THRESHOLD && !hasEffect(c, EffectType.MOMENTUM)) {
                applyEffect(c, EffectType.MOMENTUM, Math.min(1, momentum.get(c) / MOMENTUM_LIMIT));
                momentumCooldown = MOMENTUM_COOLDOWN_TICKS;
                return c;
            }
        }
        return null;
    }

    // ===== Aggregate modifiers =====

    private double sum(Corner corner, ModifierTarget target) {
        double total = 0;
        for (FightEffect e : effects.get(corner).values()) total += e.getModifier(target);
        return total;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    public double getAggressionModifier(Corner corner) {
        return clamp(sum(corner, ModifierTarget.AGGRESSION), -0.6, 0.6);
    }

    public double getDefenseModifier(Corner corner) {
        return clamp(sum(corner, ModifierTarget.DEFENSE), -0.5, 0.3);
    }

    public double getAccuracyModifier(Corner corner) {
        return clamp(sum(corner, ModifierTarget.ACCURACY) + sum(corner, ModifierTarget.VISION), -0.4, 0.3);
    }

    public double getPowerModifier(Corner corner) {
        return clamp(sum(corner, ModifierTarget.POWER), -0.4, 0.3);
    }

    public double getSpeedModifier(Corner corner) {
        return clamp(sum(corner, ModifierTarget.SPEED), -0.4, 0.3);
    }

    public double getAttributeModifier(Corner corner, ModifierTarget target) {
        return sum(corner, target);
    }

    /**
     * Every attribute-backed modifier currently active, for the fighter's snapshot.
     */
    public Map<ModifierTarget, Double> getAttributeModifiers(Corner corner) {
        Map<ModifierTarget, Double> out = new EnumMap<>(ModifierTarget.class);
        for (FightEffect e : effects.get(corner).values()) {
            for (ModifierTarget t : e.getModifiers().keySet()) {
                if (t.getAttributes().isEmpty()) continue;
                out.merge(t, e.getModifier(t), Double::sum);
            }
        }
        out.replaceAll((t, v) -> clamp(v, -0.5, 0.5));
        return out;
    }

    // ===== Triggers =====

    public void onPunchLanded(Corner attacker, double damage, boolean powerPunch) {
        Corner defender = attacker.opponent();
        addMomentum(attacker, 3);
        addMomentum(defender, -2);
        consecutiveLanded.merge(attacker, 1, Integer::sum);
        consecutiveLanded.put(defender, 0);
        recentDamage.merge(defender, Math.max(0, damage), Double::sum);

        if (consecutiveLanded.get(attacker) >= 3) {
            applyEffect(attacker, EffectType.RHYTHM, 0.5);
        }
        if (powerPunch && damage >= 8 && rng.nextDouble() < 0.02) {
            applyEffect(attacker, EffectType.HURT_HANDS, 0.6);
        }
        if (damage >= 6) {
            applyEffect(defender, EffectType.CAUTIOUS, Math.min(1, damage / 10));
        }
        if (recentDamage.get(defender) > 25) {
            applyEffect(defender, EffectType.SHELL_SHOCKED, 0.7);
        }
    }

    public void onFighterHurt(Corner hurt, Fighter opponent) {
        applyEffect(hurt, EffectType.CAUTIOUS, 0.8);
        if (rng.nextDouble() < 0.3) {
            applyEffect(hurt, EffectType.ADRENALINE_SURGE, 0.6);
        }
        applyEffect(hurt.opponent(), EffectType.KILLER_INSTINCT,
            opponent.getAttribute(Attribute.KILLER_INSTINCT) / 100.0);
    }

    public void onKnockdown(Corner down, int knockdownsTotal, Fighter attacker) {
        addMomentum(down.opponent(), 30);
        addMomentum(down, -40);
        applyEffect(down, EffectType.RATTLED, 0.7);
        applyEffect(down, EffectType.CAUTIOUS, 1.0);
        if (knockdownsTotal >= 2) {
            applyEffect(down, EffectType.FROZEN, 0.5, 40, "knockdowns");
        }
        applyEffect(down.opponent(), EffectType.CONFIDENCE_BOOST, 0.7);
        applyEffect(down.opponent(), EffectType.KILLER_INSTINCT,
            attacker.getAttribute(Attribute.KILLER_INSTINCT) / 100.0);
    }

    public void onRecovery(Corner corner) {
        if (rng.nextDouble() < 0.4) {
            applyEffect(corner, EffectType.ADRENALINE_SURGE, 0.7);
        }
        removeEffect(corner, EffectType.SHELL_SHOCKED);
    }

    public void onHighOutput(Corner corner, int punchesThrown) {
        if (punchesThrown > 30) {
            applyEffect(corner, EffectType.ARM_WEARY, Math.min(1, 0.3 + (punchesThrown - 30) / 30.0));
        }
    }

    public void onStaminaLow(Corner corner, double staminaPercent) {
        if (staminaPercent < 0.2) {
            applyEffect(corner, EffectType.GASSED, Math.min(1, 1 - staminaPercent * 2.5));
        } else {
            removeEffect(corner, EffectType.GASSED);
        }
    }

    public void onBehindOnCards(Corner corner, double scoreDiff, int roundsLeft) {
        if (scoreDiff <= -2 && roundsLeft <= 3) {
            applyEffect(corner, EffectType.DESPERATE, Math.min(1, -scoreDiff / 6));
        }
    }

    public void onDomination(Corner dominant) {
        applyEffect(dominant, EffectType.CROWD_ENERGY, 0.6);
        applyEffect(dominant.opponent(), EffectType.DEMORALIZED, 0.5);
    }

    public void onCutOpened(Corner corner, Cut cut) {
        if (cut != null && cut.location().isEyeArea()) {
            applyEffect(corner, EffectType.VISION_IMPAIRED, Math.min(1, cut.severity() / 5.0));
        }
    }

    /**
     * Stare-down before the first bell. The gap between the intimidator's presence
     * and the target's heart (plus a little experience) decides whether the target
     * freezes and for how long.
     *
     * @return whether FROZEN was applied
     */
    public boolean onIntimidation(Corner target, int intimidation, int heart, int experience) {
        double gap = intimidation - (heart + experience * 0.2);
        if (gap <= 0) return false;
        double strength = Math.min(1, gap / 40);
        if (rng.nextDouble() >= 0.5 + intimidation / 200.0) return false;
        applyEffect(target, EffectType.FROZEN, strength, (int) Math.round(180 + strength * 500), "intimidation");
        return true;
    }

    /**
     * Late-fight surge, once per fight, in the last three rounds.
     */
    public boolean checkSecondWind(Corner corner, Fighter fighter, int round, int totalRounds) {
        if (secondWindUsed.get(corner) || round < totalRounds - 2) return false;
        if (rng.nextDouble() >= fighter.getAttribute(Attribute.SECOND_WIND) / 300.0) return false;
        secondWindUsed.put(corner, true);
        applyEffect(corner, EffectType.SECOND_WIND, 0.7, 80, "second wind");
        return true;
    }

    public boolean checkFocusLapse(Corner corner, Fighter fighter) {
        if (hasEffect(corner, EffectType.FOCUS_LAPSE)) return false;
        double chance = Math.max(0.003, (100 - fighter.getAttribute(Attribute.FOCUS)) / 1500.0);
        double stamina = fighter.getStaminaPercent();
        if (stamina < 0.4) chance *= 1.5;
        else if (stamina < 0.6) chance *= 1.2;
        if (rng.nextDouble() >= chance) return false;
        applyEffect(corner, EffectType.FOCUS_LAPSE, 0.8, 4 + rng.nextInt(5), "focus");
        return true;
    }

    /**
     * Clutch fighters raise their game against elite opposition, for the whole fight.
     */
    public boolean applyBigFightMentality(Corner corner, Fighter fighter, Fighter opponent) {
        double rating = (opponent.getAttribute(Attribute.CHIN)
            + opponent.getAttribute(Attribute.HEART)
            + opponent.getAttribute(Attribute.KNOCKOUT_POWER)
            + opponent.getAttribute(Attribute.FIGHT_IQ)
            + opponent.getAttribute(Attribute.EXPERIENCE)) / 5.0;
        int clutch = fighter.getAttribute(Attribute.CLUTCH_FACTOR);
        if (rating < 80 || clutch < 70) return false;
        double eliteFactor = 1 + (rating - 80) / 40;
        double intensity = Math.min(1, (clutch - 50) / 100.0 * eliteFactor);
        applyEffect(corner, EffectType.BIG_FIGHT_MENTALITY, intensity, 0, "big fight");
        return true;
    }

    /**
     * Explosive starters get an early-rounds buff. It has no timer of its own: it
     * fades each round and {@link #updateFastStartForRound} removes it from round five.
     */
    public boolean applyFastStart(Corner corner, Fighter fighter) {
        double score = (fighter.getAttribute(Attribute.FIRST_STEP) + fighter.getAttribute(Attribute.KILLER_INSTINCT)) / 2.0;
        if (score < 92) return false;
        applyEffect(corner, EffectType.FAST_START, Math.min(1, 0.3 + (score - 92) / 16), 0, "fast start");
        return true;
    }

    public void updateFastStartForRound(int round) {
        for (Corner c : Corner.values()) {
            FightEffect fs = effects.get(c).get(EffectType.FAST_START);
            if (fs == null) continue;
            if (round > 4) {
                effects.get(c).remove(EffectType.FAST_START);
            } else {
                fs.scaleModifiers(EffectType.FAST_START.getModifiers(), (5 - round) / 4.0);
            }
        }
    }

    /**
     * Between-rounds reset: round-scoped effects clear and both fighters come out on fresh legs.
     */
    public void resetForRound() {
        for (Corner c : Corner.values()) {
            Map<EffectType, FightEffect> active = effects.get(c);
            active.remove(EffectType.CAUTIOUS);
            active.remove(EffectType.SHELL_SHOCKED);
            active.remove(EffectType.FOCUS_LAPSE);
            active.remove(EffectType.RHYTHM);
            active.remove(EffectType.ARM_WEARY);
            applyEffect(c, EffectType.FRESH_LEGS, 0.3, 12, "round start");
            consecutiveLanded.put(c, 0);
            recentDamage.put(c, 0.0);
        }
    }

    // ===== Summary =====

    public EffectsSummary getEffectsSummary(Corner corner) {
        List<ActiveEffect> buffs = new ArrayList<>();
        List<ActiveEffect> debuffs = new ArrayList<>();
        for (FightEffect e : effects.get(corner).values()) {
            if (e.getType().isBuff()) buffs.add(ActiveEffect.of(e));
            else debuffs.add(ActiveEffect.of(e));
        }
        return new EffectsSummary(List.copyOf(buffs), List.copyOf(debuffs), momentum.get(corner));
    }

    public EffectsSummary getEffectsSummary(String fighterId) {
        return getEffectsSummary(resolve(fighterId));
    }
}

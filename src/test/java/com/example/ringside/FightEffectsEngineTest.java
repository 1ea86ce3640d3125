package com.example.ringside;

import com.example.ringside.effect.*;
import com.example.ringside.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FightEffectsEngine Tests")
class FightEffectsEngineTest {

    private FightEffectsEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FightEffectsEngine("red", "blue", new Random(11));
    }

    private static Fighter withAll(String name, int value, Attribute... attributes) {
        Map<Attribute, Integer> attrs = new EnumMap<>(Attribute.class);
        for (Attribute a : attributes) attrs.put(a, value);
        return new Fighter(name, attrs);
    }

    // ==================== Lookup ====================

    @Test
    @DisplayName("Fighters resolve by id or corner label")
    void resolveFighters() {
        assertEquals(Corner.A, engine.resolve("red"));
        assertEquals(Corner.B, engine.resolve("blue"));
        assertEquals(Corner.B, engine.resolve("B"));
        assertThrows(InvalidFighterReferenceException.class, () -> engine.resolve("green"));
        assertThrows(InvalidFighterReferenceException.class, () -> engine.getEffectsSummary("green"));
    }

    // ==================== Lifetime and stacking ====================

    @Test
    @DisplayName("Timed effects expire after their duration")
    void effectsExpire() {
        engine.applyEffect(Corner.A, EffectType.FRESH_LEGS, 0.5);
        for (int i = 0; i < 11; i++) engine.tick();
        assertTrue(engine.hasEffect(Corner.A, EffectType.FRESH_LEGS));
        engine.tick();
        assertFalse(engine.hasEffect(Corner.A, EffectType.FRESH_LEGS));
    }

    @Test
    @DisplayName("Permanent effects never expire")
    void permanentEffects() {
        engine.applyEffect(Corner.B, EffectType.VISION_IMPAIRED, 0.4);
        for (int i = 0; i < 1000; i++) engine.tick();
        assertTrue(engine.hasEffect(Corner.B, EffectType.VISION_IMPAIRED));
        assertEquals(0.4, engine.getEffectIntensity(Corner.B, EffectType.VISION_IMPAIRED), 1e-9);
    }

    @Test
    @DisplayName("Intensity fades over the last quarter of the duration")
    void intensityFades() {
        engine.applyEffect(Corner.A, EffectType.RATTLED, 0.8, 40, "test");
        for (int i = 0; i < 35; i++) engine.tick();
        assertEquals(0.8 * 5 / 10.0, engine.getEffectIntensity(Corner.A, EffectType.RATTLED), 1e-9);
    }

    @Test
    @DisplayName("Stacking effects cap at their maximum stacks")
    void stackingCaps() {
        for (int i = 0; i < 6; i++) engine.onPunchLanded(Corner.A, 1, false);
        assertEquals(3, engine.getEffect(Corner.A, EffectType.RHYTHM).getStacks());
    }

    @Test
    @DisplayName("Unique effects are not refreshed")
    void uniqueNotRefreshed() {
        FightEffect first = engine.applyEffect(Corner.A, EffectType.SECOND_WIND, 0.7, 80, "test");
        for (int i = 0; i < 10; i++) engine.tick();
        FightEffect again = engine.applyEffect(Corner.A, EffectType.SECOND_WIND, 1.0, 80, "test");

        assertSame(first, again);
        assertEquals(70, again.getDuration());
        assertEquals(0.7, again.getIntensity(), 1e-9);
    }

    // ==================== Momentum ====================

    @Test
    @DisplayName("Only one fighter holds momentum")
    void singleMomentumHolder() {
        engine.applyEffect(Corner.A, EffectType.MOMENTUM, 0.5);
        engine.applyEffect(Corner.B, EffectType.MOMENTUM, 0.5);
        assertFalse(engine.hasEffect(Corner.A, EffectType.MOMENTUM));
        assertTrue(engine.hasEffect(Corner.B, EffectType.MOMENTUM));
    }

    @Test
    @DisplayName("Momentum is clamped and shifts with a cooldown")
    void momentumShift() {
        Fighter attacker = new Fighter("Attacker", null);
        for (int i = 0; i < 6; i++) engine.onKnockdown(Corner.B, i + 1, attacker);

        assertEquals(100, engine.getMomentum(Corner.A), 1e-9);
        assertEquals(-100, engine.getMomentum(Corner.B), 1e-9);

        assertEquals(Corner.A, engine.checkMomentumShift());
        assertTrue(engine.hasEffect(Corner.A, EffectType.MOMENTUM));
        engine.removeEffect(Corner.A, EffectType.MOMENTUM);
        assertNull(engine.checkMomentumShift());
    }

    @Test
    @DisplayName("Knockdowns rattle the fallen fighter and embolden the other")
    void knockdownTrigger() {
        engine.onKnockdown(Corner.B, 2, new Fighter("Puncher", null));
        EffectsSummary down = engine.getEffectsSummary(Corner.B);
        assertTrue(down.has(EffectType.RATTLED));
        assertTrue(down.has(EffectType.FROZEN));
        EffectsSummary up = engine.getEffectsSummary("red");
        assertTrue(up.has(EffectType.CONFIDENCE_BOOST));
        assertTrue(up.has(EffectType.KILLER_INSTINCT));
        assertTrue(up.debuffs().isEmpty());
    }

    // ==================== Rounds ====================

    @Test
    @DisplayName("Round reset clears round-scoped effects and gives fresh legs")
    void resetForRound() {
        engine.applyEffect(Corner.A, EffectType.CAUTIOUS, 0.8);
        engine.applyEffect(Corner.A, EffectType.DESPERATE, 0.8);
        engine.resetForRound();

        assertFalse(engine.hasEffect(Corner.A, EffectType.CAUTIOUS));
        assertTrue(engine.hasEffect(Corner.A, EffectType.DESPERATE));
        assertTrue(engine.hasEffect(Corner.A, EffectType.FRESH_LEGS));
        assertTrue(engine.hasEffect(Corner.B, EffectType.FRESH_LEGS));
    }

    @Test
    @DisplayName("Fast start decays through round four and is gone in round five")
    void fastStartDecays() {
        Fighter explosive = withAll("Explosive", 100, Attribute.FIRST_STEP, Attribute.KILLER_INSTINCT);
        assertTrue(engine.applyFastStart(Corner.A, explosive));
        FightEffect fs = engine.getEffect(Corner.A, EffectType.FAST_START);
        double full = fs.getModifier(ModifierTarget.HAND_SPEED);

        engine.updateFastStartForRound(3);
        assertEquals(full / 2, fs.getModifier(ModifierTarget.HAND_SPEED), 1e-9);

        engine.updateFastStartForRound(5);
        assertFalse(engine.hasEffect(Corner.A, EffectType.FAST_START));
    }

    @Test
    @DisplayName("Ordinary starters get no fast start")
    void noFastStartForOrdinaryFighters() {
        assertFalse(engine.applyFastStart(Corner.A, new Fighter("Ordinary", null)));
    }

    // ==================== Pre-fight triggers ====================

    @Test
    @DisplayName("A big heart cannot be intimidated")
    void bigHeartResistsIntimidation() {
        assertFalse(engine.onIntimidation(Corner.B, 90, 95, 60));
        assertFalse(engine.hasEffect(Corner.B, EffectType.FROZEN));
    }

    @Test
    @DisplayName("Clutch fighters rise against elite opposition")
    void bigFightMentality() {
        Fighter elite = withAll("Elite", 95, Attribute.CHIN, Attribute.HEART, Attribute.KNOCKOUT_POWER,
            Attribute.FIGHT_IQ, Attribute.EXPERIENCE);
        Fighter clutch = withAll("Clutch", 90, Attribute.CLUTCH_FACTOR);
        Fighter journeyman = new Fighter("Journeyman", null);

        assertFalse(engine.applyBigFightMentality(Corner.A, clutch, journeyman));
        assertTrue(engine.applyBigFightMentality(Corner.A, clutch, elite));
        assertTrue(engine.getEffect(Corner.A, EffectType.BIG_FIGHT_MENTALITY).isPermanent());
    }

    // ==================== Aggregates ====================

    @Test
    @DisplayName("Attribute modifiers skip aggression and are clamped")
    void attributeModifiers() {
        engine.applyEffect(Corner.A, EffectType.KILLER_INSTINCT, 1.0);
        engine.applyEffect(Corner.A, EffectType.HURT_HANDS, 1.0);
        engine.applyEffect(Corner.A, EffectType.ARM_WEARY, 1.0);
        engine.applyEffect(Corner.A, EffectType.GASSED, 1.0);

        Map<ModifierTarget, Double> mods = engine.getAttributeModifiers(Corner.A);
        assertFalse(mods.containsKey(ModifierTarget.AGGRESSION));
        assertEquals(-0.4, mods.get(ModifierTarget.POWER), 1e-9);
        assertEquals(-0.4, engine.getPowerModifier(Corner.A), 1e-9);
        assertEquals(0.3, engine.getAggressionModifier(Corner.A), 1e-9);
    }
}

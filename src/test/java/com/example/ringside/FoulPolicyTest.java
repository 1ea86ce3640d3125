package com.example.ringside;

import com.example.ringside.model.*;
import com.example.ringside.official.*;
import com.example.ringside.util.ModelParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FoulPolicy Tests")
class FoulPolicyTest {

    private static final FightSituation MID_FIGHT = new FightSituation(5, 0, 4);

    /** Sees everything: skill 100 and full strictness make detection certain for late hits. */
    private static final Referee HAWK = new Referee("Hawk", 100, 100, 100, 100, 100,
        new RefereeTendencies(3, 1, 0.6, 0.5, 1, 1.0, true, 0.7));

    private FoulPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new FoulPolicy(new Random(21), ModelParameters.empty());
    }

    private static Fighter dirty(int dirtiness, Map<FoulType, Integer> tendencies) {
        return new Fighter("dirty", "Dirty Dan", null, null, null, new FoulTactics(dirtiness, tendencies));
    }

    // ==================== Attempts ====================

    @Test
    @DisplayName("Clean fighters never foul")
    void cleanFightersNeverFoul() {
        Fighter clean = dirty(19, Map.of(FoulType.HEADBUTT, 100));
        for (int i = 0; i < 5000; i++) {
            assertNull(policy.shouldAttemptFoul(Corner.A, clean, MID_FIGHT));
        }
    }

    @Test
    @DisplayName("Attempt rate follows dirtiness")
    void attemptRate() {
        Fighter filthy = dirty(100, Map.of(FoulType.HEADBUTT, 100));
        int attempts = 0;
        for (int i = 0; i < 10_000; i++) {
            FoulType t = policy.shouldAttemptFoul(Corner.A, filthy, MID_FIGHT);
            if (t != null) {
                attempts++;
                assertEquals(FoulType.HEADBUTT, t);
            }
        }
        assertTrue(attempts > 800 && attempts < 1200, "attempts: " + attempts);
    }

    @Test
    @DisplayName("Early rounds halve the attempt rate")
    void earlyRoundsAreCleaner() {
        Fighter filthy = dirty(100, Map.of());
        int early = 0;
        int late = 0;
        for (int i = 0; i < 20_000; i++) {
            if (policy.shouldAttemptFoul(Corner.A, filthy, new FightSituation(1, 0, 4)) != null) early++;
            if (policy.shouldAttemptFoul(Corner.B, filthy, MID_FIGHT) != null) late++;
        }
        assertTrue(early < late * 0.7, early + " vs " + late);
    }

    @Test
    @DisplayName("No tendencies means holding")
    void defaultsToHolding() {
        Fighter filthy = dirty(100, Map.of());
        FoulType t = null;
        for (int i = 0; i < 1000 && t == null; i++) t = policy.shouldAttemptFoul(Corner.A, filthy, MID_FIGHT);
        assertEquals(FoulType.HOLDING, t);
    }

    // ==================== Escalation ====================

    @Test
    @DisplayName("Repeated late hits escalate from warning to deductions to disqualification")
    void escalation() {
        Fighter attacker = dirty(0, Map.of());
        FoulConsequence[] expected = {
            FoulConsequence.WARNING,
            FoulConsequence.POINT_DEDUCTION,
            FoulConsequence.POINT_DEDUCTION,
            FoulConsequence.POINT_DEDUCTION,
            FoulConsequence.DISQUALIFICATION
        };
        for (FoulConsequence consequence : expected) {
            FoulResult r = policy.executeFoul(Corner.A, FoulType.HITTING_AFTER_BREAK, attacker, HAWK);
            assertTrue(r.detected());
            assertEquals(consequence, r.consequence());
        }

        FoulSummary summary = policy.getFoulSummary(Corner.A);
        assertEquals(5, summary.committed());
        assertEquals(1, summary.warnings());
        assertEquals(3, summary.deductions());
        assertTrue(summary.disqualified());
        assertEquals(3, policy.getDeductions(Corner.A));
        assertEquals(0, policy.getDeductions(Corner.B));
    }

    @Test
    @DisplayName("Round reset clears only the per-round count")
    void resetRound() {
        Fighter attacker = dirty(0, Map.of());
        policy.executeFoul(Corner.B, FoulType.PUSH, attacker, HAWK);
        policy.executeFoul(Corner.B, FoulType.PUSH, attacker, HAWK);
        assertEquals(2, policy.getFoulsThisRound(Corner.B));

        policy.resetRound();
        assertEquals(0, policy.getFoulsThisRound(Corner.B));
        assertEquals(2, policy.getFoulSummary(Corner.B).committed());
    }

    // ==================== Effects ====================

    @Test
    @DisplayName("Foul damage stays within the foul's range")
    void damageRange() {
        Fighter attacker = dirty(0, Map.of());
        for (int i = 0; i < 200; i++) {
            FoulResult r = policy.executeFoul(Corner.A, FoulType.ELBOW, attacker, HAWK);
            assertTrue(r.damage() >= FoulType.ELBOW.getMinDamage() && r.damage() <= FoulType.ELBOW.getMaxDamage());
        }
    }

    @Test
    @DisplayName("Low blows drain the target; holding rests the attacker")
    void staminaEffects() {
        Fighter attacker = dirty(0, Map.of());
        Fighter target = new Fighter("Target", null);
        attacker.setStamina(50);

        policy.applyFoulEffects(new FoulResult(Corner.A, FoulType.LOW_BLOW, 0, null, true, false,
            FoulConsequence.WARNING, 1, 0), attacker, target, 3);
        assertEquals(target.getMaxStamina() - FoulType.LOW_BLOW.getStaminaDrain(), target.getStamina(), 1e-9);

        policy.applyFoulEffects(new FoulResult(Corner.A, FoulType.HOLDING, 0, null, false, false,
            FoulConsequence.NONE, 0, 0), attacker, target, 3);
        assertEquals(50 + FoulType.HOLDING.getStaminaRecovery(), attacker.getStamina(), 1e-9);
    }

    @Test
    @DisplayName("A headbutt cut opens on the target")
    void cutFromFoul() {
        Fighter target = new Fighter("Target", null);
        Cut cut = policy.applyFoulEffects(new FoulResult(Corner.A, FoulType.HEADBUTT, 4, CutLocation.RIGHT_EYEBROW,
            true, false, FoulConsequence.WARNING, 1, 0), dirty(0, Map.of()), target, 2);

        assertNotNull(cut);
        assertEquals(1, target.getCuts().size());
        assertEquals(4, target.getHeadDamage(), 1e-9);
    }
}

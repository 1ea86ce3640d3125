package com.example.ringside;

import com.example.ringside.engine.StoppageDecision;
import com.example.ringside.engine.StoppageEvaluator;
import com.example.ringside.fight.*;
import com.example.ringside.model.*;
import com.example.ringside.official.Referee;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Stoppage Evaluator Tests")
class StoppageEvaluatorTest {

    private final StoppageEvaluator evaluator = new StoppageEvaluator(null, new Random(5));

    private static Fight fight(FightRules rules, Referee referee) {
        return new Fight(new Fighter("Red Fighter", null), new Fighter("Blue Fighter", null),
            new FightConfig(6, rules), referee, null, null);
    }

    private static Fight fight() {
        return fight(FightRules.standard(), null);
    }

    private static void floor(Fighter f, int times) {
        for (int i = 0; i < times; i++) {
            f.knockDown(false);
            f.getUp();
        }
    }

    // ==================== Certain Stoppages ====================

    @Test
    @DisplayName("A fresh fighter is never stopped")
    void freshFighter() {
        Fight fight = fight();
        StoppageDecision d = evaluator.evaluate(fight.getFighter(Corner.A), fight.getFighter(Corner.B), fight);
        assertFalse(d.stop());
        assertEquals(0, d.probability(), 1e-9);
        assertEquals(FightMethod.TKO_REFEREE, d.method());
    }

    @Test
    @DisplayName("Three knockdowns in a round end it when the rule is on")
    void threeKnockdowns() {
        Fight fight = fight(FightRules.standard().withThreeKnockdownRule(true), null);
        Fighter a = fight.getFighter(Corner.A);
        floor(a, 3);
        StoppageDecision d = evaluator.evaluate(a, fight.getFighter(Corner.B), fight);
        assertTrue(d.stop());
        assertEquals(FightMethod.TKO_THREE_KNOCKDOWNS, d.method());
        assertEquals(1.0, d.probability(), 1e-9);
    }

    @Test
    @DisplayName("An empty tank and a hurt fighter is stopped")
    void exhaustedAndHurt() {
        Fight fight = fight();
        Fighter a = fight.getFighter(Corner.A);
        a.setStamina(0);
        a.setHurt(4);
        StoppageDecision d = evaluator.evaluate(a, fight.getFighter(Corner.B), fight);
        assertTrue(d.stop());
        assertEquals("exhaustion_and_damage", d.reason());
    }

    @Test
    @DisplayName("Maxed head damage after a knockdown is stopped")
    void maxedHeadDamage() {
        Fight fight = fight();
        Fighter a = fight.getFighter(Corner.A);
        floor(a, 1);
        a.takeDamage(a.getMaxHeadDamage(), HitLocation.HEAD);
        StoppageDecision d = evaluator.evaluate(a, fight.getFighter(Corner.B), fight);
        assertTrue(d.stop());
        assertEquals("damage", d.reason());
    }

    @Test
    @DisplayName("Maxed body damage after a knockdown is stopped")
    void maxedBodyDamage() {
        Fight fight = fight();
        Fighter a = fight.getFighter(Corner.A);
        floor(a, 1);
        a.takeDamage(a.getMaxBodyDamage(), HitLocation.BODY);
        StoppageDecision d = evaluator.evaluate(a, fight.getFighter(Corner.B), fight);
        assertTrue(d.stop());
        assertEquals("body_damage", d.reason());
    }

    // ==================== Probability ====================

    @Test
    @DisplayName("A bad cut makes it a doctor's call")
    void badCutIsDoctorStoppage() {
        Fight fight = fight();
        Fighter a = fight.getFighter(Corner.A);
        for (int i = 0; i < 3; i++) a.addCut(CutLocation.NOSE, 1);
        StoppageDecision d = evaluator.evaluate(a, fight.getFighter(Corner.B), fight);
        assertEquals(FightMethod.TKO_DOCTOR, d.method());
        assertTrue(d.probability() > 0);
    }

    @Test
    @DisplayName("A protective referee scales the same trouble higher")
    void protectivenessScalesProbability() {
        double protective = probabilityFor(Referee.protective());
        double lenient = probabilityFor(Referee.lenient());
        assertTrue(protective > lenient);
        assertEquals(Referee.protective().getTendencies().protectiveness()
            / Referee.lenient().getTendencies().protectiveness(), protective / lenient, 1e-9);
    }

    private double probabilityFor(Referee referee) {
        Fight fight = fight(FightRules.standard(), referee);
        Fighter a = fight.getFighter(Corner.A);
        floor(a, 2);
        a.setHurt(4);
        return evaluator.evaluate(a, fight.getFighter(Corner.B), fight).probability();
    }

    // ==================== Sustained Hurt ====================

    @Test
    @DisplayName("A long hurt spell on a battered round pushes toward a stoppage")
    void sustainedHurt() {
        Fight fight = fight();
        Fighter a = fight.getFighter(Corner.A);
        Fighter b = fight.getFighter(Corner.B);
        a.getRoundStats().recordDamageReceived(35);

        a.setHurt(6);
        assertEquals(0, evaluator.evaluate(a, b, fight).probability(), 1e-9);

        for (int i = 0; i < 24; i++) {
            if (i % 8 == 0) a.setHurt(6);
            a.updateStun(0.5);
        }
        assertTrue(a.getHurtElapsed() > 10);

        StoppageDecision d = evaluator.evaluate(a, b, fight);
        assertEquals(0.15 * Referee.standard().getTendencies().protectiveness(), d.probability(), 1e-9);
        assertFalse(d.stop());
    }

    // ==================== Finisher ====================

    @Test
    @DisplayName("Finisher rating weighs knockout power over killer instinct")
    void finisherRating() {
        Fighter opp = new Fighter("Closer", Map.of(Attribute.KNOCKOUT_POWER, 90, Attribute.KILLER_INSTINCT, 80));
        assertEquals(90 * 0.6 + 80 * 0.4, evaluator.finisherRating(opp), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({
        "50,  0.0",
        "70,  0.0",
        "80,  0.1",
        "88,  0.18",
        "100, 0.8"
    })
    @DisplayName("Finisher bonus is flat, then linear, then steep for elite finishers")
    void finisherBonus(double rating, double expected) {
        assertEquals(expected, evaluator.finisherBonus(rating), 1e-9);
    }
}

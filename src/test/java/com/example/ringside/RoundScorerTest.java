package com.example.ringside;

import com.example.ringside.fight.*;
import com.example.ringside.model.Corner;
import com.example.ringside.model.HitLocation;
import com.example.ringside.model.PunchQuality;
import com.example.ringside.model.PunchType;
import com.example.ringside.util.ModelParameters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RoundScorer Tests")
class RoundScorerTest {

    private RoundScorer scorer;
    private Judge steady;
    private Random rng;

    @BeforeEach
    void setUp() {
        scorer = new RoundScorer(ModelParameters.empty());
        steady = new Judge("Steady", "balanced", JudgePreferences.neutral(), 100);
        rng = new Random(42);
    }

    private static Round dominatedBy(Corner corner) {
        Round round = new Round(1, 180);
        for (int i = 0; i < 20; i++) {
            round.recordPunchThrown(corner, PunchType.CROSS);
            round.recordPunchLanded(corner, PunchType.CROSS, HitLocation.HEAD, PunchQuality.CLEAN, 8, false);
        }
        return round;
    }

    private static void knockdown(Round round, Corner fighter) {
        round.recordKnockdown(new KnockdownRecord(fighter, round.getNumber(), round.getCurrentTime(), PunchType.REAR_HOOK, 8, false));
    }

    // ==================== Base scores ====================

    @Test
    @DisplayName("An empty round is scored even")
    void emptyRoundIsEven() {
        RoundScore score = scorer.calculateJudgeScore(steady, new Round(1, 180), null, rng);
        assertEquals(10, score.scoreA());
        assertEquals(10, score.scoreB());
        assertNull(score.winner());
    }

    @Test
    @DisplayName("A clear round goes 10-9 to the busier, harder puncher")
    void clearRound() {
        RoundScore score = scorer.calculateJudgeScore(steady, dominatedBy(Corner.B), null, rng);
        assertEquals(9, score.scoreA());
        assertEquals(10, score.scoreB());
        assertEquals(Corner.B, score.winner());
    }

    @Test
    @DisplayName("A perfectly consistent judge never miscalls a moderate round")
    void consistentJudgeCallsModerateRound() {
        Round round = new Round(1, 180);
        round.recordCenterControl(Corner.A, 30);
        for (int i = 0; i < 50; i++) {
            RoundScore score = scorer.calculateJudgeScore(steady, round, null, rng);
            assertEquals(10, score.scoreA());
            assertEquals(9, score.scoreB());
        }
    }

    @Test
    @DisplayName("An erratic judge miscalls moderate rounds some of the time")
    void erraticJudgeMiscalls() {
        Judge erratic = new Judge("Erratic", "balanced", JudgePreferences.neutral(), 0);
        Round round = new Round(1, 180);
        round.recordCenterControl(Corner.A, 30);

        int wrong = 0;
        for (int i = 0; i < 500; i++) {
            if (scorer.calculateJudgeScore(erratic, round, null, rng).winner() == Corner.B) wrong++;
        }
        assertTrue(wrong > 125 && wrong < 275, "miscalls: " + wrong);
    }

    @Test
    @DisplayName("Home bias inflates the home fighter's total")
    void homeBias() {
        Judge homer = new Judge("Homer", "balanced", JudgePreferences.neutral(), 90, 1.0, 50);
        Round round = new Round(1, 180);
        round.recordCenterControl(Corner.A, 30);

        double neutral = scorer.calculateTotal(homer, round, Corner.A, null);
        double atHome = scorer.calculateTotal(homer, round, Corner.A, Corner.A);
        assertEquals(neutral * 1.5, atHome, 1e-9);
    }

    // ==================== Knockdowns and deductions ====================

    @Test
    @DisplayName("A knockdown against the round winner hands the round over")
    void knockdownFlipsRound() {
        Round round = dominatedBy(Corner.A);
        knockdown(round, Corner.A);
        RoundScore score = scorer.calculateJudgeScore(steady, round, null, rng);
        assertEquals(9, score.scoreA());
        assertEquals(10, score.scoreB());
    }

    @Test
    @DisplayName("A knockdown against the round loser makes it 10-8")
    void knockdownWidensRound() {
        Round round = dominatedBy(Corner.A);
        knockdown(round, Corner.B);
        RoundScore score = scorer.calculateJudgeScore(steady, round, null, rng);
        assertEquals(10, score.scoreA());
        assertEquals(8, score.scoreB());
    }

    @Test
    @DisplayName("Point deductions come off before the floor")
    void pointDeductions() {
        Round round = dominatedBy(Corner.A);
        round.recordPointDeduction(Corner.A, "Low Blow");
        RoundScore score = scorer.calculateJudgeScore(steady, round, null, rng);
        assertEquals(9, score.scoreA());
        assertEquals(9, score.scoreB());
    }

    @Test
    @DisplayName("No score drops below seven")
    void scoreFloor() {
        Round round = dominatedBy(Corner.A);
        for (int i = 0; i < 4; i++) knockdown(round, Corner.B);
        round.recordPointDeduction(Corner.B, "Headbutt");
        round.recordPointDeduction(Corner.B, "Headbutt");
        RoundScore score = scorer.calculateJudgeScore(steady, round, null, rng);
        assertEquals(7, score.scoreB());
    }

    // ==================== Round ledger rules ====================

    @Test
    @DisplayName("A round can be scored once, and only after it is complete")
    void scoredExactlyOnce() {
        Round round = new Round(1, 180);
        List<RoundScore> scores = List.of(scorer.calculateJudgeScore(steady, round, null, rng));

        assertThrows(IllegalStateException.class, () -> round.setScores(scores));
        round.finish();
        round.setScores(scores);
        assertTrue(round.isScored());
        assertThrows(IllegalStateException.class, () -> round.setScores(scores));
    }

    @Test
    @DisplayName("A completed round rejects further recording")
    void completedRoundIsFrozen() {
        Round round = new Round(1, 1);
        assertFalse(round.tick(0.5));
        assertTrue(round.tick(0.5));
        assertThrows(IllegalStateException.class, () -> round.recordPunchThrown(Corner.A, PunchType.JAB));
    }

    @Test
    @DisplayName("Stats are handed out as copies")
    void statsAreCopies() {
        Round round = new Round(1, 180);
        round.getStats(Corner.A).recordPunchThrown(PunchType.JAB);
        assertEquals(0, round.getStats(Corner.A).getPunchesThrown());
    }
}

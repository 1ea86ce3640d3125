package com.example.ringside;

import com.example.ringside.effect.EffectType;
import com.example.ringside.effect.FightEffect;
import com.example.ringside.engine.CombatResolution;
import com.example.ringside.engine.CombatResolver;
import com.example.ringside.engine.DamageCalculator;
import com.example.ringside.engine.FightSimulator;
import com.example.ringside.engine.PunchOutcome;
import com.example.ringside.event.BuzzedEvent;
import com.example.ringside.event.EventType;
import com.example.ringside.event.FightEvent;
import com.example.ringside.fight.*;
import com.example.ringside.model.Attribute;
import com.example.ringside.model.Corner;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.ModifierTarget;
import com.example.ringside.model.PunchQuality;
import com.example.ringside.model.PunchType;
import com.example.ringside.sim.ReferenceSimulation;
import com.example.ringside.util.ModelParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FightSimulator Tests")
class FightSimulatorTest {

    private static Fight quietFight(int rounds) {
        FightConfig config = new FightConfig(rounds, 10, 0, 0.5, FightRules.standard(), null, 70);
        return new Fight(new Fighter("Red Fighter", null), new Fighter("Blue Fighter", null), config);
    }

    private static Fight realFight(int rounds) {
        Fighter a = new Fighter("Red Slugger", Map.of(Attribute.KNOCKOUT_POWER, 88, Attribute.WORK_RATE, 80));
        Fighter b = new Fighter("Blue Boxer", Map.of(Attribute.HEAD_MOVEMENT, 82, Attribute.JAB_ACCURACY, 80));
        return new Fight(a, b, new FightConfig(rounds, 60, 20, 0.5, FightRules.standard(), null, 70));
    }

    private static List<EventType> types(List<FightEvent> events) {
        List<EventType> out = new ArrayList<>();
        for (FightEvent e : events) out.add(e.type());
        return out;
    }

    // ==================== No-op Collaborators ====================

    @Test
    @DisplayName("With nothing happening the fight goes the distance as a unanimous draw")
    void quietFightIsDraw() {
        Fight fight = quietFight(2);
        FightResult result = new FightSimulator(fight, new Random(1)).runToCompletion();

        assertEquals(FightStatus.COMPLETED, fight.getStatus());
        assertEquals(FightMethod.DRAW_UNANIMOUS, result.method());
        assertNull(result.winner());
        assertEquals(2, result.round());
        assertEquals(3, result.scorecards().size());
    }

    @Test
    @DisplayName("The first step opens the fight and round one")
    void firstStep() {
        FightSimulator sim = new FightSimulator(quietFight(1), new Random(1));
        List<EventType> seen = types(sim.step());
        assertEquals(EventType.FIGHT_START, seen.get(0));
        assertEquals(EventType.ROUND_START, seen.get(seen.size() - 1));
        assertEquals(FightStatus.IN_PROGRESS, sim.getFight().getStatus());
    }

    @Test
    @DisplayName("Each tick reports a tick event and the bell ends the round")
    void ticksAndBell() {
        FightSimulator sim = new FightSimulator(quietFight(2), new Random(1));
        sim.step();
        int ticks = 0;
        boolean roundEnded = false;
        while (!roundEnded) {
            List<EventType> seen = types(sim.step());
            if (seen.contains(EventType.TICK)) ticks++;
            roundEnded = seen.contains(EventType.ROUND_END);
        }
        assertEquals(19, ticks);
        assertEquals(FightStatus.BETWEEN_ROUNDS, sim.getFight().getStatus());

        List<EventType> rest = types(sim.step());
        assertEquals(List.of(EventType.ROUND_START), rest);
        assertEquals(2, sim.getFight().getCurrentRoundNumber());
    }

    @Test
    @DisplayName("The end is reported once and stepping afterwards does nothing")
    void endReportedOnce() {
        FightSimulator sim = new FightSimulator(quietFight(1), new Random(1));
        List<FightEvent> all = new ArrayList<>();
        sim.addListener(all::add);
        sim.runToCompletion();

        long ends = all.stream().filter(e -> e.type() == EventType.FIGHT_END).count();
        assertEquals(1, ends);
        assertEquals(EventType.FIGHT_END, all.get(all.size() - 1).type());
        assertEquals(EventType.FIGHT_ENDING, all.get(all.size() - 2).type());

        assertTrue(sim.step().isEmpty());
        assertTrue(sim.step().isEmpty());
        assertEquals(1, all.stream().filter(e -> e.type() == EventType.FIGHT_END).count());
    }

    @Test
    @DisplayName("A failing listener does not stop the fight or the other listeners")
    void failingListenerIsIsolated() {
        FightSimulator sim = new FightSimulator(quietFight(1), new Random(1));
        List<FightEvent> seen = new ArrayList<>();
        sim.addListener(e -> { throw new IllegalStateException("broken listener"); });
        sim.addListener(seen::add);

        FightResult result = sim.runToCompletion();
        assertNotNull(result);
        assertFalse(seen.isEmpty());
    }

    // ==================== Fight-long Effects ====================

    @Test
    @DisplayName("Fast start fades through round four and is gone from round five")
    void fastStartLastsFourRounds() {
        Fighter starter = new Fighter("Fast Starter", Map.of(Attribute.FIRST_STEP, 100, Attribute.KILLER_INSTINCT, 100));
        FightConfig config = new FightConfig(6, 180, 0, 0.5, FightRules.standard(), null, 70);
        FightSimulator sim = new FightSimulator(new Fight(starter, new Fighter("Blue Fighter", null), config),
            new Random(4));

        Map<Integer, Double> firstStepAtRoundStart = new TreeMap<>();
        while (!sim.getFight().isOver()) {
            List<FightEvent> events = sim.step();
            if (types(events).contains(EventType.ROUND_START)) {
                FightEffect fs = sim.getEffects().getEffect(Corner.A, EffectType.FAST_START);
                firstStepAtRoundStart.put(sim.getFight().getCurrentRound().getNumber(),
                    fs == null ? 0.0 : fs.getModifier(ModifierTarget.FIRST_STEP));
            }
        }

        assertEquals(6, firstStepAtRoundStart.size());
        for (int round = 1; round <= 4; round++) {
            assertTrue(firstStepAtRoundStart.get(round) > 0, "round " + round + ": " + firstStepAtRoundStart);
        }
        assertTrue(firstStepAtRoundStart.get(1) > firstStepAtRoundStart.get(2));
        assertTrue(firstStepAtRoundStart.get(3) > firstStepAtRoundStart.get(4));
        assertEquals(0.0, firstStepAtRoundStart.get(5));
        assertEquals(0.0, firstStepAtRoundStart.get(6));
    }

    @Test
    @DisplayName("A buzzed fighter caught clean on the head again gets worse")
    void buzzCompoundsWhenReHit() {
        Fighter glassy = new Fighter("Glass Jaw", Map.of(Attribute.CHIN, 40));
        Fight fight = new Fight(new Fighter("Red Fighter", null), glassy,
            new FightConfig(1, 60, 0, 0.5, FightRules.standard(), null, 70));
        CombatResolver jabEveryTick = (fa, fb, da, db, f) -> new CombatResolution(
            List.of(PunchOutcome.landed(Corner.A, PunchType.JAB, 4, PunchQuality.CLEAN, false)),
            null, null, null, null, null);
        DamageCalculator flatFour = new DamageCalculator() {
            @Override
            public double calculateDamage(PunchOutcome hit, Fighter attacker, Fighter target) {
                return 4;
            }

            @Override
            public boolean checkHurt(Fighter target, double damage) {
                return false;
            }
        };
        FightSimulator sim = new FightSimulator(fight, new Random(2), null, null, jabEveryTick, flatFour, null, null);

        List<BuzzedEvent> buzzes = new ArrayList<>();
        sim.addListener(e -> {
            if (e instanceof BuzzedEvent) buzzes.add((BuzzedEvent) e);
        });
        sim.step();
        sim.step();
        sim.step();

        assertEquals(2, buzzes.size());
        assertEquals(2, buzzes.get(0).severity());
        assertEquals(3, buzzes.get(1).severity());
        assertTrue(glassy.isBuzzed());
        assertEquals(3, glassy.getBuzzedSeverity());
    }

    // ==================== Reference Collaborators ====================

    @ParameterizedTest
    @ValueSource(longs = {1, 7, 42, 1234})
    @DisplayName("Fighter state stays consistent through a full simulated fight")
    void invariantsHold(long seed) {
        Fight fight = realFight(4);
        FightSimulator sim = ReferenceSimulation.create(fight, new Random(seed), ModelParameters.loadDefault());
        Map<Corner, Integer> knockdowns = new EnumMap<>(Corner.class);
        knockdowns.put(Corner.A, 0);
        knockdowns.put(Corner.B, 0);

        int guard = 0;
        while (!fight.isOver() && guard++ < 20000) {
            sim.step();
            for (Corner c : Corner.values()) {
                Fighter f = fight.getFighter(c);
                assertTrue(f.getStamina() >= 0 && f.getStamina() <= f.getMaxStamina(), "stamina " + f.getStamina());
                assertTrue(f.getHeadDamage() >= 0 && f.getHeadDamage() <= f.getMaxHeadDamage());
                assertTrue(f.getBodyDamage() >= 0 && f.getBodyDamage() <= f.getMaxBodyDamage());
                assertFalse(f.isHurt() && f.isBuzzed(), "hurt and buzzed at once");
                assertTrue(f.getKnockdownsTotal() >= knockdowns.get(c));
                knockdowns.put(c, f.getKnockdownsTotal());
                if (f.getSubState() != null) {
                    assertTrue(f.getSubState().isValidFor(f.getState()));
                }
            }
        }

        assertTrue(fight.isOver());
        FightResult result = fight.getResult();
        assertNotNull(result);
        if (result.method().isKnockout()) {
            assertNotNull(result.winner());
        }
        assertTrue(sim.step().isEmpty());
    }

    @Test
    @DisplayName("The same seed replays the same fight")
    void sameSeedSameFight() {
        Fight first = realFight(3);
        Fight second = realFight(3);
        List<EventType> firstEvents = new ArrayList<>();
        List<EventType> secondEvents = new ArrayList<>();

        FightSimulator one = ReferenceSimulation.create(first, 99L);
        one.addListener(e -> firstEvents.add(e.type()));
        FightResult a = one.runToCompletion();

        FightSimulator two = ReferenceSimulation.create(second, 99L);
        two.addListener(e -> secondEvents.add(e.type()));
        FightResult b = two.runToCompletion();

        assertEquals(a.method(), b.method());
        assertEquals(a.winner(), b.winner());
        assertEquals(a.round(), b.round());
        assertEquals(a.time(), b.time(), 1e-9);
        assertEquals(firstEvents, secondEvents);
        assertEquals(first.getFighter(Corner.A).getHeadDamage(), second.getFighter(Corner.A).getHeadDamage(), 1e-9);
    }

    @Test
    @DisplayName("A simulated fight actually throws and lands punches")
    void punchesAreThrown() {
        Fight fight = realFight(2);
        ReferenceSimulation.create(fight, 5L).runToCompletion();
        int thrown = 0;
        int landed = 0;
        for (Corner c : Corner.values()) {
            thrown += fight.getFighter(c).getFightStats().getPunchesThrown();
            landed += fight.getFighter(c).getFightStats().getPunchesLanded();
        }
        assertTrue(thrown > 0);
        assertTrue(landed > 0);
        assertTrue(landed <= thrown);
    }
}

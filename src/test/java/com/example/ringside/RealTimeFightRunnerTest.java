package com.example.ringside;

import com.example.ringside.engine.FightSimulator;
import com.example.ringside.engine.Pacer;
import com.example.ringside.engine.RealTimeFightRunner;
import com.example.ringside.fight.*;
import com.example.ringside.model.Fighter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RealTimeFightRunner Tests")
class RealTimeFightRunnerTest {

    private static FightSimulator simulator() {
        FightConfig config = new FightConfig(2, 10, 5, 0.5, FightRules.standard(), null, 70);
        Fight fight = new Fight(new Fighter("Red Fighter", null), new Fighter("Blue Fighter", null), config);
        return new FightSimulator(fight, new Random(2));
    }

    @Test
    @DisplayName("Without pacing a real-time run finishes like a batch run")
    void runsToCompletion() throws Exception {
        RealTimeFightRunner runner = new RealTimeFightRunner(simulator(), Pacer.NONE, 1.0);
        Future<FightResult> future = runner.start();
        FightResult result = future.get(10, TimeUnit.SECONDS);
        assertNotNull(result);
        assertEquals(FightMethod.DRAW_UNANIMOUS, result.method());
        assertFalse(runner.isRunning());
    }

    @Test
    @DisplayName("Delays are scaled by the speed multiplier")
    void delaysAreScaled() {
        List<Long> delays = Collections.synchronizedList(new ArrayList<>());
        RealTimeFightRunner runner = new RealTimeFightRunner(simulator(), delays::add, 2.0);
        assertNotNull(runner.run());

        assertEquals(1500L, delays.get(0));
        assertEquals(250L, delays.get(1));
        assertTrue(delays.contains(2500L), "rest period " + delays);
    }

    @Test
    @DisplayName("A stopped runner returns without a result")
    void stopBeforeRun() {
        FightSimulator sim = simulator();
        RealTimeFightRunner runner = new RealTimeFightRunner(sim, Pacer.NONE, 1.0);
        runner.stop();
        runner.stop();
        assertNull(runner.run());
        assertTrue(runner.isStopped());
        assertEquals(FightStatus.NOT_STARTED, sim.getFight().getStatus());
    }

    @Test
    @DisplayName("Pausing holds the fight until it is resumed")
    void pauseAndResume() throws Exception {
        FightSimulator sim = simulator();
        RealTimeFightRunner runner = new RealTimeFightRunner(sim, Pacer.NONE, 1.0);
        runner.pause();
        Future<FightResult> future = runner.start();

        Thread.sleep(100);
        assertTrue(runner.isPaused());
        assertEquals(FightStatus.NOT_STARTED, sim.getFight().getStatus());

        runner.resume();
        assertNotNull(future.get(10, TimeUnit.SECONDS));
        assertTrue(sim.getFight().isOver());
    }

    @Test
    @DisplayName("A runner is used once and needs a positive speed")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new RealTimeFightRunner(simulator(), Pacer.NONE, 0));
        assertThrows(IllegalArgumentException.class, () -> new RealTimeFightRunner(null));

        RealTimeFightRunner runner = new RealTimeFightRunner(simulator(), Pacer.NONE, 1.0);
        runner.run();
        assertThrows(IllegalStateException.class, runner::start);
    }
}

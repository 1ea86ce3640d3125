package com.example.ringside.engine;

import com.example.ringside.event.EventType;
import com.example.ringside.event.FightEvent;
import com.example.ringside.fight.Fight;
import com.example.ringside.fight.FightResult;
import com.example.ringside.fight.FightStatus;
import com.example.ringside.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Future;

/**
 * Plays a fight out in real time on its own thread by wrapping
 * {@link FightSimulator#step()} with delays: an intro pause, one tick length per
 * step (divided by the speed multiplier), the referee's count cadence during
 * knockdowns and the rest period between rounds. Counts run at full length
 * whatever the speed.
 *
 * Pausing holds the loop between steps without touching fight state; stopping
 * ends it at the next step boundary.
 */
public class RealTimeFightRunner {

    private static final Logger logger = LoggerFactory.getLogger(RealTimeFightRunner.class);

    static final long INTRO_PAUSE_MS = 3000;
    private static final String TASK_NAME = "fight";

    private final FightSimulator simulator;
    private final Pacer pacer;
    private final double speedMultiplier;
    private final TickService tickService = new TickService("ringside-fight");
    private final Object pauseLock = new Object();

    private volatile boolean paused;
    private volatile boolean stopped;
    private volatile boolean running;

    public RealTimeFightRunner(FightSimulator simulator, Pacer pacer, double speedMultiplier) {
        if (simulator == null) throw new IllegalArgumentException("simulator is required");
        if (!(speedMultiplier > 0)) {
            throw new IllegalArgumentException("speedMultiplier must be positive, got " + speedMultiplier);
        }
        this.simulator = simulator;
        this.pacer = pacer == null ? Pacer.SLEEP : pacer;
        this.speedMultiplier = speedMultiplier;
    }

    public RealTimeFightRunner(FightSimulator simulator) {
        this(simulator, Pacer.SLEEP, 1.0);
    }

    /**
     * Start the loop on the fight thread.
     * @return completes with the result, or null if the run was stopped first
     */
    public Future<FightResult> start() {
        if (tickService.isShutdown()) {
            throw new IllegalStateException("Runner has already been used");
        }
        return tickService.submit(TASK_NAME, this::run);
    }

    /**
     * Run the loop on the calling thread.
     * @return the result, or null if stopped before the fight ended
     */
    public FightResult run() {
        Fight fight = simulator.getFight();
        running = true;
        try {
            pacer.delay(scaled(INTRO_PAUSE_MS));
            while (!stopped && !fight.isOver()) {
                if (paused) {
                    waitWhilePaused();
                    continue;
                }
                if (fight.getStatus() == FightStatus.BETWEEN_ROUNDS) {
                    pacer.delay(scaled(fight.getConfig().restDuration * 1000));
                    if (stopped) break;
                }
                List<FightEvent> events = simulator.step();
                for (FightEvent event : events) {
                    if (event.type() == EventType.COUNT) {
                        pacer.delay(Math.round(fight.getReferee().getTendencies().countSpeed() * 1000));
                    }
                }
                pacer.delay(scaled(fight.getConfig().tickRate * 1000));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("[RealTimeFightRunner] Interrupted in round {}", fight.getCurrentRoundNumber());
        } catch (RuntimeException e) {
            logger.error("[RealTimeFightRunner] Fight loop failed in round {}", fight.getCurrentRoundNumber(), e);
            stopped = true;
            throw e;
        } finally {
            running = false;
            tickService.shutdown();
        }
        return fight.isOver() ? fight.getResult() : null;
    }

    private long scaled(double millis) {
        return Math.round(millis / speedMultiplier);
    }

    private void waitWhilePaused() throws InterruptedException {
        synchronized (pauseLock) {
            while (paused && !stopped) {
                pauseLock.wait();
            }
        }
    }

    public void pause() {
        paused = true;
    }

    public void resume() {
        synchronized (pauseLock) {
            paused = false;
            pauseLock.notifyAll();
        }
    }

    /** Safe from any thread, any number of times. */
    public void stop() {
        synchronized (pauseLock) {
            stopped = true;
            pauseLock.notifyAll();
        }
    }

    public boolean isPaused() { return paused; }
    public boolean isStopped() { return stopped; }
    public boolean isRunning() { return running; }
    public double getSpeedMultiplier() { return speedMultiplier; }
}

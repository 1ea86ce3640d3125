package com.example.ringside.fight;

import com.example.ringside.model.Corner;
import com.example.ringside.model.DefenseMove;
import com.example.ringside.model.FighterStats;
import com.example.ringside.model.HitLocation;
import com.example.ringside.model.PunchQuality;
import com.example.ringside.model.PunchType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger for a single round. All recording goes through here so that nothing can
 * touch a round once it is complete; the only write allowed after that is the
 * one-time attachment of the judges' scores.
 */
public class Round {
    private final int number;
    private final double duration;
    private final double significantStrikeDamage;

    private double currentTime;
    private boolean complete;
    private String stoppageReason;
    private Double stoppageTime;

    private final Map<Corner, FighterStats> stats = new EnumMap<>(Corner.class);
    private final Map<Corner, List<KnockdownRecord>> knockdowns = new EnumMap<>(Corner.class);
    private final Map<Corner, Integer> pointDeductions = new EnumMap<>(Corner.class);
    private final List<RoundEvent> events = new ArrayList<>();
    private List<RoundScore> scores;

    public Round(int number, double duration, double significantStrikeDamage) {
        this.number = number;
        this.duration = duration;
        this.significantStrikeDamage = significantStrikeDamage;
        for (Corner c : Corner.values()) {
            stats.put(c, new FighterStats());
            knockdowns.put(c, new ArrayList<>());
            pointDeductions.put(c, 0);
        }
    }

    public Round(int number, double duration) {
        this(number, duration, 6);
    }

    // Timing

    /**
     * Advance the round clock. The round completes when the clock reaches its duration.
     * @return whether the round is now complete
     */
    public boolean tick(double dt) {
        ensureOpen();
        currentTime = Math.min(duration, currentTime + Math.max(0, dt));
        if (currentTime >= duration) {
            complete = true;
        }
        return complete;
    }

    /** End the round early (stoppage, disqualification). */
    public void stop(String reason) {
        if (complete) return;
        stoppageReason = reason;
        stoppageTime = currentTime;
        complete = true;
        events.add(new RoundEvent(currentTime, "STOPPAGE", null, reason));
    }

    /** Close the round at the bell without advancing the clock further. */
    public void finish() {
        complete = true;
    }

    private void ensureOpen() {
        if (complete) {
            throw new IllegalStateException("Round " + number + " is complete and can no longer change");
        }
    }

    // Recording

    public void recordPunchThrown(Corner corner, PunchType type) {
        ensureOpen();
        stats.get(corner).recordPunchThrown(type);
    }

    /**
     * Credit a landed punch to the attacker and the damage to the opponent.
     */
    public void recordPunchLanded(Corner attacker, PunchType type, HitLocation location, PunchQuality quality,
                                  double damage, boolean counter) {
        ensureOpen();
        stats.get(attacker).recordPunchLanded(type, location, quality, damage, counter, significantStrikeDamage);
        stats.get(attacker.opponent()).recordDamageReceived(damage);
    }

    public void recordPunchMissed(Corner attacker) {
        ensureOpen();
        stats.get(attacker).recordPunchMissed();
    }

    public void recordDefense(Corner defender, DefenseMove move) {
        ensureOpen();
        stats.get(defender).recordDefense(move);
    }

    public void recordForwardMovement(Corner corner, double t) {
        ensureOpen();
        stats.get(corner).addForwardMovementTime(t);
    }

    public void recordBackwardMovement(Corner corner, double t) {
        ensureOpen();
        stats.get(corner).addBackwardMovementTime(t);
    }

    public void recordCenterControl(Corner corner, double t) {
        ensureOpen();
        stats.get(corner).addCenterControlTime(t);
    }

    public void recordRopeTime(Corner corner, double t) {
        ensureOpen();
        stats.get(corner).addRopeTime(t);
    }

    public void recordCornerTime(Corner corner, double t) {
        ensureOpen();
        stats.get(corner).addCornerTime(t);
    }

    public void recordClinchTime(double t) {
        ensureOpen();
        for (FighterStats s : stats.values()) s.addClinchTime(t);
    }

    public void recordClinchInitiated(Corner corner) {
        ensureOpen();
        stats.get(corner).recordClinchInitiated();
        events.add(new RoundEvent(currentTime, "CLINCH", corner, null));
    }

    public void recordKnockdown(KnockdownRecord record) {
        ensureOpen();
        knockdowns.get(record.fighter()).add(record);
        stats.get(record.fighter()).recordKnockdownSuffered();
        stats.get(record.fighter().opponent()).recordKnockdownScored();
        events.add(new RoundEvent(currentTime, record.flash() ? "FLASH_KNOCKDOWN" : "KNOCKDOWN",
            record.fighter(), "count " + record.count()));
    }

    public void recordFoul(Corner corner, String foul) {
        ensureOpen();
        stats.get(corner).recordFoul();
        events.add(new RoundEvent(currentTime, "FOUL", corner, foul));
    }

    public void recordPointDeduction(Corner corner, String reason) {
        ensureOpen();
        pointDeductions.merge(corner, 1, Integer::sum);
        stats.get(corner).recordPointDeduction();
        events.add(new RoundEvent(currentTime, "POINT_DEDUCTION", corner, reason));
    }

    public void logEvent(String type, Corner corner, String detail) {
        ensureOpen();
        events.add(new RoundEvent(currentTime, type, corner, detail));
    }

    // Scoring

    /**
     * Attach the judges' scores. Allowed once, after the round is complete.
     */
    public void setScores(List<RoundScore> roundScores) {
        if (!complete) throw new IllegalStateException("Round " + number + " is still in progress");
        if (scores != null) throw new IllegalStateException("Round " + number + " has already been scored");
        scores = List.copyOf(roundScores);
    }

    public boolean isScored() {
        return scores != null;
    }

    public List<RoundScore> getScores() {
        return scores == null ? Collections.emptyList() : scores;
    }

    // Queries

    /** Live ledger for the corner; mutate only through this round. */
    FighterStats ledger(Corner corner) {
        return stats.get(corner);
    }

    /** Copy of the corner's ledger. */
    public FighterStats getStats(Corner corner) {
        return stats.get(corner).copy();
    }

    public List<KnockdownRecord> getKnockdowns(Corner corner) {
        return Collections.unmodifiableList(knockdowns.get(corner));
    }

    public int getKnockdownCount(Corner corner) {
        return knockdowns.get(corner).size();
    }

    public int getPointDeductions(Corner corner) {
        return pointDeductions.get(corner);
    }

    public List<RoundEvent> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public double getAccuracy(Corner corner) {
        return stats.get(corner).getAccuracy();
    }

    public int getNumber() { return number; }
    public double getDuration() { return duration; }
    public double getCurrentTime() { return currentTime; }
    public double getRemainingTime() { return Math.max(0, duration - currentTime); }
    public boolean isComplete() { return complete; }
    public String getStoppageReason() { return stoppageReason; }
    public Double getStoppageTime() { return stoppageTime; }
}

package com.example.ringside.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Statistics ledger for one fighter, used both per round and for the whole fight.
 * Times are in simulated seconds.
 */
public class FighterStats {

    // Punch counts
    private int punchesThrown;
    private int punchesLanded;
    private int punchesMissed;
    private int jabsThrown;
    private int jabsLanded;
    private int powerPunchesThrown;
    private int powerPunchesLanded;
    private int bodyPunchesThrown;
    private int bodyPunchesLanded;
    private int headPunchesThrown;
    private int headPunchesLanded;
    private int cleanPunchesLanded;
    private int partialPunchesLanded;
    private int counterPunchesLanded;
    private int significantStrikesLanded;

    // Damage
    private double damageDealt;
    private double damageReceived;

    // Defense (punches this fighter stopped)
    private int punchesBlocked;
    private int punchesEvaded;
    private final Map<DefenseMove, Integer> defenseBreakdown = new EnumMap<>(DefenseMove.class);

    // Ring position
    private double forwardMovementTime;
    private double backwardMovementTime;
    private double centerControlTime;
    private double ropeTime;
    private double cornerTime;
    private double clinchTime;
    private int clinchesInitiated;

    // Knockdowns and fouls
    private int knockdownsScored;
    private int knockdownsSuffered;
    private int foulsCommitted;
    private int pointsDeducted;

    public void recordPunchThrown(PunchType type) {
        punchesThrown++;
        if (type.isJab()) jabsThrown++; else powerPunchesThrown++;
        if (type.isBodyPunch()) bodyPunchesThrown++; else headPunchesThrown++;
    }

    public void recordPunchLanded(PunchType type, HitLocation location, PunchQuality quality,
                                  double damage, boolean counter, double significantThreshold) {
        punchesLanded++;
        if (type.isJab()) jabsLanded++; else powerPunchesLanded++;
        if (location == HitLocation.BODY) bodyPunchesLanded++; else headPunchesLanded++;
        if (quality == PunchQuality.CLEAN) cleanPunchesLanded++; else partialPunchesLanded++;
        if (counter) counterPunchesLanded++;
        double dmg = Math.max(0, damage);
        damageDealt += dmg;
        if (dmg > significantThreshold) significantStrikesLanded++;
    }

    public void recordDamageReceived(double damage) {
        damageReceived += Math.max(0, damage);
    }

    public void recordPunchMissed() {
        punchesMissed++;
    }

    public void recordDefense(DefenseMove move) {
        if (move == null) return;
        if (move.isEvasion()) punchesEvaded++; else punchesBlocked++;
        defenseBreakdown.merge(move, 1, Integer::sum);
    }

    public void addForwardMovementTime(double t) { forwardMovementTime += Math.max(0, t); }
    public void addBackwardMovementTime(double t) { backwardMovementTime += Math.max(0, t); }
    public void addCenterControlTime(double t) { centerControlTime += Math.max(0, t); }
    public void addRopeTime(double t) { ropeTime += Math.max(0, t); }
    public void addCornerTime(double t) { cornerTime += Math.max(0, t); }
    public void addClinchTime(double t) { clinchTime += Math.max(0, t); }
    public void recordClinchInitiated() { clinchesInitiated++; }
    public void recordKnockdownScored() { knockdownsScored++; }
    public void recordKnockdownSuffered() { knockdownsSuffered++; }
    public void recordFoul() { foulsCommitted++; }
    public void recordPointDeduction() { pointsDeducted++; }

    /**
     * Add another ledger's counts into this one.
     */
    public void accumulate(FighterStats o) {
        punchesThrown += o.punchesThrown;
        punchesLanded += o.punchesLanded;
        punchesMissed += o.punchesMissed;
        jabsThrown += o.jabsThrown;
        jabsLanded += o.jabsLanded;
        powerPunchesThrown += o.powerPunchesThrown;
        powerPunchesLanded += o.powerPunchesLanded;
        bodyPunchesThrown += o.bodyPunchesThrown;
        bodyPunchesLanded += o.bodyPunchesLanded;
        headPunchesThrown += o.headPunchesThrown;
        headPunchesLanded += o.headPunchesLanded;
        cleanPunchesLanded += o.cleanPunchesLanded;
        partialPunchesLanded += o.partialPunchesLanded;
        counterPunchesLanded += o.counterPunchesLanded;
        significantStrikesLanded += o.significantStrikesLanded;
        damageDealt += o.damageDealt;
        damageReceived += o.damageReceived;
        punchesBlocked += o.punchesBlocked;
        punchesEvaded += o.punchesEvaded;
        o.defenseBreakdown.forEach((k, v) -> defenseBreakdown.merge(k, v, Integer::sum));
        forwardMovementTime += o.forwardMovementTime;
        backwardMovementTime += o.backwardMovementTime;
        centerControlTime += o.centerControlTime;
        ropeTime += o.ropeTime;
        cornerTime += o.cornerTime;
        clinchTime += o.clinchTime;
        clinchesInitiated += o.clinchesInitiated;
        knockdownsScored += o.knockdownsScored;
        knockdownsSuffered += o.knockdownsSuffered;
        foulsCommitted += o.foulsCommitted;
        pointsDeducted += o.pointsDeducted;
    }

    public FighterStats copy() {
        FighterStats c = new FighterStats();
        c.accumulate(this);
        return c;
    }

    public double getAccuracy() {
        return punchesThrown == 0 ? 0 : (double) punchesLanded / punchesThrown;
    }

    public double getJabAccuracy() {
        return jabsThrown == 0 ? 0 : (double) jabsLanded / jabsThrown;
    }

    public double getPowerAccuracy() {
        return powerPunchesThrown == 0 ? 0 : (double) powerPunchesLanded / powerPunchesThrown;
    }

    public int getPunchesThrown() { return punchesThrown; }
    public int getPunchesLanded() { return punchesLanded; }
    public int getPunchesMissed() { return punchesMissed; }
    public int getJabsThrown() { return jabsThrown; }
    public int getJabsLanded() { return jabsLanded; }
    public int getPowerPunchesThrown() { return powerPunchesThrown; }
    public int getPowerPunchesLanded() { return powerPunchesLanded; }
    public int getBodyPunchesThrown() { return bodyPunchesThrown; }
    public int getBodyPunchesLanded() { return bodyPunchesLanded; }
    public int getHeadPunchesThrown() { return headPunchesThrown; }
    public int getHeadPunchesLanded() { return headPunchesLanded; }
    public int getCleanPunchesLanded() { return cleanPunchesLanded; }
    public int getPartialPunchesLanded() { return partialPunchesLanded; }
    public int getCounterPunchesLanded() { return counterPunchesLanded; }
    public int getSignificantStrikesLanded() { return significantStrikesLanded; }
    public double getDamageDealt() { return damageDealt; }
    public double getDamageReceived() { return damageReceived; }
    public int getPunchesBlocked() { return punchesBlocked; }
    public int getPunchesEvaded() { return punchesEvaded; }
    public Map<DefenseMove, Integer> getDefenseBreakdown() { return Collections.unmodifiableMap(defenseBreakdown); }
    public double getForwardMovementTime() { return forwardMovementTime; }
    public double getBackwardMovementTime() { return backwardMovementTime; }
    public double getCenterControlTime() { return centerControlTime; }
    public double getRopeTime() { return ropeTime; }
    public double getCornerTime() { return cornerTime; }
    public double getClinchTime() { return clinchTime; }
    public int getClinchesInitiated() { return clinchesInitiated; }
    public int getKnockdownsScored() { return knockdownsScored; }
    public int getKnockdownsSuffered() { return knockdownsSuffered; }
    public int getFoulsCommitted() { return foulsCommitted; }
    public int getPointsDeducted() { return pointsDeducted; }
}

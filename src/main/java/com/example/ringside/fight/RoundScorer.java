package com.example.ringside.fight;

import com.example.ringside.model.Corner;
import com.example.ringside.model.FighterStats;
import com.example.ringside.util.ModelParameters;

import java.util.Random;

/**
 * Scores a round the way a judge would under the ten-point must system.
 *
 * Each fighter gets four criteria totals from the round ledger, weighted by the
 * judge's preferences. The gap between the totals decides the round: clear gaps
 * are always 10-9, moderate gaps can be miscalled by an inconsistent judge, and
 * close rounds are usually even. Knockdowns and point deductions come off after.
 */
public class RoundScorer {

    /** Per-fighter criteria totals before the judge's weights. */
    public record Criteria(double cleanPunching, double aggression, double ringGeneralship, double defense) {
    }

    private final ModelParameters params;

    public RoundScorer(ModelParameters params) {
        this.params = params == null ? ModelParameters.empty() : params;
    }

    private double p(String path, double def) {
        return params.getDouble("scoring." + path, def);
    }

    public Criteria calculateCriteria(FighterStats own, FighterStats opp) {
        double clean = own.getCleanPunchesLanded() * p("cleanPunching.cleanPunch", 0.8)
            + own.getPowerPunchesLanded() * p("cleanPunching.powerPunch", 1.5)
            + own.getJabsLanded() * p("cleanPunching.jab", 0.2)
            + (own.getDamageDealt() / 10.0) * p("cleanPunching.damagePer10", 6)
            + own.getSignificantStrikesLanded() * p("cleanPunching.significantStrike", 3);

        boolean outLanded = own.getPunchesLanded() > opp.getPunchesLanded();
        boolean outDamaged = own.getDamageDealt() > opp.getDamageDealt();

        double aggression = own.getForwardMovementTime() * p("aggression.forwardTimeRate", 0.03) * own.getAccuracy()
            + (outLanded ? p("aggression.outLandedBonus", 2) : 0)
            + (outDamaged ? p("aggression.outDamagedBonus", 18) : 0)
            + own.getDamageDealt() / p("aggression.damageDivisor", 15);

        double backwardRate = outDamaged
            ? p("ringGeneralship.backwardWhileWinning", 0.02)
            : p("ringGeneralship.backwardWhileLosing", 0.08);
        double generalship = own.getCenterControlTime() * p("ringGeneralship.centerControl", 0.2)
            + opp.getRopeTime() * p("ringGeneralship.opponentRopes", 0.25)
            + opp.getCornerTime() * p("ringGeneralship.opponentCorner", 0.4)
            - own.getBackwardMovementTime() * backwardRate
            - own.getRopeTime() * p("ringGeneralship.ownRopes", 0.12)
            - own.getCornerTime() * p("ringGeneralship.ownCorner", 0.2);

        double defense = own.getPunchesBlocked() * p("defense.block", 1)
            + own.getPunchesEvaded() * p("defense.evasion", 2)
            - own.getDamageReceived() / p("defense.damageReceivedDivisor", 20);

        return new Criteria(clean, aggression, generalship, defense);
    }

    /**
     * Weighted total for one corner as this judge sees it, home bias included.
     */
    public double calculateTotal(Judge judge, Round round, Corner corner, Corner homeCorner) {
        FighterStats own = round.ledger(corner);
        FighterStats opp = round.ledger(corner.opponent());
        Criteria c = calculateCriteria(own, opp);
        JudgePreferences pref = judge.getPreferences();

        double total = c.cleanPunching() * pref.cleanPunching() * p("weights.cleanPunching", 1.2)
            + own.getPowerPunchesLanded() * pref.powerShots() * p("weights.powerShots", 2.0)
            + own.getPunchesLanded() * pref.volume() * p("weights.volume", 0.25)
            + c.aggression() * pref.effectiveAggression()
            + Math.max(0, c.ringGeneralship()) * pref.ringGeneralship()
            + Math.max(0, c.defense()) * pref.defense() * p("weights.defense", 0.8);

        if (homeCorner == corner && judge.getHomeBias() != 0) {
            total *= 1 + judge.getHomeBias() / 100.0;
        }
        return total;
    }

    /**
     * Score a completed round for one judge.
     */
    public RoundScore calculateJudgeScore(Judge judge, Round round, Corner homeCorner, Random rng) {
        double totalA = calculateTotal(judge, round, Corner.A, homeCorner);
        double totalB = calculateTotal(judge, round, Corner.B, homeCorner);
        double diff = totalA - totalB;

        int baseA;
        int baseB;
        double abs = Math.abs(diff);
        if (abs > p("thresholds.clearRound", 12)) {
            baseA = diff > 0 ? 10 : 9;
            baseB = diff > 0 ? 9 : 10;
        } else if (abs > p("thresholds.moderateRound", 4)) {
            double wrongChance = Math.min(p("thresholds.wrongCallCap", 0.4), 1 - judge.getConsistency() / 100.0);
            boolean favourA = diff > 0;
            if (rng.nextDouble() < wrongChance) favourA = !favourA;
            baseA = favourA ? 10 : 9;
            baseB = favourA ? 9 : 10;
        } else {
            double close = p("thresholds.closeRound", 1);
            if (rng.nextDouble() < p("thresholds.closeRoundEvenChance", 0.3)) {
                baseA = 10;
                baseB = 10;
            } else if (diff > close) {
                baseA = 10;
                baseB = 9;
            } else if (diff < -close) {
                baseA = 9;
                baseB = 10;
            } else {
                baseA = 10;
                baseB = 10;
            }
        }

        int kdA = round.getKnockdownCount(Corner.A);
        int kdB = round.getKnockdownCount(Corner.B);
        double scoreA = baseA - kdA * judge.getKnockdownWeight();
        double scoreB = baseB - kdB * judge.getKnockdownWeight();

        // A knockdown against the fighter who was winning the round hands it over.
        if (kdA > 0 && kdB == 0 && baseA > baseB) {
            scoreA = Math.min(scoreA, 9);
            scoreB = 10;
        } else if (kdB > 0 && kdA == 0 && baseB > baseA) {
            scoreB = Math.min(scoreB, 9);
            scoreA = 10;
        }

        scoreA -= round.getPointDeductions(Corner.A);
        scoreB -= round.getPointDeductions(Corner.B);

        int floor = params.getInt("scoring.minimumScore", 7);
        int finalA = (int) Math.max(floor, Math.round(scoreA));
        int finalB = (int) Math.max(floor, Math.round(scoreB));
        return new RoundScore(round.getNumber(), judge.getName(), finalA, finalB, totalA, totalB);
    }
}

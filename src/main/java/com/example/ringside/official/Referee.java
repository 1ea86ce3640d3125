package com.example.ringside.official;

import com.example.ringside.model.Fighter;
import com.example.ringside.model.FighterStats;

import java.util.List;
import java.util.Random;

/**
 * The third man in the ring: breaks clinches, examines hurt fighters and calls fouls.
 * Holds the tracking state of the clinch in progress.
 */
public class Referee {

    private final String name;
    private final int experience;
    private final int attentiveness;
    private final int fairness;
    private final int positioning;
    private final int commandPresence;
    private final RefereeTendencies tendencies;

    // Clinch tracking
    private Double clinchBreakTime;
    private boolean clinchWarningIssued;

    public Referee(String name, int experience, int attentiveness, int fairness, int positioning,
                   int commandPresence, RefereeTendencies tendencies) {
        this.name = name == null ? "Referee" : name;
        this.experience = clampAttr(experience);
        this.attentiveness = clampAttr(attentiveness);
        this.fairness = clampAttr(fairness);
        this.positioning = clampAttr(positioning);
        this.commandPresence = clampAttr(commandPresence);
        this.tendencies = tendencies == null ? RefereeTendencies.standard() : tendencies;
    }

    private static int clampAttr(int v) {
        return Math.max(1, Math.min(100, v));
    }

    // ===== Presets =====

    public static Referee standard() {
        return new Referee("Referee", 75, 80, 85, 75, 80, RefereeTendencies.standard());
    }

    public static Referee strict() {
        return new Referee("Strict Referee", 85, 90, 85, 80, 90,
            new RefereeTendencies(2, 1.5, 0.55, 0.6, 1, 0.8, false, 0.9));
    }

    public static Referee lenient() {
        return new Referee("Lenient Referee", 70, 65, 80, 70, 70,
            new RefereeTendencies(4.5, 0.8, 0.75, 0.35, 1.1, 0.3, true, 0.5));
    }

    public static Referee protective() {
        return new Referee("Protective Referee", 80, 85, 85, 80, 80,
            new RefereeTendencies(3, 1, 0.45, 0.8, 1, 0.5, true, 0.7));
    }

    public static Referee preset(String name) {
        if (name == null) return standard();
        switch (name.trim().toLowerCase()) {
            case "strict": return strict();
            case "lenient": return lenient();
            case "protective": return protective();
            default: return standard();
        }
    }

    // ===== Clinch =====

    /**
     * Decide whether to warn or break the clinch. The break time is set once per
     * clinch: the referee's tolerance, halved if either fighter is hurt, stretched a
     * little when both are exhausted, scaled by experience and a random factor, and
     * never beyond {@code maxDuration}.
     */
    public ClinchCall checkClinchBreak(double duration, Fighter fighterA, Fighter fighterB,
                                       double maxDuration, Random rng) {
        if (clinchBreakTime == null) {
            double breakTime = tendencies.clinchTolerance();
            if (fighterA.isHurt() || fighterB.isHurt()) breakTime *= 0.5;
            double avgStamina = (fighterA.getStaminaPercent() + fighterB.getStaminaPercent()) / 2;
            if (avgStamina < 0.3) breakTime *= 1.2;
            breakTime *= 0.8 + experience / 100.0 * 0.4;
            breakTime *= 0.8 + rng.nextDouble() * 0.4;
            clinchBreakTime = Math.min(breakTime, maxDuration);
        }

        if (duration >= clinchBreakTime) {
            return new ClinchCall(ClinchCall.Action.BREAK, 0.3 / Math.max(0.1, tendencies.clinchBreakSpeed()));
        }
        if (!clinchWarningIssued && duration >= clinchBreakTime * 0.7) {
            clinchWarningIssued = true;
            return new ClinchCall(ClinchCall.Action.WARN, 0);
        }
        return ClinchCall.NONE;
    }

    public void resetClinch() {
        clinchBreakTime = null;
        clinchWarningIssued = false;
    }

    // ===== Stoppage =====

    /**
     * Look the fighter over. A fighter clearly ahead on the cards is given the
     * benefit of the doubt; otherwise damage, hurt time, knockdowns, one-way traffic
     * and an empty tank add up against a threshold lowered by protectiveness.
     */
    public StoppageCall checkStoppage(Fighter fighter, Fighter opponent, FightSituation situation) {
        if (situation != null && situation.scoreDiff() > 2) {
            return StoppageCall.noStop(0);
        }

        double score = 0;
        double head = fighter.getHeadDamagePercent();
        if (head > 0.8) score += 0.4;
        else if (head > 0.6) score += 0.2;
        if (fighter.getBodyDamagePercent() > 0.9) score += 0.2;

        if (fighter.isHurt()) {
            score += 0.3;
            if (fighter.getHurtElapsed() > 10) score += 0.3;
            else if (fighter.getHurtElapsed() > 5) score += 0.2;
        }

        if (fighter.getKnockdownsThisRound() >= 2) score += 0.3;
        if (fighter.getKnockdownsTotal() >= 3) score += 0.2;

        FighterStats own = fighter.getRoundStats();
        FighterStats opp = opponent.getRoundStats();
        boolean oneWay = opp.getPunchesLanded() > 20 && own.getPunchesLanded() < 5;
        if (oneWay) score += 0.2;

        if (fighter.getStaminaPercent() < 0.1) score += 0.15;

        double threshold = tendencies.stoppageThreshold() * (1 - tendencies.protectiveness() * 0.3);
        if (score < threshold) {
            return StoppageCall.noStop(score);
        }

        String reason;
        if (fighter.getKnockdownsThisRound() >= 3) reason = StoppageCall.THREE_KNOCKDOWNS;
        else if (oneWay && fighter.isHurt()) reason = StoppageCall.NOT_DEFENDING;
        else if (head > 0.8) reason = StoppageCall.ACCUMULATED_DAMAGE;
        else reason = StoppageCall.REFEREE_STOPPAGE;
        return new StoppageCall(true, reason, score);
    }

    // ===== Commands =====

    public String issueCommand(RefereeCommand command, Random rng) {
        List<String> texts = command.getVariations();
        return texts.get(rng.nextInt(texts.size()));
    }

    /** Average of experience, attentiveness, positioning and command presence. */
    public double getSkill() {
        return (experience + attentiveness + positioning + commandPresence) / 4.0;
    }

    public String getName() { return name; }
    public int getExperience() { return experience; }
    public int getAttentiveness() { return attentiveness; }
    public int getFairness() { return fairness; }
    public int getPositioning() { return positioning; }
    public int getCommandPresence() { return commandPresence; }
    public RefereeTendencies getTendencies() { return tendencies; }
    public boolean isClinchWarningIssued() { return clinchWarningIssued; }
}

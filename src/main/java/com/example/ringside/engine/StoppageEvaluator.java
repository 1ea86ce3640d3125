package com.example.ringside.engine;

import com.example.ringside.fight.Fight;
import com.example.ringside.fight.FightMethod;
import com.example.ringside.model.Attribute;
import com.example.ringside.model.Fighter;
import com.example.ringside.util.ModelParameters;

import java.util.Random;

/**
 * Per-tick TKO check. Exhaustion, damage, knockdowns, a long hurt spell under
 * fire, bad cuts and a dangerous finisher across the ring add up to a stop
 * probability. The referee's protectiveness scales it, and the result only
 * counts past a minimum and then as a small random gate, so stoppages stay rare.
 * A few situations stop the fight outright.
 */
public class StoppageEvaluator {

    private final ModelParameters params;
    private final Random rng;

    public StoppageEvaluator(ModelParameters params, Random rng) {
        this.params = params == null ? ModelParameters.empty() : params;
        this.rng = rng;
    }

    private double p(String path, double def) {
        return params.getDouble("stoppage." + path, def);
    }

    public StoppageDecision evaluate(Fighter fighter, Fighter opponent, Fight fight) {
        double probability = 0;
        FightMethod method = FightMethod.TKO_REFEREE;

        double damage = fighter.getHeadDamagePercent();
        double stamina = fighter.getStaminaPercent();
        int kdRound = fighter.getKnockdownsThisRound();
        int kdTotal = fighter.getKnockdownsTotal();

        if (kdRound >= 3 && fight.getConfig().rules.threeKnockdownRule()) {
            return new StoppageDecision(true, FightMethod.TKO_THREE_KNOCKDOWNS, 1.0, "three_knockdowns");
        }

        if (stamina <= 0) {
            if (fighter.isHurt() || damage >= 0.8) {
                return new StoppageDecision(true, method, 1.0, "exhaustion_and_damage");
            }
            probability += 0.35;
        } else if (stamina < 0.15) {
            probability += 0.15;
        }

        if (damage >= 1.0) {
            if (kdTotal > 0 || stamina < 0.15) {
                return new StoppageDecision(true, method, 1.0, "damage");
            }
            probability += 0.2;
        }

        if (fighter.getBodyDamagePercent() >= 1.0 && kdTotal > 0) {
            return new StoppageDecision(true, method, 1.0, "body_damage");
        }

        if (kdRound >= 3) probability += 0.5;
        else if (kdRound == 2) probability += 0.4;

        if (kdTotal >= 4) probability += 0.3;
        else if (kdTotal == 3) probability += 0.2;
        else if (kdTotal == 2) probability += 0.1;

        if (fighter.isHurt() && kdRound >= 1) probability += 0.3;

        if (fighter.isHurt() && fighter.getHurtElapsed() > 10
            && fighter.getRoundStats().getDamageReceived() > 30) {
            probability += 0.15;
        }

        int worstCut = fighter.getWorstCutSeverity();
        if (worstCut >= 3) {
            probability += 0.15;
            method = FightMethod.TKO_DOCTOR;
        }
        if (worstCut >= 4) {
            probability += 0.3;
        }

        if (fighter.isHurt() || kdRound > 0) {
            probability += finisherBonus(finisherRating(opponent));
        }

        probability *= fight.getReferee().getTendencies().protectiveness();

        boolean stop = probability > p("minProbability", 0.5)
            && rng.nextDouble() < probability * p("gateMultiplier", 0.15);
        if (stop) {
            return new StoppageDecision(true, method, probability,
                method == FightMethod.TKO_DOCTOR ? "cut" : "referee_stoppage");
        }
        return StoppageDecision.continueFight(method, probability);
    }

    /**
     * How dangerous the opponent is against a hurt fighter.
     */
    public double finisherRating(Fighter opponent) {
        return opponent.getModifiedAttribute(Attribute.KNOCKOUT_POWER) * p("finisher.knockoutPowerWeight", 0.6)
            + opponent.getModifiedAttribute(Attribute.KILLER_INSTINCT) * p("finisher.killerInstinctWeight", 0.4);
    }

    /**
     * Nothing below the threshold, a linear climb above it, and a steep quadratic
     * climb for elite finishers.
     */
    public double finisherBonus(double rating) {
        double threshold = p("finisher.threshold", 70);
        double elite = p("finisher.eliteThreshold", 88);
        if (rating <= threshold) return 0;
        double bonus = (Math.min(rating, 100) - threshold) / (100 - threshold) * p("finisher.linearBonus", 0.3);
        if (rating > elite) {
            double over = (Math.min(rating, 100) - elite) / (100 - elite);
            bonus += over * over * p("finisher.eliteBonus", 0.5);
        }
        return bonus;
    }
}

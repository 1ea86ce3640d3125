package com.example.ringside.engine;

import com.example.ringside.model.Attribute;
import com.example.ringside.model.Fighter;
import com.example.ringside.util.ModelParameters;

/**
 * Probabilities for a downed fighter: whether a flash knockdown really is one,
 * whether a regular knockdown leaves them out cold, and whether they beat the count.
 *
 * Heart dominates getting up. Chin, experience and composure come second, and
 * accumulated head damage, low stamina and earlier knockdowns all work against.
 */
public class RecoveryModel {

    private final ModelParameters params;

    public RecoveryModel(ModelParameters params) {
        this.params = params == null ? ModelParameters.empty() : params;
    }

    private double p(String path, double def) {
        return params.getDouble("knockdown." + path, def);
    }

    /**
     * Chance that a knockdown requested as a flash ends with the fighter popping
     * straight back up. Evaluated before the knockdown is applied.
     */
    public double flashRecoveryChance(Fighter fighter) {
        int heart = fighter.getAttribute(Attribute.HEART);
        double chance;
        if (heart >= 95) chance = 0.98;
        else if (heart >= 90) chance = 0.92;
        else if (heart >= 85) chance = 0.80;
        else if (heart >= 80) chance = 0.55;
        else if (heart >= 75) chance = 0.35;
        else chance = 0.20;

        int prior = fighter.getKnockdownsTotal();
        if (prior >= 2) chance *= p("flash.priorKnockdownsTwoPlus", 0.5);
        else if (prior == 1) chance *= p("flash.priorKnockdownsOne", 0.75);

        double damage = fighter.getHeadDamagePercent();
        if (damage > 0.5) chance *= 0.6;
        else if (damage > 0.3) chance *= 0.8;
        return chance;
    }

    /** Count at which a confirmed flash knockdown ends, 2 to 4. */
    public int flashRecoveryCount(Fighter fighter) {
        double bonus = (fighter.getAttribute(Attribute.CHIN) + fighter.getAttribute(Attribute.HEART)) / 200.0;
        return (int) Math.max(2, Math.min(4, Math.round(4 - bonus * 2)));
    }

    /**
     * Chance the fighter is out cold and never beats the count. Uses the chin as it
     * stands now, so a gassed fighter's weakened chin counts.
     *
     * @param attacker the fighter who scored the knockdown
     * @param punchDamage damage of the punch that did it
     */
    public double immediateKnockoutChance(Fighter fighter, Fighter attacker, double punchDamage) {
        double koPower = attacker == null ? 70 : attacker.getModifiedAttribute(Attribute.KNOCKOUT_POWER);
        double chance = Math.max(0, (koPower - 60) / 200);

        chance *= 1 - fighter.getModifiedAttribute(Attribute.CHIN) / 150.0;

        if (punchDamage >= 8) chance *= 2.0;
        else if (punchDamage >= 6) chance *= 1.5;

        double damage = fighter.getHeadDamagePercent();
        if (damage > 0.7) chance *= 2.5;
        else if (damage > 0.5) chance *= 1.8;
        else if (damage > 0.3) chance *= 1.3;

        // The current knockdown is already counted.
        int earlierThisRound = Math.max(0, fighter.getKnockdownsThisRound() - 1);
        if (earlierThisRound >= 2) chance *= 2.0;
        else if (earlierThisRound == 1) chance *= 1.4;

        double stamina = fighter.getStaminaPercent();
        if (stamina < 0.2) chance *= 1.8;
        else if (stamina < 0.4) chance *= 1.3;

        chance *= 1 - fighter.getAttribute(Attribute.HEART) / 300.0;
        return Math.max(0, Math.min(p("immediateKO.cap", 0.35), chance));
    }

    /**
     * Chance of getting up on this count.
     */
    public double recoveryChance(Fighter fighter, int count) {
        int heart = fighter.getAttribute(Attribute.HEART);
        double heartFactor;
        if (heart >= 95) heartFactor = 0.95 + (heart - 95) * 0.01;
        else if (heart >= 85) heartFactor = 0.75 + (heart - 85) * 0.02;
        else if (heart >= 75) heartFactor = 0.50 + (heart - 75) * 0.025;
        else heartFactor = 0.30 + (heart - 50) * 0.008;

        double baseFactor = (fighter.getAttribute(Attribute.CHIN)
            + fighter.getAttribute(Attribute.EXPERIENCE)
            + fighter.getAttribute(Attribute.COMPOSURE)) / 300.0;

        double chance = heartFactor * p("recovery.heartWeight", 0.7) + baseFactor * p("recovery.baseWeight", 0.3);

        double damage = fighter.getHeadDamagePercent();
        if (damage > 0.6) chance *= 1 - (damage - 0.6) * 1.5;
        else chance *= 1 - damage * 0.3;

        if (count <= 4) chance *= 1.2;
        else if (count == 7) chance *= 0.9;
        else if (count == 8) chance *= 0.75;
        else if (count >= 9) chance *= 0.5;

        double stamina = fighter.getStaminaPercent();
        if (stamina < 0.2) chance *= 0.5;
        else if (stamina < 0.4) chance *= 0.7;
        else chance *= 0.8 + stamina * 0.2;

        int prior = Math.max(0, fighter.getKnockdownsTotal() - 1);
        if (prior > 0) chance *= Math.pow(p("recovery.priorKnockdownPenalty", 0.85), prior);

        return Math.min(p("recovery.maxChance", 0.92), Math.max(p("recovery.minChance", 0.15), chance));
    }

    public int firstCheckCount() {
        return params.getInt("knockdown.recovery.firstCheckCount", 4);
    }

    public int mandatoryCount() {
        return params.getInt("knockdown.recovery.mandatoryCount", 8);
    }
}

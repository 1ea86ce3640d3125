package com.example.ringside.sim;

import com.example.ringside.engine.DamageCalculator;
import com.example.ringside.engine.PunchOutcome;
import com.example.ringside.model.Attribute;
import com.example.ringside.model.BodyType;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.HitLocation;
import com.example.ringside.util.ModelParameters;

import java.util.Random;

/**
 * Scales landed damage by the target's resistance and the attacker's
 * remaining gas, and rolls whether a shot hurts.
 */
public class SimpleDamageCalculator implements DamageCalculator {

    static final double MAX_RESISTANCE = 0.3;

    private final Random rng;
    private final ModelParameters params;

    public SimpleDamageCalculator(Random rng, ModelParameters params) {
        this.rng = rng;
        this.params = params == null ? ModelParameters.empty() : params;
    }

    @Override
    public double calculateDamage(PunchOutcome hit, Fighter attacker, Fighter target) {
        double damage = hit.damage();

        double resistance = target.getModifiedAttribute(Attribute.BLOCKING) / 500.0
            + target.getModifiedAttribute(Attribute.EXPERIENCE) / 1000.0;
        BodyType body = target.getPhysical().bodyType();
        if (body == BodyType.MUSCULAR || body == BodyType.STOCKY) resistance += 0.03;
        damage *= 1 - Math.min(MAX_RESISTANCE, resistance);

        if (hit.location() == HitLocation.HEAD) {
            damage *= 1.2 - target.getModifiedAttribute(Attribute.CHIN) / 250.0;
        }

        // a gassed puncher loses snap; punching stamina carries some of it
        double gas = attacker.getStaminaPercent();
        if (gas < 0.5) {
            double carry = attacker.getModifiedAttribute(Attribute.PUNCHING_STAMINA) / 100.0;
            damage *= 1 - (0.5 - gas) * (1 - carry * 0.6);
        }
        return Math.max(0, damage);
    }

    @Override
    public boolean checkHurt(Fighter target, double damage) {
        double headPercent = target.getHeadDamagePercent();
        double threshold = params.getDouble("combat.hurt.headThreshold", 5) * (1 - headPercent * 0.25);
        if (damage < threshold) return false;

        double base = params.getDouble("combat.hurt.baseChance", 0.25)
            + (damage / threshold - 1) * params.getDouble("combat.hurt.damageRatioScaling", 0.3);
        double chin = 1 - (target.getModifiedAttribute(Attribute.CHIN) - 70) / 100.0
            * params.getDouble("combat.hurt.chinFactor", 0.4);
        double composure = 1 - (target.getModifiedAttribute(Attribute.COMPOSURE) - 70)
            / params.getDouble("combat.hurt.composureFactor", 300);
        double accumulated = headPercent > 0.4 ? 1.2 + (headPercent - 0.4) * 0.8 : 1;
        double stamina = target.getStaminaPercent();
        double gas = stamina < 0.3 ? 1.3 : stamina < 0.5 ? 1.15 : 1;

        double chance = base * chin * composure * accumulated * gas;
        chance = Math.max(params.getDouble("combat.hurt.minChance", 0.10),
            Math.min(params.getDouble("combat.hurt.maxChance", 0.60), chance));
        return rng.nextDouble() < chance;
    }
}

package com.example.ringside.sim;

import com.example.ringside.engine.ActionType;
import com.example.ringside.engine.Decision;
import com.example.ringside.engine.StaminaManager;
import com.example.ringside.model.Attribute;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.FighterState;
import com.example.ringside.model.HitLocation;
import com.example.ringside.model.PunchType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Punch costs by type, a constant baseline drain for being in the fight, and
 * slow recovery while neutral, defending or holding. Recovery shrinks as the
 * tank empties.
 */
public class SimpleStaminaManager implements StaminaManager {

    private static final Map<PunchType, Double> PUNCH_COSTS = new EnumMap<>(PunchType.class);

    static {
        PUNCH_COSTS.put(PunchType.JAB, 0.35);
        PUNCH_COSTS.put(PunchType.CROSS, 0.80);
        PUNCH_COSTS.put(PunchType.LEAD_HOOK, 0.70);
        PUNCH_COSTS.put(PunchType.REAR_HOOK, 0.95);
        PUNCH_COSTS.put(PunchType.LEAD_UPPERCUT, 0.65);
        PUNCH_COSTS.put(PunchType.REAR_UPPERCUT, 1.0);
        PUNCH_COSTS.put(PunchType.BODY_JAB, 0.40);
        PUNCH_COSTS.put(PunchType.BODY_CROSS, 0.85);
        PUNCH_COSTS.put(PunchType.BODY_HOOK_LEAD, 0.75);
        PUNCH_COSTS.put(PunchType.BODY_HOOK_REAR, 1.0);
    }

    static final double BASELINE_PER_SECOND = 0.12;
    static final double MOVE_PER_SECOND = 0.1;
    static final double OFFENSIVE_PER_SECOND = 0.1;
    static final double RECOVERY_PER_SECOND = 0.35;
    static final double HIT_BASE = 0.3;
    static final double HIT_PER_DAMAGE = 0.15;
    static final double BODY_HIT_MULTIPLIER = 1.5;

    @Override
    public void update(Fighter fighter, Decision decision, double tickRate) {
        if (fighter.isDown()) return;
        double cost = BASELINE_PER_SECOND * tickRate;
        if (decision != null && decision.action().isPunch()) {
            cost += punchCost(decision.action().punchType(), fighter);
        } else if (decision != null && decision.action().type() == ActionType.MOVE) {
            cost += MOVE_PER_SECOND * tickRate;
        }
        FighterState state = fighter.getState();
        if (state == FighterState.OFFENSIVE) cost += OFFENSIVE_PER_SECOND * tickRate;
        fighter.spendStamina(cost);

        if (state == FighterState.NEUTRAL || state == FighterState.DEFENSIVE || state == FighterState.CLINCH) {
            double rate = fighter.getModifiedAttribute(Attribute.RECOVERY_RATE) / 70.0;
            double recovery = RECOVERY_PER_SECOND * tickRate * rate * (1 - fighter.getStaminaPercent() * 0.5);
            if (state == FighterState.CLINCH) recovery *= 1.3;
            fighter.recoverStamina(recovery);
        }
    }

    double punchCost(PunchType type, Fighter fighter) {
        double efficiency = 1.5 - fighter.getModifiedAttribute(Attribute.PUNCHING_STAMINA) / 200.0;
        return PUNCH_COSTS.getOrDefault(type, 0.8) * efficiency;
    }

    @Override
    public double calculateHitStaminaCost(double damage, HitLocation location, Fighter attacker) {
        double cost = HIT_BASE + damage * HIT_PER_DAMAGE;
        if (location == HitLocation.BODY) cost *= BODY_HIT_MULTIPLIER;
        return cost;
    }

    @Override
    public double calculateMissStaminaCost(PunchType punchType, Fighter attacker) {
        return punchType.isJab() ? 0.3 : 0.8;
    }
}

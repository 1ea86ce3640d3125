package com.example.ringside.engine;

import com.example.ringside.model.Fighter;
import com.example.ringside.model.FighterState;
import com.example.ringside.model.HitLocation;
import com.example.ringside.model.PunchType;

/**
 * Fallback stamina model: throwing costs a flat 2, resting in a neutral or
 * defensive stance gives back 0.2 a tick, and hits and misses cost nothing extra.
 */
public class BasicStaminaManager implements StaminaManager {

    static final double PUNCH_COST = 2.0;
    static final double PASSIVE_RECOVERY = 0.2;

    @Override
    public void update(Fighter fighter, Decision decision, double tickRate) {
        if (decision != null && decision.action().isPunch()) {
            fighter.spendStamina(PUNCH_COST);
        }
        FighterState state = fighter.getState();
        if (state == FighterState.DEFENSIVE || state == FighterState.NEUTRAL) {
            fighter.recoverStamina(PASSIVE_RECOVERY);
        }
    }

    @Override
    public double calculateHitStaminaCost(double damage, HitLocation location, Fighter attacker) {
        return 0;
    }

    @Override
    public double calculateMissStaminaCost(PunchType punchType, Fighter attacker) {
        return 0;
    }
}

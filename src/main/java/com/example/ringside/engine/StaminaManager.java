package com.example.ringside.engine;

import com.example.ringside.model.Fighter;
import com.example.ringside.model.HitLocation;
import com.example.ringside.model.PunchType;

public interface StaminaManager {

    /** Per-tick stamina change for the fighter's chosen activity. */
    void update(Fighter fighter, Decision decision, double tickRate);

    /** Stamina the target loses absorbing a landed punch. */
    double calculateHitStaminaCost(double damage, HitLocation location, Fighter attacker);

    /** Stamina the attacker wastes on a punch that hit nothing. */
    double calculateMissStaminaCost(PunchType punchType, Fighter attacker);
}

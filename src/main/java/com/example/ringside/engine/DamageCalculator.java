package com.example.ringside.engine;

import com.example.ringside.model.Fighter;

public interface DamageCalculator {

    /** Final damage for a landed punch. */
    double calculateDamage(PunchOutcome hit, Fighter attacker, Fighter target);

    /** Whether this hit leaves the target hurt. */
    boolean checkHurt(Fighter target, double damage);
}

package com.example.ringside.engine;

import com.example.ringside.fight.Fight;
import com.example.ringside.model.Fighter;

/**
 * Turns both fighters' decisions into hits, misses, blocks, evasions and possibly a knockdown.
 */
public interface CombatResolver {

    CombatResolution resolve(Fighter fighterA, Fighter fighterB, Decision decisionA, Decision decisionB, Fight fight);
}

package com.example.ringside.engine;

import com.example.ringside.fight.Fight;
import com.example.ringside.model.Fighter;

public class NoOpCombatResolver implements CombatResolver {

    @Override
    public CombatResolution resolve(Fighter fighterA, Fighter fighterB, Decision decisionA, Decision decisionB, Fight fight) {
        return CombatResolution.empty();
    }
}

package com.example.ringside.engine;

import com.example.ringside.fight.Fight;
import com.example.ringside.model.Fighter;

/**
 * Keeps each fighter in its current state and does nothing.
 */
public class NoOpDecisionSource implements DecisionSource {

    @Override
    public Decision decide(Fighter fighter, Fighter opponent, Fight fight) {
        if (fighter.getState().isVoluntary()) {
            return new Decision(fighter.getState(), fighter.getSubState(), Action.NONE);
        }
        return Decision.hold(fighter.getState());
    }
}

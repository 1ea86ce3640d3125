package com.example.ringside.engine;

import com.example.ringside.model.FighterState;
import com.example.ringside.model.FighterSubState;

/**
 * A decision source's choice for one fighter for one tick.
 * Only voluntary states can be chosen, and the sub-state must belong to the state.
 */
public record Decision(FighterState state, FighterSubState subState, Action action) {

    public Decision {
        if (state == null) state = FighterState.NEUTRAL;
        if (!state.isVoluntary()) {
            throw new IllegalArgumentException("A decision cannot choose " + state);
        }
        if (subState != null && !subState.isValidFor(state)) {
            throw new IllegalArgumentException(subState + " is not a sub-state of " + state);
        }
        if (action == null) action = Action.NONE;
    }

    public static Decision hold(FighterState state) {
        return new Decision(state != null && state.isVoluntary() ? state : FighterState.NEUTRAL, null, Action.NONE);
    }

    public static Decision of(FighterState state, FighterSubState subState, Action action) {
        return new Decision(state, subState, action);
    }
}

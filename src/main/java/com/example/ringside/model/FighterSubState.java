package com.example.ringside.model;

/**
 * Tag attached to a fighter only while in the matching primary state.
 */
public interface FighterSubState {

    /** The primary state this sub-state belongs to. */
    FighterState primaryState();

    String getDisplayName();

    /**
     * Whether this sub-state may be carried while in the given primary state.
     * A buzzed fighter keeps a defensive sub-state.
     */
    default boolean isValidFor(FighterState state) {
        if (state == primaryState()) return true;
        return state == FighterState.BUZZED && primaryState() == FighterState.DEFENSIVE;
    }
}

package com.example.ringside.model;

public enum DefensiveSubState implements FighterSubState {
    HIGH_GUARD("High Guard"),
    PHILLY_SHELL("Philly Shell"),
    HEAD_MOVEMENT("Head Movement"),
    DISTANCE("Distance"),
    PARRYING("Parrying");

    private final String displayName;

    DefensiveSubState(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public FighterState primaryState() {
        return FighterState.DEFENSIVE;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }
}

package com.example.ringside.model;

public enum OffensiveSubState implements FighterSubState {
    JABBING("Jabbing"),
    COMBINATION("Combination"),
    POWER_SHOT("Power Shot"),
    BODY_WORK("Body Work"),
    FEINTING("Feinting");

    private final String displayName;

    OffensiveSubState(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public FighterState primaryState() {
        return FighterState.OFFENSIVE;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }
}

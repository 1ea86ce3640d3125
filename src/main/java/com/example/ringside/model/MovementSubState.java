package com.example.ringside.model;

public enum MovementSubState implements FighterSubState {
    CUTTING_OFF("Cutting Off"),
    CIRCLING("Circling"),
    RETREATING("Retreating");

    private final String displayName;

    MovementSubState(String displayName) {
        this.displayName = displayName;
    }

    @Override
    public FighterState primaryState() {
        return FighterState.MOVING;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }
}

package com.example.ringside.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Primary condition of a fighter. Exactly one is active at any time.
 */
public enum FighterState {

    NEUTRAL("Neutral", true),
    OFFENSIVE("Offensive", true),
    DEFENSIVE("Defensive", true),
    TIMING("Timing", true),
    MOVING("Moving", true),
    CLINCH("Clinch", true),
    /** Dazed but not hurt; forced into a guard */
    BUZZED("Buzzed", false),
    HURT("Hurt", false),
    KNOCKED_DOWN("Knocked Down", false),
    FLASH_DOWN("Flash Down", false),
    /** Back on the feet after beating the count */
    RECOVERED("Recovered", false);

    private final String displayName;
    private final boolean voluntary;

    FighterState(String displayName, boolean voluntary) {
        this.displayName = displayName;
        this.voluntary = voluntary;
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Whether a decision source may ask for this state. */
    public boolean isVoluntary() {
        return voluntary;
    }

    public boolean isDown() {
        return this == KNOCKED_DOWN || this == FLASH_DOWN;
    }

    /**
     * Transition table. A downed fighter can only get up (RECOVERED); every other
     * state may move to any state except RECOVERED.
     */
    public Set<FighterState> allowedTransitions() {
        if (isDown()) {
            return EnumSet.of(RECOVERED, this);
        }
        return EnumSet.complementOf(EnumSet.of(RECOVERED));
    }

    public boolean canTransitionTo(FighterState next) {
        if (next == null) return false;
        if (next == this) return true;
        return allowedTransitions().contains(next);
    }
}

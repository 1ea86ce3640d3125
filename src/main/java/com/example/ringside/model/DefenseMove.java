package com.example.ringside.model;

/**
 * How a punch was stopped: the first four are evasions, the rest blocks.
 */
public enum DefenseMove {
    SLIP(true),
    DUCK(true),
    LEAN(true),
    FOOTWORK(true),
    HIGH_GUARD(false),
    SHELL(false),
    ARM(false);

    private final boolean evasion;

    DefenseMove(boolean evasion) {
        this.evasion = evasion;
    }

    public boolean isEvasion() {
        return evasion;
    }
}

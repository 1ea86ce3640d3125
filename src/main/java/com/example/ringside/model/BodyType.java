package com.example.ringside.model;

public enum BodyType {
    LEAN(1.05),
    AVERAGE(1.0),
    MUSCULAR(0.97),
    STOCKY(0.98),
    LANKY(1.02);

    private final double staminaModifier;

    BodyType(double staminaModifier) {
        this.staminaModifier = staminaModifier;
    }

    public double getStaminaModifier() {
        return staminaModifier;
    }
}

package com.example.ringside.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fatigue bands and the attribute penalties (in percent) each one carries.
 */
public enum StaminaTier {
    FRESH(0.80, 0, 0, 0, 0, 0),
    GOOD(0.60, -3, -2, 0, 0, 0),
    TIRED(0.40, -8, -5, -5, -5, 0),
    EXHAUSTED(0.25, -15, -12, -10, -15, 0),
    GASSED(0.0, -30, -25, -20, -30, -15);

    private final double threshold;
    private final Map<ModifierTarget, Double> penalties;

    StaminaTier(double threshold, double power, double speed, double accuracy, double defense, double chin) {
        this.threshold = threshold;
        Map<ModifierTarget, Double> m = new EnumMap<>(ModifierTarget.class);
        if (power != 0) m.put(ModifierTarget.POWER, power);
        if (speed != 0) m.put(ModifierTarget.SPEED, speed);
        if (accuracy != 0) m.put(ModifierTarget.ACCURACY, accuracy);
        if (defense != 0) m.put(ModifierTarget.DEFENSE, defense);
        if (chin != 0) m.put(ModifierTarget.CHIN, chin);
        this.penalties = Collections.unmodifiableMap(m);
    }

    public double getThreshold() {
        return threshold;
    }

    public Map<ModifierTarget, Double> getPenalties() {
        return penalties;
    }

    public static StaminaTier forPercent(double percent) {
        for (StaminaTier tier : values()) {
            if (percent >= tier.threshold) return tier;
        }
        return GASSED;
    }
}

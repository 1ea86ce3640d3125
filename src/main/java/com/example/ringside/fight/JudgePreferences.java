package com.example.ringside.fight;

/**
 * Multipliers a judge applies to each scoring criterion. 1.0 is neutral.
 */
public record JudgePreferences(
    double cleanPunching,
    double defense,
    double effectiveAggression,
    double ringGeneralship,
    double powerShots,
    double volume
) {
    public static JudgePreferences neutral() {
        return new JudgePreferences(1, 1, 1, 1, 1, 1);
    }
}

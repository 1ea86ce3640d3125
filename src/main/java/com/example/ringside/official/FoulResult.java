package com.example.ringside.official;

import com.example.ringside.model.Corner;
import com.example.ringside.model.CutLocation;

/**
 * A foul as committed and as called. The cut location is null when no cut opened.
 */
public record FoulResult(
    Corner attacker,
    FoulType type,
    double damage,
    CutLocation cutLocation,
    boolean detected,
    boolean intentional,
    FoulConsequence consequence,
    int warningsForType,
    int totalDeductions
) {
    public Corner target() {
        return attacker.opponent();
    }

    public boolean isPointDeduction() {
        return consequence == FoulConsequence.POINT_DEDUCTION;
    }

    public boolean isDisqualification() {
        return consequence == FoulConsequence.DISQUALIFICATION;
    }
}

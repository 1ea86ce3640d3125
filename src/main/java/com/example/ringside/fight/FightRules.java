package com.example.ringside.fight;

/**
 * Rule flags for a bout.
 *
 * @param threeKnockdownRule three knockdowns in one round end the fight
 * @param mandatoryEightCount a fighter who beats the count still takes an eight count
 * @param maxClinchDuration seconds a clinch may last before the referee must break it
 */
public record FightRules(boolean threeKnockdownRule, boolean mandatoryEightCount, double maxClinchDuration) {

    public FightRules {
        if (maxClinchDuration <= 0) maxClinchDuration = 6;
    }

    public static FightRules standard() {
        return new FightRules(false, true, 6);
    }

    public FightRules withThreeKnockdownRule(boolean enabled) {
        return new FightRules(enabled, mandatoryEightCount, maxClinchDuration);
    }
}

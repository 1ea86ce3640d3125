package com.example.ringside.official;

/**
 * Foul catalogue. Damage is bonus head damage; the stamina fields drain the
 * target or refresh the attacker.
 */
public enum FoulType {
    HEADBUTT("Headbutt", "headbutt", 2, 8, 0.25, 0, 0, 0.6, 2),
    LOW_BLOW("Low Blow", "lowBlow", 0, 2, 0, 15, 0, 0.8, 1),
    RABBIT_PUNCH("Rabbit Punch", "rabbitPunch", 1, 4, 0, 0, 0, 0.5, 2),
    HOLDING("Holding", "holding", 0, 0, 0, 0, 5, 0.9, 3),
    ELBOW("Elbow", "elbow", 3, 10, 0.35, 0, 0, 0.7, 1),
    PUSH("Push", "push", 0, 1, 0, 0, 0, 0.4, 3),
    HITTING_AFTER_BREAK("Hitting After Break", "hittingAfterBreak", 2, 6, 0, 0, 0, 0.95, 1),
    HITTING_ON_BREAK("Hitting On Break", "hittingOnBreak", 1, 4, 0, 0, 0, 0.85, 2);

    private final String displayName;
    private final String tendencyKey;
    private final double minDamage;
    private final double maxDamage;
    private final double cutChance;
    private final double staminaDrain;
    private final double staminaRecovery;
    private final double detectionChance;
    private final int warningThreshold;

    FoulType(String displayName, String tendencyKey, double minDamage, double maxDamage, double cutChance,
             double staminaDrain, double staminaRecovery, double detectionChance, int warningThreshold) {
        this.displayName = displayName;
        this.tendencyKey = tendencyKey;
        this.minDamage = minDamage;
        this.maxDamage = maxDamage;
        this.cutChance = cutChance;
        this.staminaDrain = staminaDrain;
        this.staminaRecovery = staminaRecovery;
        this.detectionChance = detectionChance;
        this.warningThreshold = warningThreshold;
    }

    public String getDisplayName() { return displayName; }
    public String getTendencyKey() { return tendencyKey; }
    public double getMinDamage() { return minDamage; }
    public double getMaxDamage() { return maxDamage; }
    public double getCutChance() { return cutChance; }
    public double getStaminaDrain() { return staminaDrain; }
    public double getStaminaRecovery() { return staminaRecovery; }
    public double getDetectionChance() { return detectionChance; }
    public int getWarningThreshold() { return warningThreshold; }

    public static FoulType fromTendencyKey(String key) {
        for (FoulType t : values()) {
            if (t.tendencyKey.equalsIgnoreCase(key) || t.name().equalsIgnoreCase(key)) return t;
        }
        return null;
    }
}

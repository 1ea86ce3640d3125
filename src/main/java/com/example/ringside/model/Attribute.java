package com.example.ringside.model;

/**
 * Fighter attributes, each rated 1-100.
 */
public enum Attribute {
    // Power
    POWER_LEFT(AttributeGroup.POWER, "powerLeft", 70),
    POWER_RIGHT(AttributeGroup.POWER, "powerRight", 75),
    KNOCKOUT_POWER(AttributeGroup.POWER, "knockoutPower", 70),
    BODY_PUNCHING(AttributeGroup.POWER, "bodyPunching", 70),
    PUNCHING_STAMINA(AttributeGroup.POWER, "punchingStamina", 70),

    // Speed
    HAND_SPEED(AttributeGroup.SPEED, "handSpeed", 70),
    FOOT_SPEED(AttributeGroup.SPEED, "footSpeed", 70),
    REFLEXES(AttributeGroup.SPEED, "reflexes", 70),
    FIRST_STEP(AttributeGroup.SPEED, "firstStep", 70),
    COMBINATION_SPEED(AttributeGroup.SPEED, "combinationSpeed", 70),

    // Stamina
    CARDIO(AttributeGroup.STAMINA, "cardio", 70),
    RECOVERY_RATE(AttributeGroup.STAMINA, "recoveryRate", 70),
    WORK_RATE(AttributeGroup.STAMINA, "workRate", 70),
    SECOND_WIND(AttributeGroup.STAMINA, "secondWind", 50),
    PACE_CONTROL(AttributeGroup.STAMINA, "paceControl", 60),

    // Defense
    HEAD_MOVEMENT(AttributeGroup.DEFENSE, "headMovement", 65),
    BLOCKING(AttributeGroup.DEFENSE, "blocking", 70),
    PARRYING(AttributeGroup.DEFENSE, "parrying", 60),
    SHOULDER_ROLL(AttributeGroup.DEFENSE, "shoulderRoll", 50),
    CLINCH_DEFENSE(AttributeGroup.DEFENSE, "clinchDefense", 65),
    CLINCH_OFFENSE(AttributeGroup.DEFENSE, "clinchOffense", 60),
    RING_AWARENESS(AttributeGroup.DEFENSE, "ringAwareness", 65),

    // Offense
    JAB_ACCURACY(AttributeGroup.OFFENSE, "jabAccuracy", 70),
    POWER_ACCURACY(AttributeGroup.OFFENSE, "powerAccuracy", 65),
    BODY_ACCURACY(AttributeGroup.OFFENSE, "bodyAccuracy", 65),
    PUNCH_SELECTION(AttributeGroup.OFFENSE, "punchSelection", 65),
    FEINTING(AttributeGroup.OFFENSE, "feinting", 55),
    COUNTER_PUNCHING(AttributeGroup.OFFENSE, "counterPunching", 60),
    COMBINATION_PUNCHING(AttributeGroup.OFFENSE, "combinationPunching", 70),

    // Technical
    FOOTWORK(AttributeGroup.TECHNICAL, "footwork", 65),
    DISTANCE_MANAGEMENT(AttributeGroup.TECHNICAL, "distanceManagement", 65),
    INSIDE_FIGHTING(AttributeGroup.TECHNICAL, "insideFighting", 60),
    OUTSIDE_FIGHTING(AttributeGroup.TECHNICAL, "outsideFighting", 65),
    RING_GENERALSHIP(AttributeGroup.TECHNICAL, "ringGeneralship", 60),
    ADAPTABILITY(AttributeGroup.TECHNICAL, "adaptability", 60),
    FIGHT_IQ(AttributeGroup.TECHNICAL, "fightIQ", 65),

    // Mental
    CHIN(AttributeGroup.MENTAL, "chin", 75),
    HEART(AttributeGroup.MENTAL, "heart", 75),
    KILLER_INSTINCT(AttributeGroup.MENTAL, "killerInstinct", 65),
    COMPOSURE(AttributeGroup.MENTAL, "composure", 65),
    INTIMIDATION(AttributeGroup.MENTAL, "intimidation", 50),
    CONFIDENCE(AttributeGroup.MENTAL, "confidence", 70),
    EXPERIENCE(AttributeGroup.MENTAL, "experience", 60),
    CLUTCH_FACTOR(AttributeGroup.MENTAL, "clutchFactor", 60),
    FOCUS(AttributeGroup.MENTAL, "focus", 85);

    public static final int MIN_VALUE = 1;
    public static final int MAX_VALUE = 100;

    private final AttributeGroup group;
    private final String key;
    private final int defaultValue;

    Attribute(AttributeGroup group, String key, int defaultValue) {
        this.group = group;
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public AttributeGroup getGroup() { return group; }
    public String getKey() { return key; }
    public int getDefaultValue() { return defaultValue; }

    public static int clamp(double value) {
        if (Double.isNaN(value)) return MIN_VALUE;
        return (int) Math.max(MIN_VALUE, Math.min(MAX_VALUE, Math.round(value)));
    }

    /**
     * Find an attribute by its YAML key within a group, or null.
     */
    public static Attribute fromKey(AttributeGroup group, String key) {
        for (Attribute a : values()) {
            if (a.group == group && a.key.equalsIgnoreCase(key)) return a;
        }
        return null;
    }
}

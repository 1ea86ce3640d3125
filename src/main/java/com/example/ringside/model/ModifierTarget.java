package com.example.ringside.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * What a modifier acts on. The first group are shorthands spanning several
 * attributes; AGGRESSION has no attribute and is read by decision sources.
 */
public enum ModifierTarget {
    SPEED(Attribute.HAND_SPEED, Attribute.FOOT_SPEED),
    POWER(Attribute.POWER_LEFT, Attribute.POWER_RIGHT),
    DEFENSE(Attribute.HEAD_MOVEMENT, Attribute.BLOCKING),
    ACCURACY(Attribute.JAB_ACCURACY, Attribute.POWER_ACCURACY),
    VISION(Attribute.JAB_ACCURACY, Attribute.POWER_ACCURACY, Attribute.HEAD_MOVEMENT),
    AGGRESSION(),

    HAND_SPEED(Attribute.HAND_SPEED),
    FOOT_SPEED(Attribute.FOOT_SPEED),
    FIRST_STEP(Attribute.FIRST_STEP),
    COMBINATION_SPEED(Attribute.COMBINATION_SPEED),
    REFLEXES(Attribute.REFLEXES),
    HEAD_MOVEMENT(Attribute.HEAD_MOVEMENT),
    BLOCKING(Attribute.BLOCKING),
    RING_AWARENESS(Attribute.RING_AWARENESS),
    CHIN(Attribute.CHIN),
    HEART(Attribute.HEART),
    COMPOSURE(Attribute.COMPOSURE),
    CONFIDENCE(Attribute.CONFIDENCE),
    CARDIO(Attribute.CARDIO),
    WORK_RATE(Attribute.WORK_RATE),
    INTIMIDATION(Attribute.INTIMIDATION);

    private final Set<Attribute> attributes;

    ModifierTarget(Attribute... attributes) {
        this.attributes = attributes.length == 0
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.of(attributes[0], attributes));
    }

    public Set<Attribute> getAttributes() {
        return attributes;
    }
}

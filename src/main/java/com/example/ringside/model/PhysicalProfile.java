package com.example.ringside.model;

/**
 * Height and reach in centimetres, weight in kilograms.
 */
public record PhysicalProfile(double height, double weight, double reach, int age, Stance stance, BodyType bodyType) {

    public PhysicalProfile {
        if (height <= 0) height = 180;
        if (weight <= 0) weight = 75;
        if (reach <= 0) reach = 180;
        if (age <= 0) age = 25;
        if (stance == null) stance = Stance.ORTHODOX;
        if (bodyType == null) bodyType = BodyType.AVERAGE;
    }

    public static PhysicalProfile defaults() {
        return new PhysicalProfile(180, 75, 180, 25, Stance.ORTHODOX, BodyType.AVERAGE);
    }
}

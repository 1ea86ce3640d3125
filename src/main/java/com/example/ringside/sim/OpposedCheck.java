package com.example.ringside.sim;

import java.util.Random;

/**
 * Opposed check between two attribute ratings.
 *
 * Every ten points of difference moves one step along the table, with
 * diminishing returns at both ends:
 * - Equal ratings: 50%
 * - Higher attacker rating: up to 95% at +50
 * - Lower attacker rating: down to 5% at -50
 * Ratings between steps are interpolated.
 */
public final class OpposedCheck {

    // Index 0 = diff of -50, index 10 = diff of +50
    private static final double[] CHANCE_TABLE = {
        0.05,   // -50
        0.08,   // -40
        0.14,   // -30
        0.24,   // -20
        0.36,   // -10
        0.50,   //   0
        0.64,   // +10
        0.76,   // +20
        0.86,   // +30
        0.92,   // +40
        0.95    // +50
    };

    private OpposedCheck() {
    }

    /**
     * @return success chance, 0.05 to 0.95
     */
    public static double getSuccessChance(double attackRating, double defenseRating) {
        double steps = Math.max(-5, Math.min(5, (attackRating - defenseRating) / 10.0));
        double position = steps + 5;
        int lower = (int) Math.floor(position);
        if (lower >= CHANCE_TABLE.length - 1) return CHANCE_TABLE[CHANCE_TABLE.length - 1];
        double frac = position - lower;
        return CHANCE_TABLE[lower] + (CHANCE_TABLE[lower + 1] - CHANCE_TABLE[lower]) * frac;
    }

    /**
     * Base chance scaled by {@code multiplier} and shifted by {@code modifier}, clamped to 0..1.
     */
    public static double getSuccessChance(double attackRating, double defenseRating, double multiplier, double modifier) {
        double chance = getSuccessChance(attackRating, defenseRating) * multiplier + modifier;
        return Math.max(0.0, Math.min(1.0, chance));
    }

    public static boolean check(Random rng, double attackRating, double defenseRating, double multiplier, double modifier) {
        return rng.nextDouble() < getSuccessChance(attackRating, defenseRating, multiplier, modifier);
    }
}

package com.example.ringside.fight;

import com.example.ringside.model.Corner;

/**
 * One judge's score for one round, with the raw criteria totals behind it.
 */
public record RoundScore(int round, String judge, int scoreA, int scoreB, double rawA, double rawB) {

    /** The corner that won the round, or null for an even round. */
    public Corner winner() {
        if (scoreA > scoreB) return Corner.A;
        if (scoreB > scoreA) return Corner.B;
        return null;
    }

    public int scoreFor(Corner corner) {
        return corner == Corner.A ? scoreA : scoreB;
    }

    @Override
    public String toString() {
        return scoreA + "-" + scoreB;
    }
}

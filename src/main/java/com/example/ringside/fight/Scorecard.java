package com.example.ringside.fight;

import com.example.ringside.model.Corner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One judge's running card.
 */
public class Scorecard {
    private final String judgeName;
    private final List<RoundScore> rounds = new ArrayList<>();
    private int totalA;
    private int totalB;

    public Scorecard(String judgeName) {
        this.judgeName = judgeName;
    }

    public void addRound(RoundScore score) {
        rounds.add(score);
        totalA += score.scoreA();
        totalB += score.scoreB();
    }

    public String getJudgeName() { return judgeName; }
    public List<RoundScore> getRounds() { return Collections.unmodifiableList(rounds); }
    public int getTotalA() { return totalA; }
    public int getTotalB() { return totalB; }

    public int getTotal(Corner corner) {
        return corner == Corner.A ? totalA : totalB;
    }

    /** Card winner, or null if the card is level. */
    public Corner getWinner() {
        if (totalA > totalB) return Corner.A;
        if (totalB > totalA) return Corner.B;
        return null;
    }

    public Scorecard copy() {
        Scorecard c = new Scorecard(judgeName);
        for (RoundScore s : rounds) c.addRound(s);
        return c;
    }

    @Override
    public String toString() {
        return judgeName + ": " + totalA + "-" + totalB;
    }
}

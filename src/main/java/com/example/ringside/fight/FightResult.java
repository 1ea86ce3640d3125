package com.example.ringside.fight;

import com.example.ringside.model.Corner;
import com.example.ringside.model.PunchType;

import java.util.List;

/**
 * Final verdict. The winner is null for draws and no-contests.
 */
public record FightResult(
    Corner winner,
    FightMethod method,
    int round,
    double time,
    List<Scorecard> scorecards,
    String details,
    PunchType finishingPunch
) {
    public FightResult {
        scorecards = scorecards == null ? List.of() : List.copyOf(scorecards);
    }

    public boolean isDraw() {
        return winner == null;
    }

    public String describe() {
        int mins = (int) (time / 60);
        int secs = (int) (time % 60);
        String when = String.format("round %d, %d:%02d", round, mins, secs);
        if (winner == null) return method.getDisplayName() + " after " + when;
        return "Corner " + winner + " by " + method.getDisplayName() + " (" + when + ")";
    }
}

package com.example.ringside.event;

import com.example.ringside.fight.RoundScore;
import com.example.ringside.model.FighterStats;

import java.util.List;

/**
 * End of a round. The stats are detached copies of the round ledger.
 */
public record RoundEndEvent(int round, FighterStats statsA, FighterStats statsB, List<RoundScore> scores) implements FightEvent {

    public RoundEndEvent {
        statsA = statsA.copy();
        statsB = statsB.copy();
        scores = List.copyOf(scores);
    }

    @Override
    public EventType type() {
        return EventType.ROUND_END;
    }
}

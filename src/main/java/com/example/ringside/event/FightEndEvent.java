package com.example.ringside.event;

import com.example.ringside.fight.FightMethod;
import com.example.ringside.fight.Scorecard;
import com.example.ringside.model.Corner;

import java.util.List;

public record FightEndEvent(Corner winner, FightMethod method, int round, double time, List<Scorecard> scorecards) implements FightEvent {

    public FightEndEvent {
        scorecards = List.copyOf(scorecards);
    }

    @Override
    public EventType type() {
        return EventType.FIGHT_END;
    }
}

package com.example.ringside.event;

import com.example.ringside.fight.FightMethod;
import com.example.ringside.model.Corner;

public record FightEndingEvent(Corner winner, FightMethod method, boolean ko) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.FIGHT_ENDING;
    }
}

package com.example.ringside.event;

import com.example.ringside.model.Corner;

public record BuzzedEvent(Corner fighter, int severity, double duration) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.BUZZED;
    }
}

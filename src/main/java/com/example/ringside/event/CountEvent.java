package com.example.ringside.event;

import com.example.ringside.model.Corner;

public record CountEvent(Corner fighter, int count, boolean ko) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.COUNT;
    }
}

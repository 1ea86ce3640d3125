package com.example.ringside.event;

import com.example.ringside.model.Corner;

public record RecoveryEvent(Corner fighter, int count, boolean flash) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.RECOVERY;
    }
}

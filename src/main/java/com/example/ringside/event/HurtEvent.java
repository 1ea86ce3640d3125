package com.example.ringside.event;

import com.example.ringside.model.Corner;

public record HurtEvent(Corner fighter, double duration) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.HURT;
    }
}

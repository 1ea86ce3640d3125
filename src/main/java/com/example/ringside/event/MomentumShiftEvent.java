package com.example.ringside.event;

import com.example.ringside.model.Corner;

public record MomentumShiftEvent(Corner fighter, double momentum) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.MOMENTUM_SHIFT;
    }
}

package com.example.ringside.event;

import com.example.ringside.model.Corner;
import com.example.ringside.model.CutLocation;

public record CutEvent(Corner fighter, CutLocation location, int severity) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.CUT;
    }
}

package com.example.ringside.event;

public record TickEvent(int round, double time, FighterSnapshot fighterA, FighterSnapshot fighterB, double distance) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.TICK;
    }
}

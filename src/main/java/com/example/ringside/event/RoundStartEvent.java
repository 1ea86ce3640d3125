package com.example.ringside.event;

public record RoundStartEvent(int round) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.ROUND_START;
    }
}

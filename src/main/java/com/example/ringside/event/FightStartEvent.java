package com.example.ringside.event;

public record FightStartEvent(FighterSnapshot fighterA, FighterSnapshot fighterB, int rounds, double roundDuration, boolean threeKnockdownRule) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.FIGHT_START;
    }
}

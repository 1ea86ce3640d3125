package com.example.ringside.event;

import com.example.ringside.model.Corner;
import com.example.ringside.official.FoulConsequence;
import com.example.ringside.official.FoulType;

public record FoulEvent(Corner attacker, Corner target, FoulType foul, boolean detected, FoulConsequence consequence) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.FOUL;
    }
}

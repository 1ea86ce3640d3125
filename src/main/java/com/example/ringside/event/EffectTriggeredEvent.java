package com.example.ringside.event;

import com.example.ringside.effect.EffectType;
import com.example.ringside.model.Corner;

public record EffectTriggeredEvent(Corner fighter, EffectType effect, String trigger) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.EFFECT_TRIGGERED;
    }
}

package com.example.ringside.event;

import com.example.ringside.model.Corner;
import com.example.ringside.model.PunchType;

/**
 * A fighter went down. Reported as FLASH_KNOCKDOWN only when the quick recovery
 * has already been settled.
 */
public record KnockdownEvent(Corner fighter, Corner attacker, PunchType punch, boolean flash) implements FightEvent {

    @Override
    public EventType type() {
        return flash ? EventType.FLASH_KNOCKDOWN : EventType.KNOCKDOWN;
    }
}

package com.example.ringside.event;

import com.example.ringside.model.Corner;
import com.example.ringside.model.HitLocation;
import com.example.ringside.model.PunchQuality;
import com.example.ringside.model.PunchType;

public record PunchLandedEvent(Corner attacker, Corner target, PunchType punchType, HitLocation location, double damage, PunchQuality quality, boolean counter) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.PUNCH_LANDED;
    }
}

package com.example.ringside.event;

import com.example.ringside.model.Corner;

public record PointDeductionEvent(Corner fighter, String reason, int total) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.POINT_DEDUCTION;
    }
}

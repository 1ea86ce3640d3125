package com.example.ringside.event;

import com.example.ringside.official.RefereeCommand;

public record RefereeCommandEvent(RefereeCommand command, String text) implements FightEvent {

    @Override
    public EventType type() {
        return EventType.REFEREE_COMMAND;
    }
}

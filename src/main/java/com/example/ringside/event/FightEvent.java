package com.example.ringside.event;

/**
 * Something the engine reports to the outside. Events are immutable values and
 * never hold references into live engine state.
 */
public interface FightEvent {

    EventType type();
}

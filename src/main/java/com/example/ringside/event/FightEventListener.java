package com.example.ringside.event;

/**
 * Receives engine events in the order they happen. Listeners observe only;
 * they have no way back into the engine.
 */
@FunctionalInterface
public interface FightEventListener {

    void onEvent(FightEvent event);
}

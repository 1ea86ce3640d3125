package com.example.ringside.engine;

/**
 * Waits between steps of a real-time fight. Interruptible so a stopped fight
 * never hangs in a delay.
 */
@FunctionalInterface
public interface Pacer {

    /** Sleeps on the calling thread. */
    Pacer SLEEP = millis -> {
        if (millis > 0) Thread.sleep(millis);
    };

    /** No waiting at all; a real-time run then plays out as fast as batch mode. */
    Pacer NONE = millis -> { };

    void delay(long millis) throws InterruptedException;
}

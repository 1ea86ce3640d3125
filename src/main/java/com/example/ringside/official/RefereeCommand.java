package com.example.ringside.official;

import java.util.List;

/**
 * Instructions the referee gives in the ring, each with a few ways of saying it.
 */
public enum RefereeCommand {
    BREAK(List.of("Break!", "Break it up!", "Step back, break!", "Let go, break!")),
    WORK(List.of("Work! Work your way out!", "Let's go, work!", "Punch out of it!")),
    STOP(List.of("Stop!", "Stop boxing!", "That's enough, stop!")),
    WARNING(List.of("Watch it!", "Keep them up!", "That's a warning!", "Clean it up!")),
    POINT(List.of("That's a point!", "Point deduction!", "I'm taking a point!")),
    TIME(List.of("Time!", "Time out!")),
    BOX(List.of("Box!", "Let's go, box!", "Fight!"));

    private final List<String> variations;

    RefereeCommand(List<String> variations) {
        this.variations = variations;
    }

    public List<String> getVariations() {
        return variations;
    }
}

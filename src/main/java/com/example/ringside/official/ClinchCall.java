package com.example.ringside.official;

/**
 * What the referee does about a clinch this tick.
 *
 * @param delay seconds before the fighters are actually separated
 */
public record ClinchCall(Action action, double delay) {

    public enum Action { NONE, WARN, BREAK }

    public static final ClinchCall NONE = new ClinchCall(Action.NONE, 0);

    public boolean isBreak() {
        return action == Action.BREAK;
    }
}

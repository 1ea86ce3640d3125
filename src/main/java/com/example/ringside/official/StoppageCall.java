package com.example.ringside.official;

/**
 * Outcome of the referee looking a fighter over.
 */
public record StoppageCall(boolean stop, String reason, double score) {

    public static final String THREE_KNOCKDOWNS = "three_knockdowns";
    public static final String NOT_DEFENDING = "not_defending";
    public static final String ACCUMULATED_DAMAGE = "accumulated_damage";
    public static final String REFEREE_STOPPAGE = "referee_stoppage";

    public static StoppageCall noStop(double score) {
        return new StoppageCall(false, null, score);
    }
}

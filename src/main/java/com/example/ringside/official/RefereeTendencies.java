package com.example.ringside.official;

/**
 * How a referee tends to run a fight.
 *
 * @param clinchTolerance seconds of holding tolerated before a break
 * @param clinchBreakSpeed how quickly a called break is enforced
 * @param stoppageThreshold stoppage score needed to wave it off
 * @param protectiveness 0-1, lowers the threshold and scales TKO odds
 * @param countSpeed seconds per count, used for pacing
 * @param foulStrictness 0-1, scales foul detection
 * @param warningFirst whether a first offence is always only a warning
 * @param keepsFightMoving 0-1, how eager the referee is to keep action going
 */
public record RefereeTendencies(
    double clinchTolerance,
    double clinchBreakSpeed,
    double stoppageThreshold,
    double protectiveness,
    double countSpeed,
    double foulStrictness,
    boolean warningFirst,
    double keepsFightMoving
) {
    public static RefereeTendencies standard() {
        return new RefereeTendencies(3, 1, 0.6, 0.5, 1, 0.5, true, 0.7);
    }
}

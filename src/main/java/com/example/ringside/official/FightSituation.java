package com.example.ringside.official;

/**
 * Context the officials and the foul policy read.
 *
 * @param scoreDiff estimated card margin for the fighter in question (positive is ahead)
 * @param distance distance between the fighters in feet
 */
public record FightSituation(int round, double scoreDiff, double distance) {
}

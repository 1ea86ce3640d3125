package com.example.ringside.fight;

import com.example.ringside.model.Corner;
import com.example.ringside.model.PunchType;

/**
 * A knockdown the fighter got up from.
 */
public record KnockdownRecord(Corner fighter, int round, double time, PunchType punch, int count, boolean flash) {
}

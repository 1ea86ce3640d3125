package com.example.ringside.engine;

import com.example.ringside.model.Corner;
import com.example.ringside.model.PunchType;

/**
 * The resolver's claim that a punch put the target down. A flash request is
 * only a candidate until the engine settles whether the fighter really pops up.
 */
public record KnockdownRequest(Corner target, PunchType punchType, double damage, boolean flash) {

    public Corner attacker() {
        return target.opponent();
    }
}

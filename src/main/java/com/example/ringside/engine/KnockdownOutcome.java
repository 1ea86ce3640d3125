package com.example.ringside.engine;

import com.example.ringside.fight.FightMethod;

/**
 * How a knockdown sequence ended.
 *
 * @param flash whether it was (and was reported as) a flash knockdown
 * @param count the count the fighter got up at, or 10 for a knockout
 * @param stoppage the method if the fight ended here, otherwise null
 */
public record KnockdownOutcome(boolean flash, boolean recovered, int count, FightMethod stoppage) {

    public boolean endedFight() {
        return stoppage != null;
    }
}

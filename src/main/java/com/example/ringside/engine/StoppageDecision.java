package com.example.ringside.engine;

import com.example.ringside.fight.FightMethod;

/**
 * Result of one stoppage check on one fighter.
 *
 * @param probability accumulated stop probability after the referee's protectiveness
 */
public record StoppageDecision(boolean stop, FightMethod method, double probability, String reason) {

    public static StoppageDecision continueFight(FightMethod method, double probability) {
        return new StoppageDecision(false, method, probability, null);
    }
}

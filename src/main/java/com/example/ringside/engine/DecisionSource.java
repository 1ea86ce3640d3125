package com.example.ringside.engine;

import com.example.ringside.fight.Fight;
import com.example.ringside.model.Fighter;

/**
 * Chooses what a fighter does each tick. Supplied by the embedding application.
 */
public interface DecisionSource {

    Decision decide(Fighter fighter, Fighter opponent, Fight fight);
}

package com.example.ringside.sim;

import com.example.ringside.engine.FightSimulator;
import com.example.ringside.fight.Fight;
import com.example.ringside.util.ModelParameters;

import java.util.Random;

/**
 * Wires a simulator with the reference collaborators from this package, all
 * sharing one random source so a seed reproduces the whole fight.
 */
public final class ReferenceSimulation {

    private ReferenceSimulation() {
    }

    public static FightSimulator create(Fight fight, Random rng, ModelParameters params) {
        ModelParameters p = params == null ? ModelParameters.empty() : params;
        return new FightSimulator(fight, rng, p,
            new RandomDecisionSource(rng),
            new SimpleCombatResolver(rng),
            new SimpleDamageCalculator(rng, p),
            new SimpleStaminaManager(),
            new SimplePositionTracker());
    }

    public static FightSimulator create(Fight fight, long seed) {
        return create(fight, new Random(seed), ModelParameters.loadDefault());
    }
}

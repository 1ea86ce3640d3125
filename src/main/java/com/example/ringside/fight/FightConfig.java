package com.example.ringside.fight;

import com.example.ringside.model.Corner;
import com.example.ringside.model.InvalidFightConfigurationException;

/**
 * Fight settings. Durations are in simulated seconds.
 */
public class FightConfig {
    public static final int DEFAULT_ROUNDS = 10;
    public static final double DEFAULT_ROUND_DURATION = 180;
    public static final double DEFAULT_REST_DURATION = 60;
    public static final double DEFAULT_TICK_RATE = 0.5;
    public static final int DEFAULT_CORNER_SKILL = 70;

    public final int rounds;
    public final double roundDuration;
    public final double restDuration;
    public final double tickRate;
    public final FightRules rules;
    /** Corner a judge's home bias favours, or null for a neutral venue. */
    public final Corner homeCorner;
    public final int cornerSkill;

    public FightConfig(int rounds, double roundDuration, double restDuration, double tickRate,
                       FightRules rules, Corner homeCorner, int cornerSkill) {
        if (rounds <= 0) {
            throw new InvalidFightConfigurationException("Round count must be positive: " + rounds);
        }
        if (!(roundDuration > 0)) {
            throw new InvalidFightConfigurationException("Round duration must be positive: " + roundDuration);
        }
        if (!(restDuration >= 0)) {
            throw new InvalidFightConfigurationException("Rest duration cannot be negative: " + restDuration);
        }
        if (!(tickRate > 0)) {
            throw new InvalidFightConfigurationException("Tick rate must be positive: " + tickRate);
        }
        this.rounds = rounds;
        this.roundDuration = roundDuration;
        this.restDuration = restDuration;
        this.tickRate = tickRate;
        this.rules = rules == null ? FightRules.standard() : rules;
        this.homeCorner = homeCorner;
        this.cornerSkill = Math.max(0, Math.min(100, cornerSkill));
    }

    public FightConfig(int rounds, FightRules rules) {
        this(rounds, DEFAULT_ROUND_DURATION, DEFAULT_REST_DURATION, DEFAULT_TICK_RATE, rules, null, DEFAULT_CORNER_SKILL);
    }

    public FightConfig(int rounds) {
        this(rounds, FightRules.standard());
    }

    public FightConfig() {
        this(DEFAULT_ROUNDS);
    }

    public int ticksPerRound() {
        return (int) Math.ceil(roundDuration / tickRate);
    }
}

package com.example.ringside.sim;

import com.example.ringside.engine.Action;
import com.example.ringside.engine.Decision;
import com.example.ringside.engine.DecisionSource;
import com.example.ringside.engine.MoveDirection;
import com.example.ringside.fight.Fight;
import com.example.ringside.model.Attribute;
import com.example.ringside.model.DefensiveSubState;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.FighterState;
import com.example.ringside.model.MovementSubState;
import com.example.ringside.model.OffensiveSubState;
import com.example.ringside.model.PunchType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * Weighted random fighter behaviour driven by attributes: busy fighters attack
 * more, tired or hurt fighters cover up and hold, and the current state is sticky
 * for a few ticks so fighters do not flicker between states.
 */
public class RandomDecisionSource implements DecisionSource {

    private static final PunchType[] POWER_PUNCHES = {
        PunchType.CROSS, PunchType.LEAD_HOOK, PunchType.REAR_HOOK, PunchType.LEAD_UPPERCUT, PunchType.REAR_UPPERCUT
    };
    private static final PunchType[] BODY_PUNCHES = {
        PunchType.BODY_JAB, PunchType.BODY_CROSS, PunchType.BODY_HOOK_LEAD, PunchType.BODY_HOOK_REAR
    };

    static final double STATE_STICKINESS = 0.8;
    static final double OUT_OF_RANGE = 5.0;

    private final Random rng;

    public RandomDecisionSource(Random rng) {
        this.rng = rng;
    }

    @Override
    public Decision decide(Fighter fighter, Fighter opponent, Fight fight) {
        if (fighter.isDown()) return Decision.hold(FighterState.NEUTRAL);

        if (fighter.isHurt() || fighter.isBuzzed()) {
            double holdChance = fighter.getModifiedAttribute(Attribute.CLINCH_OFFENSE) / 250.0;
            if (fighter.getState() == FighterState.CLINCH || rng.nextDouble() < holdChance) {
                return new Decision(FighterState.CLINCH, null, Action.clinch());
            }
            return new Decision(FighterState.DEFENSIVE, DefensiveSubState.HIGH_GUARD, Action.defend());
        }

        FighterState current = fighter.getState();
        FighterState next = current.isVoluntary() && rng.nextDouble() < STATE_STICKINESS
            ? current : pickState(fighter, opponent);
        double distance = fighter.getPosition().distanceTo(opponent.getPosition());
        if (distance > OUT_OF_RANGE && next != FighterState.MOVING && next != FighterState.DEFENSIVE) {
            return new Decision(FighterState.MOVING, MovementSubState.CUTTING_OFF, Action.move(MoveDirection.FORWARD));
        }
        return decisionFor(next, fighter);
    }

    private FighterState pickState(Fighter fighter, Fighter opponent) {
        double stamina = fighter.getStaminaPercent();
        Map<FighterState, Double> weights = new EnumMap<>(FighterState.class);
        double offensive = (fighter.getModifiedAttribute(Attribute.WORK_RATE)
            + fighter.getModifiedAttribute(Attribute.KILLER_INSTINCT)) / 2;
        if (opponent.isHurt() || opponent.isBuzzed()) offensive *= 1.5;
        if (stamina < 0.3) offensive *= 0.5;
        weights.put(FighterState.OFFENSIVE, offensive);
        weights.put(FighterState.DEFENSIVE, 100 - fighter.getModifiedAttribute(Attribute.WORK_RATE) / 2);
        weights.put(FighterState.MOVING, fighter.getModifiedAttribute(Attribute.FOOTWORK) / 2);
        weights.put(FighterState.TIMING, fighter.getModifiedAttribute(Attribute.COUNTER_PUNCHING) / 3);
        weights.put(FighterState.NEUTRAL, 30.0);
        weights.put(FighterState.CLINCH, stamina < 0.3 ? 12.0 : 2.0);

        double total = 0;
        for (double w : weights.values()) total += Math.max(0, w);
        double roll = rng.nextDouble() * total;
        for (Map.Entry<FighterState, Double> e : weights.entrySet()) {
            roll -= Math.max(0, e.getValue());
            if (roll < 0) return e.getKey();
        }
        return FighterState.NEUTRAL;
    }

    private Decision decisionFor(FighterState state, Fighter fighter) {
        switch (state) {
            case OFFENSIVE: {
                OffensiveSubState sub = pick(OffensiveSubState.values());
                double punchChance = 0.15 + fighter.getModifiedAttribute(Attribute.WORK_RATE) / 500.0;
                if (sub == OffensiveSubState.FEINTING || rng.nextDouble() >= punchChance) {
                    return new Decision(state, sub, Action.NONE);
                }
                return new Decision(state, sub, Action.punch(punchFor(sub)));
            }
            case DEFENSIVE:
                return new Decision(state, pick(DefensiveSubState.values()), Action.defend());
            case MOVING: {
                MovementSubState sub = pick(MovementSubState.values());
                MoveDirection dir = sub == MovementSubState.CUTTING_OFF ? MoveDirection.FORWARD
                    : sub == MovementSubState.RETREATING ? MoveDirection.BACKWARD : MoveDirection.LATERAL;
                return new Decision(state, sub, Action.move(dir));
            }
            case TIMING:
                return new Decision(state, null, rng.nextDouble() < 0.12 ? Action.punch(PunchType.CROSS) : Action.NONE);
            case CLINCH:
                return new Decision(state, null, Action.clinch());
            default:
                return new Decision(FighterState.NEUTRAL, null,
                    rng.nextDouble() < 0.08 ? Action.punch(PunchType.JAB) : Action.NONE);
        }
    }

    private PunchType punchFor(OffensiveSubState sub) {
        switch (sub) {
            case JABBING:
                return PunchType.JAB;
            case POWER_SHOT:
                return pick(POWER_PUNCHES);
            case BODY_WORK:
                return pick(BODY_PUNCHES);
            default:
                return rng.nextDouble() < 0.4 ? PunchType.JAB : pick(POWER_PUNCHES);
        }
    }

    private <T> T pick(T[] values) {
        return values[rng.nextInt(values.length)];
    }
}

package com.example.ringside.sim;

import com.example.ringside.engine.Action;
import com.example.ringside.engine.CombatResolution;
import com.example.ringside.engine.CombatResolver;
import com.example.ringside.engine.Decision;
import com.example.ringside.engine.KnockdownRequest;
import com.example.ringside.engine.PunchOutcome;
import com.example.ringside.fight.Fight;
import com.example.ringside.model.Attribute;
import com.example.ringside.model.Corner;
import com.example.ringside.model.DefenseMove;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.FighterState;
import com.example.ringside.model.PunchQuality;
import com.example.ringside.model.PunchType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Accuracy against defence. Each thrown punch is an opposed check of the
 * attacker's accuracy and hand speed against the defender's head movement,
 * blocking and reflexes; a failed check is evaded, blocked or simply missed.
 * Landed power shots can put the defender down.
 *
 * Raw damage runs 1-3 for jabs and 3-8 for power punches before power and
 * counters scale it.
 */
public class SimpleCombatResolver implements CombatResolver {

    private static final DefenseMove[] EVASIONS = { DefenseMove.SLIP, DefenseMove.DUCK, DefenseMove.LEAN, DefenseMove.FOOTWORK };
    private static final DefenseMove[] BLOCKS = { DefenseMove.HIGH_GUARD, DefenseMove.SHELL, DefenseMove.ARM };

    static final double PUNCH_RANGE = 6.5;
    static final double LAND_MULTIPLIER = 0.7;
    static final double CLEAN_CHANCE = 0.7;

    private final Random rng;

    public SimpleCombatResolver(Random rng) {
        this.rng = rng;
    }

    @Override
    public CombatResolution resolve(Fighter fighterA, Fighter fighterB, Decision decisionA, Decision decisionB, Fight fight) {
        List<PunchOutcome> hits = new ArrayList<>();
        List<PunchOutcome> misses = new ArrayList<>();
        List<PunchOutcome> blocks = new ArrayList<>();
        List<PunchOutcome> evades = new ArrayList<>();
        Map<Corner, Action> actions = new EnumMap<>(Corner.class);
        actions.put(Corner.A, decisionA.action());
        actions.put(Corner.B, decisionB.action());
        KnockdownRequest knockdown = null;

        for (Corner corner : Corner.values()) {
            Fighter attacker = corner == Corner.A ? fighterA : fighterB;
            Fighter defender = corner == Corner.A ? fighterB : fighterA;
            Decision own = corner == Corner.A ? decisionA : decisionB;
            Decision other = corner == Corner.A ? decisionB : decisionA;
            if (!own.action().isPunch() || attacker.isDown() || defender.isDown()) continue;
            if (!attacker.canThrowPunch(rng)) continue;

            PunchType type = own.action().punchType();
            if (attacker.getPosition().distanceTo(defender.getPosition()) > PUNCH_RANGE) {
                misses.add(PunchOutcome.missed(corner, type));
                continue;
            }

            double attack = accuracyFor(attacker, type) * 0.7 + attacker.getModifiedAttribute(Attribute.HAND_SPEED) * 0.3;
            double defence = defenceRating(defender, other);
            double chance = OpposedCheck.getSuccessChance(attack, defence, LAND_MULTIPLIER * defender.getTotalVulnerability(), 0);
            if (attacker.getState() == FighterState.CLINCH || defender.getState() == FighterState.CLINCH) chance *= 0.5;

            if (rng.nextDouble() < chance) {
                boolean counter = attacker.getState() == FighterState.TIMING && other.action().isPunch();
                PunchQuality quality = rng.nextDouble() < CLEAN_CHANCE ? PunchQuality.CLEAN : PunchQuality.PARTIAL;
                double damage = rawDamage(attacker, type, quality, counter);
                hits.add(new PunchOutcome(corner, type, type.getDefaultLocation(), damage, quality, counter, damage >= 5, null));
                if (knockdown == null) knockdown = checkKnockdown(corner, attacker, defender, type, damage);
                continue;
            }

            double head = defender.getModifiedAttribute(Attribute.HEAD_MOVEMENT);
            double guard = defender.getModifiedAttribute(Attribute.BLOCKING);
            boolean defending = defender.getState() == FighterState.DEFENSIVE || defender.getState() == FighterState.BUZZED;
            if (defending || rng.nextDouble() < 0.5) {
                if (rng.nextDouble() < head / (head + guard)) {
                    evades.add(PunchOutcome.stopped(corner, type, EVASIONS[rng.nextInt(EVASIONS.length)]));
                } else {
                    blocks.add(PunchOutcome.stopped(corner, type, BLOCKS[rng.nextInt(BLOCKS.length)]));
                }
            } else {
                misses.add(PunchOutcome.missed(corner, type));
            }
        }
        return new CombatResolution(hits, misses, blocks, evades, knockdown, actions);
    }

    private static double accuracyFor(Fighter f, PunchType type) {
        if (type.isJab()) return f.getModifiedAttribute(Attribute.JAB_ACCURACY);
        if (type.isBodyPunch()) return f.getModifiedAttribute(Attribute.BODY_ACCURACY);
        return f.getModifiedAttribute(Attribute.POWER_ACCURACY);
    }

    private static double defenceRating(Fighter defender, Decision decision) {
        double rating = (defender.getModifiedAttribute(Attribute.HEAD_MOVEMENT)
            + defender.getModifiedAttribute(Attribute.BLOCKING)
            + defender.getModifiedAttribute(Attribute.REFLEXES)) / 3;
        if (decision.state() == FighterState.DEFENSIVE) rating += 10;
        if (decision.action().isPunch()) rating -= 5;
        return rating;
    }

    private double rawDamage(Fighter attacker, PunchType type, PunchQuality quality, boolean counter) {
        double base = type.isJab() ? 1 + rng.nextDouble() * 2 : 3 + rng.nextDouble() * 5;
        double power = type.isRearHand()
            ? attacker.getModifiedAttribute(Attribute.POWER_RIGHT)
            : attacker.getModifiedAttribute(Attribute.POWER_LEFT);
        if (type.isBodyPunch()) power = (power + attacker.getModifiedAttribute(Attribute.BODY_PUNCHING)) / 2;
        double damage = base * (0.6 + power / 250.0);
        if (quality == PunchQuality.PARTIAL) damage *= 0.6;
        if (counter) damage *= 1.25;
        return damage;
    }

    /**
     * Only heavy power shots threaten a knockdown; chin, accumulated damage and
     * the defender's current vulnerability shift the odds.
     */
    private KnockdownRequest checkKnockdown(Corner attackerCorner, Fighter attacker, Fighter defender,
                                            PunchType type, double damage) {
        if (!type.isPowerPunch() || damage < 6) return null;
        double chance = (damage - 5) * 0.03
            * (1 + (attacker.getModifiedAttribute(Attribute.KNOCKOUT_POWER) - 70) / 100.0)
            * (1 - defender.getModifiedAttribute(Attribute.CHIN) / 200.0)
            * defender.getTotalVulnerability();
        if (defender.getHeadDamagePercent() > 0.6) chance *= 1.5;
        if (defender.isHurt()) chance *= 2;
        if (rng.nextDouble() >= chance) return null;
        boolean flash = damage < 8 && !defender.isHurt() && rng.nextDouble() < 0.5;
        return new KnockdownRequest(attackerCorner.opponent(), type, damage, flash);
    }
}

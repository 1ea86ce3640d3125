package com.example.ringside.official;

import com.example.ringside.model.Corner;
import com.example.ringside.model.Cut;
import com.example.ringside.model.CutLocation;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.HitLocation;
import com.example.ringside.util.ModelParameters;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * Decides when a fighter fouls, what the referee makes of it, and keeps each
 * corner's warnings and deductions for the whole fight.
 */
public class FoulPolicy {

    private static class FoulRecord {
        final EnumMap<FoulType, Integer> warningsByType = new EnumMap<>(FoulType.class);
        int committed;
        int detected;
        int warnings;
        int deductions;
        int foulsThisRound;
        boolean disqualified;
    }

    private final Map<Corner, FoulRecord> records = new EnumMap<>(Corner.class);
    private final Random rng;
    private final double baseChancePerDirtiness;
    private final int minimumDirtiness;

    public FoulPolicy(Random rng, ModelParameters params) {
        this.rng = rng;
        ModelParameters p = params == null ? ModelParameters.empty() : params;
        this.baseChancePerDirtiness = p.getDouble("fouls.baseChancePerDirtiness", 0.001);
        this.minimumDirtiness = p.getInt("fouls.minimumDirtiness", 20);
        for (Corner c : Corner.values()) records.put(c, new FoulRecord());
    }

    /**
     * Roll for a foul attempt this tick.
     * @return the foul chosen, or null for none
     */
    public FoulType shouldAttemptFoul(Corner corner, Fighter fighter, FightSituation situation) {
        int dirtiness = fighter.getTactics().getDirtiness();
        if (dirtiness < minimumDirtiness) return null;

        FoulRecord rec = records.get(corner);
        double chance = dirtiness * baseChancePerDirtiness;
        if (situation.scoreDiff() < -2) chance *= 1.5;
        if (fighter.getStaminaPercent() < 0.4) chance *= 1.3;
        if (fighter.isHurt() || fighter.isBuzzed()) chance *= 1.4;
        if (situation.distance() < 2) chance *= 1.5;
        if (situation.round() < 3) chance *= 0.5;
        if (rec.warnings >= 2) chance *= 0.6;
        if (rec.deductions > 0) chance *= 0.4;

        if (rng.nextDouble() >= chance) return null;
        return selectFoulType(fighter);
    }

    /**
     * Weighted pick from the fighter's tendencies; holding when none are set.
     */
    FoulType selectFoulType(Fighter fighter) {
        Map<FoulType, Integer> tendencies = fighter.getTactics().getTendencies();
        int total = 0;
        for (int w : tendencies.values()) total += w;
        if (total <= 0) return FoulType.HOLDING;
        int roll = rng.nextInt(total);
        for (Map.Entry<FoulType, Integer> e : tendencies.entrySet()) {
            roll -= e.getValue();
            if (roll < 0) return e.getKey();
        }
        return FoulType.HOLDING;
    }

    /**
     * Commit the foul: roll its damage and cut, see whether the referee catches it
     * and escalate through warnings, deductions and finally disqualification.
     */
    public FoulResult executeFoul(Corner corner, FoulType type, Fighter attacker, Referee referee) {
        FoulRecord rec = records.get(corner);
        rec.committed++;
        rec.foulsThisRound++;

        double damage = type.getMinDamage() + rng.nextDouble() * (type.getMaxDamage() - type.getMinDamage());
        CutLocation cut = null;
        if (type.getCutChance() > 0 && rng.nextDouble() < type.getCutChance()) {
            cut = rng.nextBoolean() ? CutLocation.LEFT_EYEBROW : CutLocation.RIGHT_EYEBROW;
        }

        double detection = type.getDetectionChance() * referee.getSkill() / 100.0
            * (0.8 + referee.getTendencies().foulStrictness() * 0.4);
        boolean detected = rng.nextDouble() < detection;
        boolean intentional = attacker.getTactics().getDirtiness() > 60 && rng.nextDouble() < 0.3;

        FoulConsequence consequence = FoulConsequence.NONE;
        int count = rec.warningsByType.getOrDefault(type, 0);
        if (detected) {
            rec.detected++;
            count++;
            rec.warningsByType.put(type, count);
            int threshold = type.getWarningThreshold();
            if (count <= threshold) {
                boolean firstOffence = count == 1 && referee.getTendencies().warningFirst();
                consequence = intentional && !firstOffence && count > 1
                    ? FoulConsequence.POINT_DEDUCTION : FoulConsequence.WARNING;
            } else if (count <= threshold + 2) {
                consequence = FoulConsequence.POINT_DEDUCTION;
            } else {
                consequence = rec.deductions >= 3 ? FoulConsequence.DISQUALIFICATION : FoulConsequence.POINT_DEDUCTION;
            }

            if (consequence == FoulConsequence.WARNING) {
                rec.warnings++;
            } else if (consequence == FoulConsequence.POINT_DEDUCTION) {
                rec.deductions++;
            } else {
                rec.disqualified = true;
            }
        }

        return new FoulResult(corner, type, damage, cut, detected, intentional, consequence, count, rec.deductions);
    }

    /**
     * Land the foul's physical effects on both fighters.
     * @return the cut opened, or null
     */
    public Cut applyFoulEffects(FoulResult foul, Fighter attacker, Fighter target, int roundNumber) {
        if (foul.damage() > 0) target.takeDamage(foul.damage(), HitLocation.HEAD);
        if (foul.type().getStaminaDrain() > 0) target.spendStamina(foul.type().getStaminaDrain());
        if (foul.type().getStaminaRecovery() > 0) attacker.recoverStamina(foul.type().getStaminaRecovery());
        if (foul.cutLocation() != null) return target.addCut(foul.cutLocation(), roundNumber);
        return null;
    }

    public void resetRound() {
        for (FoulRecord r : records.values()) r.foulsThisRound = 0;
    }

    public int getDeductions(Corner corner) {
        return records.get(corner).deductions;
    }

    public int getFoulsThisRound(Corner corner) {
        return records.get(corner).foulsThisRound;
    }

    public FoulSummary getFoulSummary(Corner corner) {
        FoulRecord r = records.get(corner);
        return new FoulSummary(r.committed, r.detected, r.warnings, r.deductions, r.disqualified,
            Collections.unmodifiableMap(new EnumMap<>(r.warningsByType)));
    }
}

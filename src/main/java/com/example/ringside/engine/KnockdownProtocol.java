package com.example.ringside.engine;

import com.example.ringside.effect.FightEffectsEngine;
import com.example.ringside.event.BuzzedEvent;
import com.example.ringside.event.CountEvent;
import com.example.ringside.event.FightEvent;
import com.example.ringside.event.KnockdownEvent;
import com.example.ringside.event.RecoveryEvent;
import com.example.ringside.fight.Fight;
import com.example.ringside.fight.FightMethod;
import com.example.ringside.fight.KnockdownRecord;
import com.example.ringside.fight.Round;
import com.example.ringside.model.Corner;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.Modifier;
import com.example.ringside.model.ModifierTarget;
import com.example.ringside.official.FightSituation;
import com.example.ringside.official.StoppageCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.function.Consumer;

/**
 * Runs a knockdown from the moment the fighter hits the canvas until they either
 * beat the count or are counted out.
 *
 * A flash request is settled up front: if the fighter would not pop straight back
 * up, the knockdown is reported as a regular one and they are counted out. A flash
 * label therefore always ends in a recovery, and a knockdown that ends the fight
 * under the three-knockdown rule is never labelled a flash.
 */
public class KnockdownProtocol {

    private static final Logger logger = LoggerFactory.getLogger(KnockdownProtocol.class);

    static final int FLASH_DEBUFF_TICKS = 15;
    static final int KNOCKDOWN_DEBUFF_TICKS = 30;
    static final double FLASH_BUZZ_DAMAGE = 3;

    private final Fight fight;
    private final FightEffectsEngine effects;
    private final RecoveryModel recovery;
    private final Random rng;

    public KnockdownProtocol(Fight fight, FightEffectsEngine effects, RecoveryModel recovery, Random rng) {
        this.fight = fight;
        this.effects = effects;
        this.recovery = recovery;
        this.rng = rng;
    }

    /**
     * Put the target down and count.
     *
     * @param request the resolver's knockdown
     * @param situation where the fight stands, for the referee's look after the count
     * @param emit receives each event as it happens
     */
    public KnockdownOutcome execute(KnockdownRequest request, FightSituation situation, Consumer<FightEvent> emit) {
        Corner downCorner = request.target();
        Corner attackerCorner = request.attacker();
        Fighter fighter = fight.getFighter(downCorner);
        Fighter attacker = fight.getFighter(attackerCorner);
        Round round = fight.getCurrentRound();

        boolean threeDown = fight.getConfig().rules.threeKnockdownRule() && fighter.getKnockdownsThisRound() + 1 >= 3;
        boolean flash = request.flash() && !threeDown && rng.nextDouble() < recovery.flashRecoveryChance(fighter);
        boolean failedFlash = request.flash() && !flash && !threeDown;

        fighter.knockDown(flash);
        emit.accept(new KnockdownEvent(downCorner, attackerCorner, request.punchType(), flash));
        effects.onKnockdown(downCorner, fighter.getKnockdownsTotal(), attacker);
        logger.debug("[KnockdownProtocol] {} down in round {} ({}{})", fighter.getName(), round.getNumber(),
            flash ? "flash" : "knockdown", failedFlash ? ", flash that did not hold" : "");

        if (threeDown) {
            round.recordKnockdown(new KnockdownRecord(downCorner, round.getNumber(), round.getCurrentTime(),
                request.punchType(), 0, flash));
            fight.stopFight(FightMethod.TKO_THREE_KNOCKDOWNS, attackerCorner,
                "Three knockdowns in round " + round.getNumber(), request.punchType());
            return new KnockdownOutcome(flash, false, 0, FightMethod.TKO_THREE_KNOCKDOWNS);
        }

        int count;
        if (flash) {
            count = recovery.flashRecoveryCount(fighter);
            for (int i = 1; i <= count; i++) emit.accept(new CountEvent(downCorner, i, false));
        } else if (failedFlash || rng.nextDouble() < recovery.immediateKnockoutChance(fighter, attacker, request.damage())) {
            return countOut(downCorner, request, emit, 1, failedFlash ? "Could not beat the count" : "Out cold");
        } else {
            count = regularCount(fighter, downCorner, emit);
            if (count < 0) {
                return countOut(downCorner, request, emit, 10, "Counted out");
            }
        }

        round.recordKnockdown(new KnockdownRecord(downCorner, round.getNumber(), round.getCurrentTime(),
            request.punchType(), count, flash));
        fighter.getUp();
        emit.accept(new RecoveryEvent(downCorner, count, flash));
        effects.onRecovery(downCorner);

        fighter.removeModifiers(Fighter.POST_KNOCKDOWN_SOURCE);
        fighter.addTimedModifier(Fighter.POST_KNOCKDOWN_SOURCE, true, flash
                ? Modifier.effects(ModifierTarget.SPEED, -5, ModifierTarget.POWER, -3, ModifierTarget.DEFENSE, -8)
                : Modifier.effects(ModifierTarget.SPEED, -10, ModifierTarget.POWER, -5, ModifierTarget.DEFENSE, -15),
            flash ? FLASH_DEBUFF_TICKS : KNOCKDOWN_DEBUFF_TICKS);

        if (flash && fighter.setBuzzed(FLASH_BUZZ_DAMAGE, request.punchType())) {
            emit.accept(new BuzzedEvent(downCorner, fighter.getBuzzedSeverity(), fighter.getBuzzedDuration()));
        }
        fighter.updateModifiedAttributes();

        StoppageCall call = fight.getReferee().checkStoppage(fighter, attacker, situation);
        if (call.stop()) {
            logger.debug("[KnockdownProtocol] Referee waves it off after the count: {}", call.reason());
            fight.stopFight(FightMethod.TKO_REFEREE, attackerCorner, call.reason(), request.punchType());
            return new KnockdownOutcome(flash, true, count, FightMethod.TKO_REFEREE);
        }
        return new KnockdownOutcome(flash, true, count, null);
    }

    /**
     * Count from one, checking for a recovery from the first check count on. Under
     * the mandatory eight count a fighter who is up early still waits for eight.
     *
     * @return the count beaten, or -1 if the fighter did not beat nine
     */
    private int regularCount(Fighter fighter, Corner corner, Consumer<FightEvent> emit) {
        boolean mandatory = fight.getConfig().rules.mandatoryEightCount();
        for (int i = 1; i <= 9; i++) {
            emit.accept(new CountEvent(corner, i, false));
            if (i < recovery.firstCheckCount()) continue;
            if (rng.nextDouble() < recovery.recoveryChance(fighter, i)
                && (!mandatory || i >= recovery.mandatoryCount())) {
                return i;
            }
        }
        return -1;
    }

    private KnockdownOutcome countOut(Corner corner, KnockdownRequest request, Consumer<FightEvent> emit,
                                      int fromCount, String details) {
        for (int i = fromCount; i <= 9; i++) emit.accept(new CountEvent(corner, i, false));
        emit.accept(new CountEvent(corner, 10, true));
        fight.stopFight(FightMethod.KO, request.attacker(), details, request.punchType());
        return new KnockdownOutcome(false, false, 10, FightMethod.KO);
    }
}

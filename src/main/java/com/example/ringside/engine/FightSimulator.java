package com.example.ringside.engine;

import com.example.ringside.effect.EffectType;
import com.example.ringside.effect.FightEffectsEngine;
import com.example.ringside.event.BuzzedEvent;
import com.example.ringside.event.CutEvent;
import com.example.ringside.event.EffectTriggeredEvent;
import com.example.ringside.event.FightEndEvent;
import com.example.ringside.event.FightEndingEvent;
import com.example.ringside.event.FightEvent;
import com.example.ringside.event.FightEventListener;
import com.example.ringside.event.FightStartEvent;
import com.example.ringside.event.FighterSnapshot;
import com.example.ringside.event.FoulEvent;
import com.example.ringside.event.HurtEvent;
import com.example.ringside.event.MomentumShiftEvent;
import com.example.ringside.event.PointDeductionEvent;
import com.example.ringside.event.PunchLandedEvent;
import com.example.ringside.event.RefereeCommandEvent;
import com.example.ringside.event.RoundEndEvent;
import com.example.ringside.event.RoundStartEvent;
import com.example.ringside.event.TickEvent;
import com.example.ringside.fight.Fight;
import com.example.ringside.fight.FightConfig;
import com.example.ringside.fight.FightMethod;
import com.example.ringside.fight.FightResult;
import com.example.ringside.fight.Round;
import com.example.ringside.fight.RoundScore;
import com.example.ringside.model.Attribute;
import com.example.ringside.model.Corner;
import com.example.ringside.model.Cut;
import com.example.ringside.model.CutLocation;
import com.example.ringside.model.DefenseMove;
import com.example.ringside.model.DefensiveSubState;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.FighterState;
import com.example.ringside.model.FighterStats;
import com.example.ringside.model.FighterSubState;
import com.example.ringside.model.HitLocation;
import com.example.ringside.model.MovementSubState;
import com.example.ringside.official.ClinchCall;
import com.example.ringside.official.FightSituation;
import com.example.ringside.official.FoulPolicy;
import com.example.ringside.official.FoulResult;
import com.example.ringside.official.FoulType;
import com.example.ringside.official.Referee;
import com.example.ringside.official.RefereeCommand;
import com.example.ringside.util.ModelParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Drives a {@link Fight} one tick at a time.
 *
 * Each {@link #step()} is pure simulation with no waiting: the first step opens
 * the fight, a step between rounds runs the whole rest period, and every other
 * step runs one tick through the fixed phase order (clock, decisions, fouls,
 * state transitions, clinch, combat, hits, stamina and position, knockdown,
 * stoppage, conditions, tick event). Real-time pacing lives in
 * {@link RealTimeFightRunner}.
 *
 * The simulator is the only thing that mutates the fight. Listeners see
 * immutable event records.
 */
public class FightSimulator {

    private static final Logger logger = LoggerFactory.getLogger(FightSimulator.class);

    static final int HIGH_OUTPUT_WINDOW_TICKS = 60;
    static final double CLINCH_SEPARATION = 3.0;
    static final double CUT_DAMAGE_THRESHOLD = 6.0;
    static final double CUT_CHANCE = 0.1;

    private final Fight fight;
    private final Random rng;
    private final DecisionSource decisionSource;
    private final CombatResolver combatResolver;
    private final DamageCalculator damageCalculator;
    private final StaminaManager staminaManager;
    private final PositionTracker positionTracker;

    private final FightEffectsEngine effects;
    private final FoulPolicy foulPolicy;
    private final KnockdownProtocol knockdownProtocol;
    private final StoppageEvaluator stoppageEvaluator;

    private final List<FightEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<Corner, Integer> thrownInWindow = new EnumMap<>(Corner.class);

    private long tickCount;
    private double clinchDuration;
    private boolean endReported;

    public FightSimulator(Fight fight, Random rng, ModelParameters params,
                          DecisionSource decisionSource, CombatResolver combatResolver,
                          DamageCalculator damageCalculator, StaminaManager staminaManager,
                          PositionTracker positionTracker) {
        if (fight == null) throw new IllegalArgumentException("fight is required");
        this.fight = fight;
        this.rng = rng == null ? new Random() : rng;
        ModelParameters p = params == null ? ModelParameters.empty() : params;

        this.decisionSource = decisionSource == null ? new NoOpDecisionSource() : decisionSource;
        this.combatResolver = combatResolver == null ? new NoOpCombatResolver() : combatResolver;
        this.damageCalculator = damageCalculator == null ? new NoOpDamageCalculator() : damageCalculator;
        this.staminaManager = staminaManager == null ? new BasicStaminaManager() : staminaManager;
        this.positionTracker = positionTracker == null ? new NoOpPositionTracker() : positionTracker;

        this.effects = new FightEffectsEngine(
            fight.getFighter(Corner.A).getId(), fight.getFighter(Corner.B).getId(), this.rng);
        this.foulPolicy = new FoulPolicy(this.rng, p);
        this.knockdownProtocol = new KnockdownProtocol(fight, effects, new RecoveryModel(p), this.rng);
        this.stoppageEvaluator = new StoppageEvaluator(p, this.rng);
        for (Corner c : Corner.values()) thrownInWindow.put(c, 0);
    }

    /**
     * Simulator with every collaborator left to its no-op fallback.
     */
    public FightSimulator(Fight fight, Random rng) {
        this(fight, rng, null, null, null, null, null, null);
    }

    public void addListener(FightEventListener listener) {
        if (listener != null) listeners.add(listener);
    }

    public void removeListener(FightEventListener listener) {
        listeners.remove(listener);
    }

    // ==================== Stepping ====================

    /**
     * Advance the fight by one step.
     *
     * @return the events emitted during the step, in order; empty once the fight is over
     */
    public List<FightEvent> step() {
        List<FightEvent> events = new ArrayList<>();
        switch (fight.getStatus()) {
            case NOT_STARTED:
                beginFight(events);
                break;
            case BETWEEN_ROUNDS:
                runRestPeriod(events);
                break;
            case IN_PROGRESS:
                runTick(events);
                break;
            default:
                return Collections.emptyList();
        }
        if (fight.isOver() && !endReported) {
            reportEnd(events);
        }
        return events;
    }

    /**
     * Batch mode: step until the fight is decided.
     */
    public FightResult runToCompletion() {
        FightConfig config = fight.getConfig();
        long guard = (long) config.rounds * (config.ticksPerRound() + 2) + 10;
        while (!fight.isOver() && guard-- > 0) {
            step();
        }
        if (!fight.isOver()) {
            throw new IllegalStateException("Fight did not finish within its scheduled rounds");
        }
        return fight.getResult();
    }

    private void emit(List<FightEvent> events, FightEvent event) {
        events.add(event);
        for (FightEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("[FightSimulator] Listener failed on {}: {}", event.type(), e.getMessage(), e);
            }
        }
    }

    // ==================== Fight and round boundaries ====================

    private void beginFight(List<FightEvent> events) {
        Fighter a = fight.getFighter(Corner.A);
        Fighter b = fight.getFighter(Corner.B);
        fight.start();
        positionTracker.initializePositions(a, b);
        logger.info("[FightSimulator] {} vs {} over {} rounds", a.getName(), b.getName(), fight.getConfig().rounds);

        emit(events, new FightStartEvent(FighterSnapshot.of(Corner.A, a), FighterSnapshot.of(Corner.B, b),
            fight.getConfig().rounds, fight.getConfig().roundDuration, fight.getConfig().rules.threeKnockdownRule()));

        applyPreFightEffects(events);
        effects.resetForRound();
        refreshAttributes();
        emit(events, new RoundStartEvent(1));
    }

    /**
     * Stare-down, big-fight nerves and explosive starters, before the first bell.
     */
    private void applyPreFightEffects(List<FightEvent> events) {
        for (Corner c : Corner.values()) {
            Fighter f = fight.getFighter(c);
            Fighter opp = fight.getOpponent(c);
            if (effects.onIntimidation(c, opp.getAttribute(Attribute.INTIMIDATION),
                    f.getAttribute(Attribute.HEART), f.getAttribute(Attribute.EXPERIENCE))) {
                emit(events, new EffectTriggeredEvent(c, EffectType.FROZEN, "intimidation"));
            }
            if (effects.applyBigFightMentality(c, f, opp)) {
                emit(events, new EffectTriggeredEvent(c, EffectType.BIG_FIGHT_MENTALITY, "big fight"));
            }
            if (effects.applyFastStart(c, f)) {
                emit(events, new EffectTriggeredEvent(c, EffectType.FAST_START, "fast start"));
            }
        }
    }

    private void endRound(List<FightEvent> events, Round round) {
        List<RoundScore> scores = fight.endRound(rng);
        FighterStats statsA = round.getStats(Corner.A);
        FighterStats statsB = round.getStats(Corner.B);

        if (dominated(statsA, statsB)) effects.onDomination(Corner.A);
        else if (dominated(statsB, statsA)) effects.onDomination(Corner.B);

        clinchDuration = 0;
        fight.getReferee().resetClinch();
        emit(events, new RoundEndEvent(round.getNumber(), statsA, statsB, scores));
        logger.info("[FightSimulator] Round {} ended: {}", round.getNumber(), scores);
    }

    private static boolean dominated(FighterStats own, FighterStats opp) {
        return own.getPunchesLanded() >= 15 && own.getPunchesLanded() >= 2 * opp.getPunchesLanded();
    }

    /**
     * Corners work on both fighters, then the next round opens.
     */
    private void runRestPeriod(List<FightEvent> events) {
        FightConfig config = fight.getConfig();
        for (Corner c : Corner.values()) {
            fight.getFighter(c).applyBetweenRoundRecovery(config.cornerSkill);
        }

        Round next = fight.startNextRound();
        effects.resetForRound();
        effects.updateFastStartForRound(next.getNumber());
        int roundsLeft = config.rounds - next.getNumber() + 1;
        for (Corner c : Corner.values()) {
            effects.onBehindOnCards(c, fight.getEstimatedScoreDiff(c), roundsLeft);
        }
        foulPolicy.resetRound();
        positionTracker.initializePositions(fight.getFighter(Corner.A), fight.getFighter(Corner.B));
        refreshAttributes();
        emit(events, new RoundStartEvent(next.getNumber()));
    }

    private void reportEnd(List<FightEvent> events) {
        endReported = true;
        FightResult result = fight.getResult();
        emit(events, new FightEndingEvent(result.winner(), result.method(), result.method().isKnockout()));
        emit(events, new FightEndEvent(result.winner(), result.method(), result.round(), result.time(),
            result.scorecards()));
        logger.info("[FightSimulator] {}", result.describe());
    }

    // ==================== The tick ====================

    private void runTick(List<FightEvent> events) {
        FightConfig config = fight.getConfig();
        double dt = config.tickRate;
        Round round = fight.getCurrentRound();
        Fighter a = fight.getFighter(Corner.A);
        Fighter b = fight.getFighter(Corner.B);
        tickCount++;

        // 1. clock
        if (fight.advanceClock(dt)) {
            endRound(events, round);
            return;
        }

        // 2. decisions
        Decision decisionA = decide(a, b);
        Decision decisionB = decide(b, a);

        // 3. fouls
        handleFouls(events, round);
        if (fight.isOver()) return;

        // 4. state transitions
        applyDecision(a, decisionA);
        applyDecision(b, decisionB);

        // 5. clinch
        boolean clinchBroken = handleClinch(events, round, dt);

        // 6. combat
        CombatResolution resolution = clinchBroken
            ? CombatResolution.empty()
            : combatResolver.resolve(a, b, decisionA, decisionB, fight);
        if (resolution == null) resolution = CombatResolution.empty();
        recordPunchesThrown(resolution, round);

        // 7. hits, misses and defence
        applyHits(events, resolution, round);
        applyMisses(resolution, round);
        recordDefence(resolution, round);

        // 8. stamina and position
        staminaManager.update(a, decisionA, dt);
        staminaManager.update(b, decisionB, dt);
        updatePositions(round, decisionA, decisionB, dt);

        // 9. knockdown
        KnockdownRequest knockdown = resolution.knockdown();
        if (knockdown != null && !fight.getFighter(knockdown.target()).isDown()) {
            knockdownProtocol.execute(knockdown, situation(knockdown.target()), e -> emit(events, e));
            clinchDuration = 0;
            fight.getReferee().resetClinch();
            if (fight.isOver()) return;
        }

        // 10. stoppage
        if (checkStoppages()) return;

        // 11. conditions and effects
        updateConditions(events, round, dt);

        // 12. tick event
        emit(events, new TickEvent(round.getNumber(), round.getCurrentTime(),
            FighterSnapshot.of(Corner.A, a), FighterSnapshot.of(Corner.B, b), positionTracker.getDistance()));
    }

    private Decision decide(Fighter fighter, Fighter opponent) {
        Decision d = decisionSource.decide(fighter, opponent, fight);
        return d == null ? Decision.hold(fighter.getState()) : d;
    }

    /**
     * Apply the chosen state. A hurt fighter stays hurt and a buzzed fighter stays
     * buzzed and defensive unless they tie up; a downed fighter is left alone.
     */
    private void applyDecision(Fighter fighter, Decision decision) {
        if (fighter.isDown()) return;
        FighterState next = decision.state();
        FighterSubState sub = decision.subState();
        if (fighter.isHurt() && next != FighterState.CLINCH) {
            next = FighterState.HURT;
            sub = null;
        } else if (fighter.isBuzzed() && next != FighterState.CLINCH) {
            next = FighterState.BUZZED;
            sub = sub instanceof DefensiveSubState ? sub : DefensiveSubState.HIGH_GUARD;
        }
        if (next != fighter.getState() || sub != fighter.getSubState()) {
            fighter.transitionTo(next, sub);
        }
    }

    private FightSituation situation(Corner corner) {
        Round round = fight.getCurrentRound();
        return new FightSituation(round == null ? 0 : round.getNumber(),
            fight.getEstimatedScoreDiff(corner), positionTracker.getDistance());
    }

    // ==================== Fouls ====================

    private void handleFouls(List<FightEvent> events, Round round) {
        Referee referee = fight.getReferee();
        for (Corner corner : Corner.values()) {
            Fighter attacker = fight.getFighter(corner);
            Fighter target = fight.getOpponent(corner);
            FoulType type = foulPolicy.shouldAttemptFoul(corner, attacker, situation(corner));
            if (type == null) continue;

            FoulResult foul = foulPolicy.executeFoul(corner, type, attacker, referee);
            round.recordFoul(corner, type.getDisplayName());
            Cut cut = foulPolicy.applyFoulEffects(foul, attacker, target, round.getNumber());
            emit(events, new FoulEvent(corner, foul.target(), type, foul.detected(), foul.consequence()));
            logger.debug("[FightSimulator] {} fouls: {} (detected={}, {})", attacker.getName(),
                type.getDisplayName(), foul.detected(), foul.consequence());
            if (cut != null) {
                emit(events, new CutEvent(foul.target(), cut.location(), cut.severity()));
                effects.onCutOpened(foul.target(), cut);
            }

            switch (foul.consequence()) {
                case WARNING:
                    emit(events, new RefereeCommandEvent(RefereeCommand.WARNING,
                        referee.issueCommand(RefereeCommand.WARNING, rng)));
                    break;
                case POINT_DEDUCTION:
                    round.recordPointDeduction(corner, type.getDisplayName());
                    emit(events, new PointDeductionEvent(corner, type.getDisplayName(), foul.totalDeductions()));
                    emit(events, new RefereeCommandEvent(RefereeCommand.POINT,
                        referee.issueCommand(RefereeCommand.POINT, rng)));
                    break;
                case DISQUALIFICATION:
                    emit(events, new RefereeCommandEvent(RefereeCommand.STOP,
                        referee.issueCommand(RefereeCommand.STOP, rng)));
                    fight.stopFight(FightMethod.DISQUALIFICATION, corner.opponent(),
                        attacker.getName() + " disqualified for " + type.getDisplayName(), null);
                    return;
                default:
                    break;
            }
        }
    }

    // ==================== Clinch ====================

    /**
     * @return whether the referee broke the clinch this tick
     */
    private boolean handleClinch(List<FightEvent> events, Round round, double dt) {
        Fighter a = fight.getFighter(Corner.A);
        Fighter b = fight.getFighter(Corner.B);
        boolean aHolding = a.getState() == FighterState.CLINCH;
        boolean bHolding = b.getState() == FighterState.CLINCH;
        Referee referee = fight.getReferee();

        if (!aHolding && !bHolding) {
            if (clinchDuration > 0) {
                clinchDuration = 0;
                referee.resetClinch();
            }
            return false;
        }

        if (clinchDuration == 0) {
            round.recordClinchInitiated(aHolding ? Corner.A : Corner.B);
        }
        clinchDuration += dt;
        round.recordClinchTime(dt);

        ClinchCall call = referee.checkClinchBreak(clinchDuration, a, b,
            fight.getConfig().rules.maxClinchDuration(), rng);
        if (call.action() == ClinchCall.Action.WARN) {
            emit(events, new RefereeCommandEvent(RefereeCommand.WORK, referee.issueCommand(RefereeCommand.WORK, rng)));
        } else if (call.isBreak()) {
            emit(events, new RefereeCommandEvent(RefereeCommand.BREAK, referee.issueCommand(RefereeCommand.BREAK, rng)));
            positionTracker.separateFighters(CLINCH_SEPARATION);
            if (aHolding) a.transitionTo(FighterState.NEUTRAL, null);
            if (bHolding) b.transitionTo(FighterState.NEUTRAL, null);
            referee.resetClinch();
            clinchDuration = 0;
            return true;
        }
        return false;
    }

    // ==================== Combat ====================

    private void recordPunchesThrown(CombatResolution resolution, Round round) {
        List<List<PunchOutcome>> groups = List.of(
            resolution.hits(), resolution.misses(), resolution.blocks(), resolution.evades());
        for (List<PunchOutcome> group : groups) {
            for (PunchOutcome punch : group) {
                round.recordPunchThrown(punch.attacker(), punch.punchType());
                thrownInWindow.merge(punch.attacker(), 1, Integer::sum);
            }
        }
    }

    private void applyHits(List<FightEvent> events, CombatResolution resolution, Round round) {
        for (PunchOutcome hit : resolution.hits()) {
            Corner attackerCorner = hit.attacker();
            Corner targetCorner = hit.target();
            Fighter attacker = fight.getFighter(attackerCorner);
            Fighter target = fight.getFighter(targetCorner);
            if (target.isDown()) continue;

            double damage = damageCalculator.calculateDamage(hit, attacker, target);
            if (Double.isNaN(damage) || damage < 0) damage = 0;

            target.takeDamage(damage, hit.location());
            round.recordPunchLanded(attackerCorner, hit.punchType(), hit.location(), hit.quality(), damage, hit.counter());
            emit(events, new PunchLandedEvent(attackerCorner, targetCorner, hit.punchType(), hit.location(),
                damage, hit.quality(), hit.counter()));
            effects.onPunchLanded(attackerCorner, damage, hit.punchType().isPowerPunch());

            if (hit.location() == HitLocation.HEAD && damage > CUT_DAMAGE_THRESHOLD && rng.nextDouble() < CUT_CHANCE) {
                CutLocation[] locations = CutLocation.values();
                Cut cut = target.addCut(locations[rng.nextInt(locations.length)], round.getNumber());
                emit(events, new CutEvent(targetCorner, cut.location(), cut.severity()));
                effects.onCutOpened(targetCorner, cut);
            }

            if (hit.causedStun() || damage >= 3) {
                target.applyStun(damage, hit.punchType());
            }

            if (!target.isHurt() && damage >= 3 && damage < 6 && hit.location() == HitLocation.HEAD) {
                double buzzChance = (damage - 2) * 0.15 + (1 - target.getAttribute(Attribute.CHIN) / 150.0);
                if (rng.nextDouble() < buzzChance && target.setBuzzed(damage, hit.punchType())) {
                    emit(events, new BuzzedEvent(targetCorner, target.getBuzzedSeverity(), target.getBuzzedDuration()));
                }
            }

            if (damageCalculator.checkHurt(target, damage)) {
                boolean alreadyHurt = target.isHurt();
                target.setHurt(3 + rng.nextDouble() * 3);
                if (!alreadyHurt) {
                    emit(events, new HurtEvent(targetCorner, target.getHurtDuration()));
                    effects.onFighterHurt(targetCorner, attacker);
                }
            }

            target.spendStamina(staminaManager.calculateHitStaminaCost(damage, hit.location(), attacker));
        }
    }

    private void applyMisses(CombatResolution resolution, Round round) {
        for (PunchOutcome miss : resolution.misses()) {
            Fighter attacker = fight.getFighter(miss.attacker());
            round.recordPunchMissed(miss.attacker());
            attacker.spendStamina(staminaManager.calculateMissStaminaCost(miss.punchType(), attacker));
        }
    }

    private void recordDefence(CombatResolution resolution, Round round) {
        for (PunchOutcome block : resolution.blocks()) {
            round.recordDefense(block.target(), block.defense() == null ? DefenseMove.HIGH_GUARD : block.defense());
        }
        for (PunchOutcome evade : resolution.evades()) {
            round.recordDefense(evade.target(), evade.defense() == null ? DefenseMove.SLIP : evade.defense());
        }
    }

    // ==================== Position ====================

    private void updatePositions(Round round, Decision decisionA, Decision decisionB, double dt) {
        Fighter a = fight.getFighter(Corner.A);
        Fighter b = fight.getFighter(Corner.B);
        positionTracker.update(a, b, decisionA, decisionB, dt);

        for (Corner c : Corner.values()) {
            Fighter f = fight.getFighter(c);
            if (positionTracker.isOnRopes(f)) round.recordRopeTime(c, dt);
            if (positionTracker.isInCorner(f)) round.recordCornerTime(c, dt);

            Decision d = c == Corner.A ? decisionA : decisionB;
            MoveDirection direction = d.action().type() == ActionType.MOVE ? d.action().direction() : null;
            if (direction == MoveDirection.FORWARD || d.subState() == MovementSubState.CUTTING_OFF) {
                round.recordForwardMovement(c, dt);
            } else if (direction == MoveDirection.BACKWARD || d.subState() == MovementSubState.RETREATING) {
                round.recordBackwardMovement(c, dt);
            }
        }
        Corner centre = positionTracker.getCenterControl();
        if (centre != null) round.recordCenterControl(centre, dt);
    }

    // ==================== Stoppage ====================

    /**
     * @return whether the fight was stopped
     */
    private boolean checkStoppages() {
        for (Corner c : Corner.values()) {
            StoppageDecision decision = stoppageEvaluator.evaluate(fight.getFighter(c), fight.getOpponent(c), fight);
            if (decision.stop()) {
                logger.debug("[FightSimulator] Stoppage of {}: {} ({}, p={})", fight.getFighter(c).getName(),
                    decision.method(), decision.reason(), decision.probability());
                fight.stopFight(decision.method(), c.opponent(), decision.reason(), null);
                return true;
            }
        }
        return false;
    }

    // ==================== Conditions ====================

    private void updateConditions(List<FightEvent> events, Round round, double dt) {
        for (Corner c : Corner.values()) {
            Fighter f = fight.getFighter(c);
            f.updateStun(dt);
            f.updateBuzzed(rng);
            f.tickConditions();
        }
        effects.tick();

        int totalRounds = fight.getConfig().rounds;
        for (Corner c : Corner.values()) {
            Fighter f = fight.getFighter(c);
            double stamina = f.getStaminaPercent();
            if (stamina < 0.3) effects.onStaminaLow(c, stamina);
            if (round.getNumber() >= totalRounds - 2
                && effects.checkSecondWind(c, f, round.getNumber(), totalRounds)) {
                emit(events, new EffectTriggeredEvent(c, EffectType.SECOND_WIND, "second wind"));
            }
            effects.checkFocusLapse(c, f);
        }

        Corner shift = effects.checkMomentumShift();
        if (shift != null) {
            emit(events, new MomentumShiftEvent(shift, effects.getMomentum(shift)));
        }

        if (tickCount % HIGH_OUTPUT_WINDOW_TICKS == 0) {
            for (Corner c : Corner.values()) {
                effects.onHighOutput(c, thrownInWindow.get(c));
                thrownInWindow.put(c, 0);
            }
        }

        refreshAttributes();
    }

    private void refreshAttributes() {
        for (Corner c : Corner.values()) {
            Fighter f = fight.getFighter(c);
            f.setEffectModifiers(effects.getAttributeModifiers(c));
            f.updateModifiedAttributes();
        }
    }

    // ==================== Accessors ====================

    public Fight getFight() { return fight; }
    public FightEffectsEngine getEffects() { return effects; }
    public FoulPolicy getFoulPolicy() { return foulPolicy; }
    public PositionTracker getPositionTracker() { return positionTracker; }
    public long getTickCount() { return tickCount; }
}

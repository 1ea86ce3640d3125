package com.example.ringside.fight;

import com.example.ringside.model.Corner;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.InvalidFightConfigurationException;
import com.example.ringside.model.InvalidFighterReferenceException;
import com.example.ringside.model.PunchType;
import com.example.ringside.official.Referee;
import com.example.ringside.util.ModelParameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Aggregate for one bout: the two fighters, the officials, the rounds and the cards.
 *
 * Status moves NOT_STARTED -> IN_PROGRESS <-> BETWEEN_ROUNDS -> STOPPED | COMPLETED,
 * and every move is checked against {@link FightStatus#canTransitionTo}.
 */
public class Fight {

    private final Map<Corner, Fighter> fighters = new EnumMap<>(Corner.class);
    private final FightConfig config;
    private final Referee referee;
    private final List<Judge> judges;
    private final List<Scorecard> scorecards = new ArrayList<>();
    private final List<Round> rounds = new ArrayList<>();
    private final RoundScorer scorer;
    private final double significantStrikeDamage;

    private FightStatus status = FightStatus.NOT_STARTED;
    private FightResult result;
    private double elapsedTime;

    public Fight(Fighter fighterA, Fighter fighterB, FightConfig config, Referee referee,
                 List<Judge> judges, ModelParameters params) {
        if (fighterA == null || fighterB == null) {
            throw new InvalidFightConfigurationException("A fight needs two fighters");
        }
        if (fighterA == fighterB || fighterA.getId().equals(fighterB.getId())) {
            throw new InvalidFightConfigurationException("Fighters must have distinct ids: " + fighterA.getId());
        }
        List<Judge> panel = judges == null ? Judge.defaultPanel() : judges;
        if (panel.size() != 3) {
            throw new InvalidFightConfigurationException("A fight needs exactly three judges, got " + panel.size());
        }
        ModelParameters p = params == null ? ModelParameters.empty() : params;

        fighters.put(Corner.A, fighterA);
        fighters.put(Corner.B, fighterB);
        this.config = config == null ? new FightConfig() : config;
        this.referee = referee == null ? Referee.standard() : referee;
        this.judges = List.copyOf(panel);
        for (Judge j : this.judges) scorecards.add(new Scorecard(j.getName()));
        this.scorer = new RoundScorer(p);
        this.significantStrikeDamage = p.getDouble("scoring.significantStrikeDamage", 6);
    }

    public Fight(Fighter fighterA, Fighter fighterB, FightConfig config) {
        this(fighterA, fighterB, config, null, null, null);
    }

    // ===== Fighters =====

    public Fighter getFighter(Corner corner) {
        return fighters.get(corner);
    }

    /**
     * Look up a fighter by corner label ("A"/"B") or by fighter id.
     * @throws InvalidFighterReferenceException if neither matches
     */
    public Fighter getFighter(String id) {
        return fighters.get(getCorner(id));
    }

    public Corner getCorner(String id) {
        if (id != null) {
            for (Map.Entry<Corner, Fighter> e : fighters.entrySet()) {
                if (e.getValue().getId().equals(id)) return e.getKey();
            }
        }
        return Corner.fromId(id);
    }

    public Corner getCorner(Fighter fighter) {
        for (Map.Entry<Corner, Fighter> e : fighters.entrySet()) {
            if (e.getValue() == fighter) return e.getKey();
        }
        throw new InvalidFighterReferenceException(fighter == null ? null : fighter.getId());
    }

    public Fighter getOpponent(Corner corner) {
        return fighters.get(corner.opponent());
    }

    // ===== Lifecycle =====

    /**
     * Open round one.
     */
    public Round start() {
        setStatus(FightStatus.IN_PROGRESS);
        return openRound(1);
    }

    public Round startNextRound() {
        if (status != FightStatus.BETWEEN_ROUNDS) {
            throw new IllegalStateException("Cannot start a round while " + status);
        }
        setStatus(FightStatus.IN_PROGRESS);
        return openRound(rounds.size() + 1);
    }

    private Round openRound(int number) {
        Round round = new Round(number, config.roundDuration, significantStrikeDamage);
        rounds.add(round);
        for (Corner c : Corner.values()) {
            fighters.get(c).resetForRound(round.ledger(c));
        }
        return round;
    }

    /**
     * Advance the fight clock alongside the round clock.
     * @return whether the round reached the bell
     */
    public boolean advanceClock(double dt) {
        Round round = getCurrentRound();
        if (round == null || round.isComplete()) return true;
        elapsedTime += dt;
        return round.tick(dt);
    }

    /**
     * Close the current round at the bell, have all three judges score it, and either
     * move to the rest period or, after the last round, decide the fight on the cards.
     *
     * @return the three scores for the round
     */
    public List<RoundScore> endRound(Random rng) {
        Round round = getCurrentRound();
        if (round == null) throw new IllegalStateException("No round in progress");
        round.finish();

        List<RoundScore> scores = new ArrayList<>();
        for (int i = 0; i < judges.size(); i++) {
            RoundScore s = scorer.calculateJudgeScore(judges.get(i), round, config.homeCorner, rng);
            scores.add(s);
            scorecards.get(i).addRound(s);
        }
        round.setScores(scores);
        archiveRound(round);

        if (round.getNumber() >= config.rounds) {
            finishByDecision();
        } else {
            setStatus(FightStatus.BETWEEN_ROUNDS);
        }
        return scores;
    }

    private void archiveRound(Round round) {
        for (Corner c : Corner.values()) {
            fighters.get(c).archiveRound(round.ledger(c));
        }
    }

    /**
     * Tally the cards. Two of three judges decide; otherwise it is a draw.
     */
    public FightResult finishByDecision() {
        int winsA = 0;
        int winsB = 0;
        int draws = 0;
        for (Scorecard card : scorecards) {
            Corner w = card.getWinner();
            if (w == Corner.A) winsA++;
            else if (w == Corner.B) winsB++;
            else draws++;
        }

        Corner winner = null;
        FightMethod method;
        if (winsA >= 2 || winsB >= 2) {
            winner = winsA >= 2 ? Corner.A : Corner.B;
            int wins = Math.max(winsA, winsB);
            if (wins == 3) method = FightMethod.DECISION_UNANIMOUS;
            else if (draws == 1) method = FightMethod.DECISION_MAJORITY;
            else method = FightMethod.DECISION_SPLIT;
        } else if (draws == 3) {
            method = FightMethod.DRAW_UNANIMOUS;
        } else if (draws == 2) {
            method = FightMethod.DRAW_MAJORITY;
        } else {
            method = FightMethod.DRAW_SPLIT;
        }

        Round last = getCurrentRound();
        setStatus(FightStatus.COMPLETED);
        result = new FightResult(winner, method, last == null ? 0 : last.getNumber(),
            last == null ? 0 : last.getCurrentTime(), copyScorecards(), "Went the distance", null);
        return result;
    }

    /**
     * End the fight inside the distance. Terminal: a second call is ignored.
     */
    public FightResult stopFight(FightMethod method, Corner winner, String details, PunchType finishingPunch) {
        if (status.isTerminal()) return result;
        Round round = getCurrentRound();
        int roundNumber = round == null ? 0 : round.getNumber();
        double time = round == null ? 0 : round.getCurrentTime();
        if (round != null && !round.isComplete()) {
            round.stop(method.getDisplayName() + (details == null ? "" : ": " + details));
            archiveRound(round);
        }
        setStatus(FightStatus.STOPPED);
        result = new FightResult(winner, method, roundNumber, time, copyScorecards(), details, finishingPunch);
        return result;
    }

    private List<Scorecard> copyScorecards() {
        List<Scorecard> out = new ArrayList<>();
        for (Scorecard s : scorecards) out.add(s.copy());
        return out;
    }

    private void setStatus(FightStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Fight cannot go from " + status + " to " + next);
        }
        status = next;
    }

    // ===== Queries =====

    /**
     * Average card margin for the corner across all judges; positive means ahead.
     */
    public double getEstimatedScoreDiff(Corner corner) {
        if (scorecards.isEmpty()) return 0;
        double sum = 0;
        for (Scorecard s : scorecards) {
            sum += s.getTotal(corner) - s.getTotal(corner.opponent());
        }
        return sum / scorecards.size();
    }

    public Round getCurrentRound() {
        return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
    }

    public int getCurrentRoundNumber() {
        return rounds.size();
    }

    public boolean isFinalRound() {
        return rounds.size() >= config.rounds;
    }

    public boolean isOver() {
        return status.isTerminal();
    }

    public List<Round> getRounds() { return Collections.unmodifiableList(rounds); }
    public List<Scorecard> getScorecards() { return Collections.unmodifiableList(scorecards); }
    public List<Judge> getJudges() { return judges; }
    public FightConfig getConfig() { return config; }
    public Referee getReferee() { return referee; }
    public FightStatus getStatus() { return status; }
    public FightResult getResult() { return result; }
    public double getElapsedTime() { return elapsedTime; }
}

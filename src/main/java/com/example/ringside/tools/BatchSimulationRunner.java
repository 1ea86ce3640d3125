package com.example.ringside.tools;

import com.example.ringside.fight.Fight;
import com.example.ringside.fight.FightConfig;
import com.example.ringside.fight.FightMethod;
import com.example.ringside.fight.FightResult;
import com.example.ringside.model.Corner;
import com.example.ringside.model.Fighter;
import com.example.ringside.sim.ReferenceSimulation;
import com.example.ringside.util.FighterLoadException;
import com.example.ringside.util.FighterLoader;
import com.example.ringside.util.ModelParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

/**
 * Runs a matchup many times in batch mode and logs how the fights ended.
 *
 * Usage: {@code BatchSimulationRunner <fighterA.yaml> <fighterB.yaml> [fights] [seed] [rounds]}.
 * Fighter arguments are file paths, or classpath resources when no such file exists.
 */
public class BatchSimulationRunner {
    private static final Logger logger = LoggerFactory.getLogger(BatchSimulationRunner.class);

    private final String fighterA;
    private final String fighterB;
    private final int rounds;
    private final ModelParameters params;

    private final Map<Corner, Integer> wins = new EnumMap<>(Corner.class);
    private final Map<FightMethod, Integer> methods = new EnumMap<>(FightMethod.class);
    private int draws;
    private int totalRounds;
    private int fights;

    public BatchSimulationRunner(String fighterA, String fighterB, int rounds, ModelParameters params) {
        this.fighterA = fighterA;
        this.fighterB = fighterB;
        this.rounds = rounds;
        this.params = params;
        for (Corner c : Corner.values()) wins.put(c, 0);
    }

    /**
     * Run {@code count} fights, each with its own seed drawn from {@code seed}.
     * Fighters are reloaded for every fight so no state carries over.
     */
    public void run(int count, long seed) throws FighterLoadException {
        Random seeds = new Random(seed);
        for (int i = 0; i < count; i++) {
            Fight fight = new Fight(load(fighterA), load(fighterB), new FightConfig(rounds), null, null, params);
            FightResult result = ReferenceSimulation.create(fight, new Random(seeds.nextLong()), params).runToCompletion();
            record(result);
            logger.debug("[Batch] Fight {}: {}", i + 1, result.describe());
        }
    }

    void record(FightResult result) {
        fights++;
        methods.merge(result.method(), 1, Integer::sum);
        totalRounds += result.round();
        if (result.winner() == null) {
            draws++;
        } else {
            wins.merge(result.winner(), 1, Integer::sum);
        }
    }

    public void report() {
        if (fights == 0) {
            logger.info("[Batch] No fights run");
            return;
        }
        logger.info("[Batch] {} fights over {} scheduled rounds", fights, rounds);
        logger.info("[Batch] {} wins: {} ({})", Corner.A.getDisplayName(), wins.get(Corner.A), percent(wins.get(Corner.A)));
        logger.info("[Batch] {} wins: {} ({})", Corner.B.getDisplayName(), wins.get(Corner.B), percent(wins.get(Corner.B)));
        logger.info("[Batch] Draws: {} ({})", draws, percent(draws));
        methods.forEach((method, n) -> logger.info("[Batch]   {} -> {} ({})", method.getDisplayName(), n, percent(n)));
        logger.info("[Batch] Average length: {} rounds", String.format("%.2f", (double) totalRounds / fights));
    }

    public int getFights() { return fights; }
    public int getWins(Corner corner) { return wins.get(corner); }
    public int getDraws() { return draws; }
    public Map<FightMethod, Integer> getMethods() { return Map.copyOf(methods); }

    private String percent(int n) {
        return String.format("%.1f%%", 100.0 * n / fights);
    }

    private static Fighter load(String ref) throws FighterLoadException {
        Path path = Path.of(ref);
        if (Files.isRegularFile(path)) return FighterLoader.loadFile(path);
        return FighterLoader.loadResource(ref.startsWith("/") ? ref : "/" + ref);
    }

    public static void main(String[] args) {
        if (args.length < 2) {
            logger.error("Usage: BatchSimulationRunner <fighterA.yaml> <fighterB.yaml> [fights] [seed] [rounds]");
            System.exit(2);
        }
        int count = args.length > 2 ? Integer.parseInt(args[2]) : 100;
        long seed = args.length > 3 ? Long.parseLong(args[3]) : System.currentTimeMillis();
        int rounds = args.length > 4 ? Integer.parseInt(args[4]) : FightConfig.DEFAULT_ROUNDS;

        BatchSimulationRunner runner = new BatchSimulationRunner(args[0], args[1], rounds, ModelParameters.loadDefault());
        try {
            runner.run(count, seed);
        } catch (FighterLoadException e) {
            logger.error("[Batch] {}", e.getMessage());
            System.exit(1);
        }
        runner.report();
    }
}

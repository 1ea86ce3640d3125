package com.example.ringside;

import com.example.ringside.fight.FightMethod;
import com.example.ringside.model.Corner;
import com.example.ringside.tools.BatchSimulationRunner;
import com.example.ringside.util.FighterLoadException;
import com.example.ringside.util.ModelParameters;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BatchSimulationRunner Tests")
class BatchSimulationRunnerTest {

    @Test
    @DisplayName("Every fight in a batch is tallied exactly once")
    void tallies() throws Exception {
        BatchSimulationRunner runner = new BatchSimulationRunner(
            "fighters/slugger.yaml", "/fighters/boxer.yaml", 2, ModelParameters.loadDefault());
        runner.run(4, 11L);
        runner.report();

        assertEquals(4, runner.getFights());
        assertEquals(4, runner.getWins(Corner.A) + runner.getWins(Corner.B) + runner.getDraws());
        int byMethod = 0;
        for (int n : runner.getMethods().values()) byMethod += n;
        assertEquals(4, byMethod);
    }

    @Test
    @DisplayName("The same seed gives the same batch")
    void reproducible() throws Exception {
        BatchSimulationRunner one = new BatchSimulationRunner("fighters/slugger.yaml", "fighters/boxer.yaml", 2, null);
        BatchSimulationRunner two = new BatchSimulationRunner("fighters/slugger.yaml", "fighters/boxer.yaml", 2, null);
        one.run(3, 77L);
        two.run(3, 77L);
        Map<FightMethod, Integer> methods = one.getMethods();
        assertEquals(methods, two.getMethods());
        assertEquals(one.getWins(Corner.A), two.getWins(Corner.A));
    }

    @Test
    @DisplayName("An unknown fighter fails the batch up front")
    void unknownFighter() {
        BatchSimulationRunner runner = new BatchSimulationRunner("fighters/slugger.yaml", "fighters/nobody.yaml", 2, null);
        assertThrows(FighterLoadException.class, () -> runner.run(1, 1L));
        assertEquals(0, runner.getFights());
    }
}

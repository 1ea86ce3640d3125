package com.example.ringside.engine;

import com.example.ringside.model.Corner;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Everything that happened between the two fighters in one tick.
 */
public record CombatResolution(
    List<PunchOutcome> hits,
    List<PunchOutcome> misses,
    List<PunchOutcome> blocks,
    List<PunchOutcome> evades,
    KnockdownRequest knockdown,
    Map<Corner, Action> actions
) {
    public CombatResolution {
        hits = hits == null ? List.of() : List.copyOf(hits);
        misses = misses == null ? List.of() : List.copyOf(misses);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        evades = evades == null ? List.of() : List.copyOf(evades);
        actions = actions == null || actions.isEmpty()
            ? Collections.emptyMap() : Collections.unmodifiableMap(new EnumMap<>(actions));
    }

    public static CombatResolution empty() {
        return new CombatResolution(null, null, null, null, null, null);
    }

    /** Every punch thrown this tick, whatever became of it. */
    public int punchesThrown() {
        return hits.size() + misses.size() + blocks.size() + evades.size();
    }
}

package com.example.ringside.model;

import com.example.ringside.official.FoulType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * How willing a fighter is to foul, and which fouls they lean on (weights 0-100).
 */
public class FoulTactics {

    private final int dirtiness;
    private final Map<FoulType, Integer> tendencies;

    public FoulTactics(int dirtiness, Map<FoulType, Integer> tendencies) {
        this.dirtiness = Math.max(0, Math.min(100, dirtiness));
        Map<FoulType, Integer> m = new EnumMap<>(FoulType.class);
        if (tendencies != null) {
            tendencies.forEach((k, v) -> m.put(k, Math.max(0, Math.min(100, v == null ? 0 : v))));
        }
        this.tendencies = Collections.unmodifiableMap(m);
    }

    public static FoulTactics clean() {
        return new FoulTactics(0, Collections.emptyMap());
    }

    public int getDirtiness() {
        return dirtiness;
    }

    public int getTendency(FoulType type) {
        return tendencies.getOrDefault(type, 0);
    }

    public Map<FoulType, Integer> getTendencies() {
        return tendencies;
    }
}

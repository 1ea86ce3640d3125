package com.example.ringside.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * A buff or debuff on a fighter. Effects are percentage changes per target,
 * so {@code SPEED -> -25} slows hand and foot speed by a quarter.
 */
public record Modifier(
    UUID id,
    String source,
    boolean debuff,
    Map<ModifierTarget, Double> effects,
    long expiresAtTick
) {
    public Modifier {
        effects = effects == null || effects.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(effects));
    }

    public Modifier(String source, boolean debuff, Map<ModifierTarget, Double> effects, long expiresAtTick) {
        this(UUID.randomUUID(), source, debuff, effects, expiresAtTick);
    }

    /** expiresAtTick of 0 means permanent. */
    public boolean isExpired(long nowTick) {
        return expiresAtTick > 0 && nowTick >= expiresAtTick;
    }

    public static Map<ModifierTarget, Double> effects(Object... pairs) {
        Map<ModifierTarget, Double> map = new EnumMap<>(ModifierTarget.class);
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            map.put((ModifierTarget) pairs[i], ((Number) pairs[i + 1]).doubleValue());
        }
        return map;
    }
}

package com.example.ringside.effect;

/**
 * Read-only view of an effect for summaries and events.
 */
public record ActiveEffect(EffectType type, double intensity, int remainingTicks, int stacks) {

    static ActiveEffect of(FightEffect e) {
        return new ActiveEffect(e.getType(), e.getEffectiveIntensity(), e.getDuration(), e.getStacks());
    }
}

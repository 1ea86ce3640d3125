package com.example.ringside.effect;

import com.example.ringside.model.ModifierTarget;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * An active effect on one fighter. Durations are in ticks; a max duration of 0
 * means the effect stays until it is removed.
 */
public class FightEffect {
    private final EffectType type;
    private final String source;
    private final Map<ModifierTarget, Double> modifiers;
    private double intensity;
    private int duration;
    private final int maxDuration;
    private int stacks = 1;

    public FightEffect(EffectType type, double intensity, int duration, String source) {
        this(type, intensity, duration, source, type.getModifiers());
    }

    public FightEffect(EffectType type, double intensity, int duration, String source,
                       Map<ModifierTarget, Double> modifiers) {
        this.type = type;
        this.intensity = clampIntensity(intensity);
        this.duration = Math.max(0, duration);
        this.maxDuration = Math.max(0, duration);
        this.source = source;
        this.modifiers = new EnumMap<>(ModifierTarget.class);
        if (modifiers != null) this.modifiers.putAll(modifiers);
    }

    private static double clampIntensity(double v) {
        if (Double.isNaN(v)) return 0;
        return Math.max(0, Math.min(1, v));
    }

    public boolean isPermanent() {
        return maxDuration == 0;
    }

    /**
     * Intensity after stacking and the fade over the last quarter of the duration.
     */
    public double getEffectiveIntensity() {
        double fade = 1.0;
        if (!isPermanent()) {
            double fadeStart = maxDuration * 0.25;
            if (duration < fadeStart && fadeStart > 0) fade = duration / fadeStart;
        }
        return intensity * stacks * fade;
    }

    public double getModifier(ModifierTarget target) {
        Double base = modifiers.get(target);
        return base == null ? 0 : base * getEffectiveIntensity();
    }

    /** @return true once the effect has run out */
    public boolean tick() {
        if (isPermanent()) return false;
        if (duration > 0) duration--;
        return duration <= 0;
    }

    /**
     * Re-apply: keep the stronger intensity, add a stack where allowed, and top up
     * the duration (by {@code additional} ticks, or half the max) up to the max.
     */
    public void refresh(double newIntensity, int additional) {
        intensity = Math.max(intensity, clampIntensity(newIntensity));
        if (type.getStackPolicy() == EffectType.StackPolicy.STACK && stacks < type.getMaxStacks()) {
            stacks++;
        }
        if (!isPermanent()) {
            int extra = additional > 0 ? additional : maxDuration / 2;
            duration = Math.min(maxDuration, duration + extra);
        }
    }

    /** Rescale the base modifiers, used as fast start wears off. */
    public void scaleModifiers(Map<ModifierTarget, Double> base, double factor) {
        for (Map.Entry<ModifierTarget, Double> e : base.entrySet()) {
            modifiers.put(e.getKey(), e.getValue() * factor);
        }
    }

    public EffectType getType() { return type; }
    public String getSource() { return source; }
    public double getIntensity() { return intensity; }
    public int getDuration() { return duration; }
    public int getMaxDuration() { return maxDuration; }
    public int getStacks() { return stacks; }
    public Map<ModifierTarget, Double> getModifiers() { return Collections.unmodifiableMap(modifiers); }
}

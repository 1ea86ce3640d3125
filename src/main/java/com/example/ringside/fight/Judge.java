package com.example.ringside.fight;

import com.example.ringside.model.InvalidFightConfigurationException;

import java.util.List;

/**
 * A ringside judge. Consistency (0-100) limits how often a moderately clear
 * round is scored the wrong way.
 */
public class Judge {
    private final String name;
    private final String style;
    private final JudgePreferences preferences;
    private final double consistency;
    private final double knockdownWeight;
    private final double homeBias;

    public Judge(String name, String style, JudgePreferences preferences, double consistency,
                 double knockdownWeight, double homeBias) {
        if (name == null || name.isBlank()) {
            throw new InvalidFightConfigurationException("Judge name is required");
        }
        this.name = name;
        this.style = style == null ? "balanced" : style;
        this.preferences = preferences == null ? JudgePreferences.neutral() : preferences;
        this.consistency = Math.max(0, Math.min(100, consistency));
        this.knockdownWeight = knockdownWeight <= 0 ? 1.0 : knockdownWeight;
        this.homeBias = homeBias;
    }

    public Judge(String name, String style, JudgePreferences preferences, double consistency) {
        this(name, style, preferences, consistency, 1.0, 0);
    }

    /**
     * The standard panel: a technical, an action and a power judge.
     */
    public static List<Judge> defaultPanel() {
        return List.of(
            new Judge("Judge 1", "technical", new JudgePreferences(1.15, 1.2, 0.9, 1.1, 1.0, 0.85), 88),
            new Judge("Judge 2", "action", new JudgePreferences(0.95, 0.85, 1.2, 0.9, 1.05, 1.15), 82),
            new Judge("Judge 3", "power", new JudgePreferences(1.1, 0.95, 1.0, 0.95, 1.2, 1.0), 85)
        );
    }

    public String getName() { return name; }
    public String getStyle() { return style; }
    public JudgePreferences getPreferences() { return preferences; }
    public double getConsistency() { return consistency; }
    public double getKnockdownWeight() { return knockdownWeight; }
    public double getHomeBias() { return homeBias; }
}

package com.example.ringside.model;

/**
 * The two corners of a fight. Every per-fighter table in the engine is keyed by corner.
 */
public enum Corner {
    A("Red"),
    B("Blue");

    private final String displayName;

    Corner(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Corner opponent() {
        return this == A ? B : A;
    }

    /**
     * Resolve a corner label ("A" or "B", case-insensitive).
     * @throws InvalidFighterReferenceException for anything else
     */
    public static Corner fromId(String id) {
        if (id != null) {
            String trimmed = id.trim();
            if (trimmed.equalsIgnoreCase("A")) return A;
            if (trimmed.equalsIgnoreCase("B")) return B;
        }
        throw new InvalidFighterReferenceException(id);
    }
}

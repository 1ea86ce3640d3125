package com.example.ringside.model;

/**
 * A cut or swelling mark. Severity runs 1-5.
 */
public record Cut(CutLocation location, int severity, boolean swelling, int roundOpened) {

    public static final int MAX_SEVERITY = 5;

    public Cut {
        if (location == null) throw new IllegalArgumentException("Cut location is required");
        severity = Math.max(1, Math.min(MAX_SEVERITY, severity));
    }

    public Cut deepen() {
        return new Cut(location, Math.min(MAX_SEVERITY, severity + 1), swelling, roundOpened);
    }
}

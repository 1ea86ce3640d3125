package com.example.ringside.fight;

/**
 * How a fight was decided.
 */
public enum FightMethod {
    KO("Knockout", true),
    TKO_REFEREE("TKO (Referee Stoppage)", true),
    TKO_CORNER("TKO (Corner Retirement)", true),
    TKO_DOCTOR("TKO (Doctor Stoppage)", true),
    TKO_INJURY("TKO (Injury)", true),
    TKO_THREE_KNOCKDOWNS("TKO (Three Knockdowns)", true),
    DECISION_UNANIMOUS("Unanimous Decision", false),
    DECISION_SPLIT("Split Decision", false),
    DECISION_MAJORITY("Majority Decision", false),
    DRAW_UNANIMOUS("Unanimous Draw", false),
    DRAW_SPLIT("Split Draw", false),
    DRAW_MAJORITY("Majority Draw", false),
    NO_CONTEST("No Contest", true),
    DISQUALIFICATION("Disqualification", true);

    private final String displayName;
    private final boolean stoppage;

    FightMethod(String displayName, boolean stoppage) {
        this.displayName = displayName;
        this.stoppage = stoppage;
    }

    public String getDisplayName() { return displayName; }

    public boolean isStoppage() { return stoppage; }

    public boolean isKnockout() { return this == KO; }

    public boolean isDraw() {
        return this == DRAW_UNANIMOUS || this == DRAW_SPLIT || this == DRAW_MAJORITY;
    }

    public boolean isDecision() {
        return !stoppage;
    }
}

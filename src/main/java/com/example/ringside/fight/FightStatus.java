package com.example.ringside.fight;

/**
 * Lifecycle of a fight. STOPPED and COMPLETED are terminal.
 */
public enum FightStatus {

    NOT_STARTED("Not Started"),
    IN_PROGRESS("In Progress"),
    BETWEEN_ROUNDS("Between Rounds"),
    /** Ended inside the distance: KO, TKO or disqualification */
    STOPPED("Stopped"),
    /** Went the distance and was scored */
    COMPLETED("Completed");

    private final String displayName;

    FightStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isTerminal() {
        return this == STOPPED || this == COMPLETED;
    }

    public boolean canTransitionTo(FightStatus next) {
        switch (this) {
            case NOT_STARTED:
                return next == IN_PROGRESS;
            case IN_PROGRESS:
                return next == BETWEEN_ROUNDS || next == STOPPED || next == COMPLETED;
            case BETWEEN_ROUNDS:
                return next == IN_PROGRESS || next == STOPPED;
            default:
                return false;
        }
    }
}

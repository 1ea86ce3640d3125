package com.example.ringside.model;

/**
 * Thrown when a fighter is looked up by an id or corner label that is not part of the fight.
 */
public class InvalidFighterReferenceException extends IllegalArgumentException {

    private final String fighterId;

    public InvalidFighterReferenceException(String fighterId) {
        super("Unknown fighter reference: " + fighterId);
        this.fighterId = fighterId;
    }

    public String getFighterId() {
        return fighterId;
    }
}

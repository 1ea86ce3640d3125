package com.example.ringside.model;

/**
 * Thrown when a fight, fighter or official is built from unusable settings.
 */
public class InvalidFightConfigurationException extends IllegalArgumentException {

    public InvalidFightConfigurationException(String message) {
        super(message);
    }
}

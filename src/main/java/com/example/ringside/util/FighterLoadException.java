package com.example.ringside.util;

/**
 * A fighter definition could not be read or is missing a required field.
 */
public class FighterLoadException extends Exception {

    public FighterLoadException(String message) {
        super(message);
    }

    public FighterLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}

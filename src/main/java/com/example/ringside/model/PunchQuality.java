package com.example.ringside.model;

/**
 * How squarely a punch landed. Clean punches weigh most on the cards.
 */
public enum PunchQuality {
    CLEAN,
    PARTIAL
}

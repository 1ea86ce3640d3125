package com.example.ringside.fight;

import com.example.ringside.model.Corner;

/**
 * Entry in a round's running log. The corner is null for neutral entries.
 */
public record RoundEvent(double time, String type, Corner corner, String detail) {
}

package com.example.ringside.engine;

import com.example.ringside.model.Corner;
import com.example.ringside.model.DefenseMove;
import com.example.ringside.model.HitLocation;
import com.example.ringside.model.PunchQuality;
import com.example.ringside.model.PunchType;

/**
 * One punch as resolved by the combat resolver. Landed punches carry damage and
 * quality; blocked and evaded ones carry the defence that stopped them.
 */
public record PunchOutcome(
    Corner attacker,
    PunchType punchType,
    HitLocation location,
    double damage,
    PunchQuality quality,
    boolean counter,
    boolean causedStun,
    DefenseMove defense
) {
    public PunchOutcome {
        if (attacker == null || punchType == null) {
            throw new IllegalArgumentException("A punch needs an attacker and a punch type");
        }
        if (location == null) location = punchType.getDefaultLocation();
        if (quality == null) quality = PunchQuality.CLEAN;
        if (Double.isNaN(damage) || damage < 0) damage = 0;
    }

    public Corner target() {
        return attacker.opponent();
    }

    public static PunchOutcome landed(Corner attacker, PunchType type, double damage, PunchQuality quality, boolean counter) {
        return new PunchOutcome(attacker, type, type.getDefaultLocation(), damage, quality, counter, false, null);
    }

    public static PunchOutcome stopped(Corner attacker, PunchType type, DefenseMove defense) {
        return new PunchOutcome(attacker, type, type.getDefaultLocation(), 0, PunchQuality.PARTIAL, false, false, defense);
    }

    public static PunchOutcome missed(Corner attacker, PunchType type) {
        return new PunchOutcome(attacker, type, type.getDefaultLocation(), 0, PunchQuality.PARTIAL, false, false, null);
    }
}

package com.example.ringside.event;

import com.example.ringside.model.Corner;
import com.example.ringside.model.Cut;
import com.example.ringside.model.Fighter;
import com.example.ringside.model.FighterState;
import com.example.ringside.model.FighterSubState;
import com.example.ringside.model.Position;

import java.util.List;

/**
 * Frozen copy of a fighter's condition at one moment.
 */
public record FighterSnapshot(
    Corner corner,
    String id,
    String name,
    FighterState state,
    FighterSubState subState,
    double stamina,
    double maxStamina,
    double headDamage,
    double maxHeadDamage,
    double bodyDamage,
    double maxBodyDamage,
    boolean hurt,
    boolean buzzed,
    int buzzedSeverity,
    int stunLevel,
    int knockdownsThisRound,
    int knockdownsTotal,
    Position position,
    List<Cut> cuts
) {
    public static FighterSnapshot of(Corner corner, Fighter f) {
        return new FighterSnapshot(corner, f.getId(), f.getName(), f.getState(), f.getSubState(),
            f.getStamina(), f.getMaxStamina(), f.getHeadDamage(), f.getMaxHeadDamage(),
            f.getBodyDamage(), f.getMaxBodyDamage(), f.isHurt(), f.isBuzzed(), f.getBuzzedSeverity(),
            f.getStunLevel(), f.getKnockdownsThisRound(), f.getKnockdownsTotal(), f.getPosition(),
            List.copyOf(f.getCuts()));
    }

    public double staminaPercent() {
        return stamina / maxStamina;
    }
}

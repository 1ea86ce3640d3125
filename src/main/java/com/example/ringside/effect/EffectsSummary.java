package com.example.ringside.effect;

import java.util.List;

public record EffectsSummary(List<ActiveEffect> buffs, List<ActiveEffect> debuffs, double momentum) {

    public boolean has(EffectType type) {
        for (ActiveEffect e : buffs) if (e.type() == type) return true;
        for (ActiveEffect e : debuffs) if (e.type() == type) return true;
        return false;
    }
}

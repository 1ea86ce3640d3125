package com.example.ringside.event;

public enum EventType {
    FIGHT_START,
    ROUND_START,
    ROUND_END,
    TICK,
    PUNCH_LANDED,
    KNOCKDOWN,
    FLASH_KNOCKDOWN,
    COUNT,
    RECOVERY,
    HURT,
    BUZZED,
    CUT,
    FOUL,
    POINT_DEDUCTION,
    REFEREE_COMMAND,
    MOMENTUM_SHIFT,
    EFFECT_TRIGGERED,
    FIGHT_ENDING,
    FIGHT_END
}

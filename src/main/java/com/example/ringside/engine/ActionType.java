package com.example.ringside.engine;

public enum ActionType {
    NONE,
    PUNCH,
    MOVE,
    DEFEND,
    CLINCH
}

package com.example.ringside.engine;

public enum MoveDirection {
    FORWARD,
    BACKWARD,
    LATERAL
}

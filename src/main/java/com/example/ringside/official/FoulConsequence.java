package com.example.ringside.official;

public enum FoulConsequence {
    /** Not seen by the referee */
    NONE,
    WARNING,
    POINT_DEDUCTION,
    DISQUALIFICATION
}

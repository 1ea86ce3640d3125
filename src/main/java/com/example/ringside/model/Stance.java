package com.example.ringside.model;

public enum Stance {
    ORTHODOX,
    SOUTHPAW,
    SWITCH
}

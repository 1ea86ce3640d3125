package com.example.ringside.model;

public enum HitLocation {
    HEAD,
    BODY
}

package com.example.ringside.model;

/**
 * The seven groups fighter attributes are organised into.
 * The key matches the section name used in fighter YAML files.
 */
public enum AttributeGroup {
    POWER("power"),
    SPEED("speed"),
    STAMINA("stamina"),
    DEFENSE("defense"),
    OFFENSE("offense"),
    TECHNICAL("technical"),
    MENTAL("mental");

    private final String key;

    AttributeGroup(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

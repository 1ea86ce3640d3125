package com.example.ringside.model;

public enum PunchType {
    JAB("Jab", HitLocation.HEAD),
    CROSS("Cross", HitLocation.HEAD),
    LEAD_HOOK("Lead Hook", HitLocation.HEAD),
    REAR_HOOK("Rear Hook", HitLocation.HEAD),
    LEAD_UPPERCUT("Lead Uppercut", HitLocation.HEAD),
    REAR_UPPERCUT("Rear Uppercut", HitLocation.HEAD),
    BODY_JAB("Body Jab", HitLocation.BODY),
    BODY_CROSS("Body Cross", HitLocation.BODY),
    BODY_HOOK_LEAD("Lead Body Hook", HitLocation.BODY),
    BODY_HOOK_REAR("Rear Body Hook", HitLocation.BODY);

    private final String displayName;
    private final HitLocation defaultLocation;

    PunchType(String displayName, HitLocation defaultLocation) {
        this.displayName = displayName;
        this.defaultLocation = defaultLocation;
    }

    public String getDisplayName() { return displayName; }
    public HitLocation getDefaultLocation() { return defaultLocation; }

    public boolean isJab() {
        return this == JAB || this == BODY_JAB;
    }

    public boolean isPowerPunch() {
        return !isJab();
    }

    public boolean isBodyPunch() {
        return defaultLocation == HitLocation.BODY;
    }

    public boolean isRearHand() {
        return this == CROSS || this == REAR_HOOK || this == REAR_UPPERCUT
            || this == BODY_CROSS || this == BODY_HOOK_REAR;
    }

    /** Head shots that lengthen a buzzed spell. */
    public boolean extendsBuzz() {
        return this == CROSS || this == REAR_HOOK || this == REAR_UPPERCUT
            || this == LEAD_HOOK || this == LEAD_UPPERCUT;
    }

    /** Shots that lengthen a stun. */
    public boolean extendsStun() {
        return this == CROSS || this == REAR_HOOK || this == REAR_UPPERCUT || this == BODY_HOOK_REAR;
    }
}

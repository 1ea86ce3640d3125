package com.example.ringside.model;

public enum CutLocation {
    LEFT_EYEBROW("left eyebrow", true),
    RIGHT_EYEBROW("right eyebrow", true),
    LEFT_EYE("left eye", true),
    RIGHT_EYE("right eye", true),
    NOSE("nose", false),
    LIP("lip", false);

    private final String displayName;
    private final boolean eyeArea;

    CutLocation(String displayName, boolean eyeArea) {
        this.displayName = displayName;
        this.eyeArea = eyeArea;
    }

    public String getDisplayName() { return displayName; }

    /** Cuts here impair vision. */
    public boolean isEyeArea() { return eyeArea; }
}

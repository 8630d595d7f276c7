package com.example.aspects.skill;

public enum TargetMode {
    SELF, SELECTED;

    public static TargetMode fromKey(String key) {
        return key != null && key.trim().equalsIgnoreCase("self") ? SELF : SELECTED;
    }
}

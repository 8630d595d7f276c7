package com.example.aspects.model;

public enum ProgressionType {
    RACE("race"), CLASS("class"), PROFESSION("profession");

    public final String key;

    ProgressionType(String key) {
        this.key = key;
    }

    public static ProgressionType fromKey(String key) {
        if (key == null) return null;
        for (ProgressionType t : values()) if (t.key.equalsIgnoreCase(key.trim())) return t;
        return null;
    }
}

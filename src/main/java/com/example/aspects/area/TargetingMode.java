package com.example.aspects.area;

public enum TargetingMode {
    ALL, ENEMIES, ALLIES;

    public static TargetingMode fromKey(String key) {
        if (key == null) return ALL;
        for (TargetingMode m : values()) if (m.name().equalsIgnoreCase(key.trim())) return m;
        return ALL;
    }
}

package com.example.aspects.model;

public enum ResourceType {
    HEALTH("health", "Health"),
    STAMINA("stamina", "Stamina"),
    MANA("mana", "Mana");

    public final String key;
    public final String displayName;

    ResourceType(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public static ResourceType fromKey(String key) {
        if (key == null) return null;
        for (ResourceType r : values()) if (r.key.equalsIgnoreCase(key.trim())) return r;
        return null;
    }
}

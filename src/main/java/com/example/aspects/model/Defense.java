package com.example.aspects.model;

/** The four offensive defenses an attack is rolled against. */
public enum Defense {
    MELEE, RANGED, MIND, SOUL;

    public static Defense fromKey(String key) {
        if (key == null) return null;
        for (Defense d : values()) if (d.name().equalsIgnoreCase(key.trim())) return d;
        return null;
    }
}

package com.example.aspects.model;

/** Physical damage is mitigated by armor, magical damage by veil. */
public enum DamageType {
    PHYSICAL, MAGICAL;

    public Stat mitigation() {
        return this == PHYSICAL ? Stat.ARMOR : Stat.VEIL;
    }

    public static DamageType fromKey(String key) {
        if (key == null) return PHYSICAL;
        return key.trim().equalsIgnoreCase("magical") ? MAGICAL : PHYSICAL;
    }
}

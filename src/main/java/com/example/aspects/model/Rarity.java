package com.example.aspects.model;

/** Item rarity; determines how many augment slots a new gear item receives. */
public enum Rarity {
    COMMON("common", 0),
    UNCOMMON("uncommon", 1),
    RARE("rare", 2),
    EPIC("epic", 3),
    LEGENDARY("legendary", 4),
    MYTHIC("mythic", 5);

    public final String key;
    public final int defaultAugmentSlots;

    Rarity(String key, int defaultAugmentSlots) {
        this.key = key;
        this.defaultAugmentSlots = defaultAugmentSlots;
    }

    public static Rarity fromKey(String key) {
        if (key == null) return COMMON;
        for (Rarity r : values()) if (r.key.equalsIgnoreCase(key.trim())) return r;
        return COMMON;
    }
}

package com.example.aspects.model;

/**
 * Gear slots with their default capacities. Capacities can be overridden from
 * the rules file (see {@code RulesConfig}).
 */
public enum EquipmentSlot {
    HEAD(1, "head", "Head", 1),
    NECK(2, "neck", "Neck", 1),
    SHOULDERS(3, "shoulders", "Shoulders", 1),
    CHEST(4, "chest", "Chest", 1),
    BACK(5, "back", "Back", 1),
    ARMS(6, "arms", "Arms", 1),
    WRISTS(7, "wrists", "Wrists", 1),
    HANDS(8, "hands", "Hands", 2),
    WAIST(9, "waist", "Waist", 1),
    LEGS(10, "legs", "Legs", 1),
    FEET(11, "feet", "Feet", 1),
    RING(12, "ring", "Ring", 10),
    TRINKET(13, "trinket", "Trinket", 2);

    public final int id;
    public final String key;
    public final String displayName;
    public final int defaultCapacity;

    EquipmentSlot(int id, String key, String displayName, int defaultCapacity) {
        this.id = id;
        this.key = key;
        this.displayName = displayName;
        this.defaultCapacity = defaultCapacity;
    }

    public int getId() { return id; }
    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    /** The hand slot holds weapons and shields and enforces the two-handed rule. */
    public boolean isHands() { return this == HANDS; }

    public static EquipmentSlot fromId(int id) {
        for (EquipmentSlot s : values()) if (s.id == id) return s;
        return null;
    }

    public static EquipmentSlot fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        // Handle common aliases
        if (k.equals("hand") || k.equals("weapon") || k.equals("main_hand") || k.equals("off_hand")) return HANDS;
        if (k.equals("boots") || k.equals("feet")) return FEET;
        if (k.equals("rings") || k.equals("finger")) return RING;
        for (EquipmentSlot s : values()) if (s.key.equals(k) || s.name().toLowerCase().equals(k)) return s;
        return null;
    }
}

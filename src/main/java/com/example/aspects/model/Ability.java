package com.example.aspects.model;

/**
 * The nine base abilities. Every derived value (resources, defenses, ranges)
 * is computed from the modifiers of these.
 */
public enum Ability {
    VITALITY("vitality", "Vitality", "vit"),
    ENDURANCE("endurance", "Endurance", "end"),
    STRENGTH("strength", "Strength", "str"),
    DEXTERITY("dexterity", "Dexterity", "dex"),
    TOUGHNESS("toughness", "Toughness", "tou"),
    INTELLIGENCE("intelligence", "Intelligence", "int"),
    WILLPOWER("willpower", "Willpower", "wil"),
    WISDOM("wisdom", "Wisdom", "wis"),
    PERCEPTION("perception", "Perception", "per");

    public final String key;
    public final String displayName;
    public final String abbreviation;

    Ability(String key, String displayName, String abbreviation) {
        this.key = key;
        this.displayName = displayName;
        this.abbreviation = abbreviation;
    }

    public String getKey() { return key; }
    public String getDisplayName() { return displayName; }

    /** Variable name used when binding this ability's modifier into a roll formula. */
    public String modVariable() { return key + ".mod"; }

    public static Ability fromKey(String key) {
        if (key == null) return null;
        String k = key.trim().toLowerCase();
        if (k.equals("will")) return WILLPOWER;
        for (Ability a : values()) {
            if (a.key.equals(k) || a.abbreviation.equals(k) || a.name().toLowerCase().equals(k)) return a;
        }
        return null;
    }
}

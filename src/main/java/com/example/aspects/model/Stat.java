package com.example.aspects.model;

/**
 * Attributes that an effect change may target: the nine abilities plus the
 * four defenses and two mitigations.
 */
public enum Stat {
    VITALITY("abilities.vitality", Ability.VITALITY),
    ENDURANCE("abilities.endurance", Ability.ENDURANCE),
    STRENGTH("abilities.strength", Ability.STRENGTH),
    DEXTERITY("abilities.dexterity", Ability.DEXTERITY),
    TOUGHNESS("abilities.toughness", Ability.TOUGHNESS),
    INTELLIGENCE("abilities.intelligence", Ability.INTELLIGENCE),
    WILLPOWER("abilities.willpower", Ability.WILLPOWER),
    WISDOM("abilities.wisdom", Ability.WISDOM),
    PERCEPTION("abilities.perception", Ability.PERCEPTION),

    MELEE_DEFENSE("defense.melee", null),
    RANGED_DEFENSE("defense.ranged", null),
    MIND_DEFENSE("defense.mind", null),
    SOUL_DEFENSE("defense.soul", null),
    ARMOR("defense.armor", null),
    VEIL("defense.veil", null);

    public final String path;
    private final Ability ability;

    Stat(String path, Ability ability) {
        this.path = path;
        this.ability = ability;
    }

    public String getPath() { return path; }

    /** The ability this stat targets, or null for defenses. */
    public Ability getAbility() { return ability; }

    public boolean isAbility() { return ability != null; }

    public static Stat of(Ability ability) {
        for (Stat s : values()) if (s.ability == ability) return s;
        throw new IllegalArgumentException("No stat for ability " + ability);
    }

    public static Stat of(Defense defense) {
        switch (defense) {
            case MELEE: return MELEE_DEFENSE;
            case RANGED: return RANGED_DEFENSE;
            case MIND: return MIND_DEFENSE;
            case SOUL: return SOUL_DEFENSE;
            default: throw new IllegalArgumentException("Unknown defense " + defense);
        }
    }

    /**
     * Resolve a stat from an attribute path ("abilities.strength", "defense.armor")
     * or a bare name ("strength", "armor"). Returns null when unknown.
     */
    public static Stat fromPath(String path) {
        if (path == null) return null;
        String p = path.trim().toLowerCase();
        if (p.endsWith(".value")) p = p.substring(0, p.length() - ".value".length());
        for (Stat s : values()) {
            if (s.path.equals(p) || s.name().toLowerCase().equals(p)) return s;
        }
        Ability a = Ability.fromKey(p);
        if (a != null) return of(a);
        if (p.equals("armor")) return ARMOR;
        if (p.equals("veil")) return VEIL;
        return null;
    }
}

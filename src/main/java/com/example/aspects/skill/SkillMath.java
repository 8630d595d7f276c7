package com.example.aspects.skill;

import com.example.aspects.model.Ability;

/**
 * The closed set of hit/damage formula families. Each weighs a primary
 * ability at 0.9 and a secondary at 0.3; see {@link SkillFormulas} for the
 * formulas themselves.
 */
public enum SkillMath {
    DEX_WEAPON("dex_weapon", Ability.DEXTERITY, Ability.STRENGTH),
    STR_WEAPON("str_weapon", Ability.STRENGTH, Ability.DEXTERITY),
    PHYS_RANGED("phys_ranged", Ability.PERCEPTION, Ability.DEXTERITY),
    MAGIC_PROJECTILE("magic_projectile", Ability.INTELLIGENCE, Ability.PERCEPTION),
    MAGIC_MELEE("magic_melee", Ability.INTELLIGENCE, Ability.STRENGTH),
    WISDOM_DEXTERITY("wisdom_dexterity", Ability.WISDOM, Ability.DEXTERITY),
    /** No to-hit roll; damage scales with the skill's configured ability. */
    GENERIC("generic", null, null);

    public final String key;
    public final Ability primary;
    public final Ability secondary;

    SkillMath(String key, Ability primary, Ability secondary) {
        this.key = key;
        this.primary = primary;
        this.secondary = secondary;
    }

    /** Unknown keys fall back to {@link #GENERIC}. */
    public static SkillMath fromKey(String key) {
        if (key == null) return GENERIC;
        for (SkillMath m : values()) if (m.key.equalsIgnoreCase(key.trim()) || m.name().equalsIgnoreCase(key.trim())) return m;
        return GENERIC;
    }
}

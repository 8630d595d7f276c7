package com.example.aspects.effect;

/**
 * How an effect's changes enter the stat pipeline. Titles add before
 * blessings multiply; equipment is capped; everything else lands in the
 * uncapped "other" bucket.
 */
public enum EffectCategory {
    EQUIPMENT, TITLE, BLESSING, TEMPORARY, PASSIVE;

    public static EffectCategory fromKey(String key) {
        if (key == null) return TEMPORARY;
        for (EffectCategory c : values()) if (c.name().equalsIgnoreCase(key.trim())) return c;
        return TEMPORARY;
    }
}

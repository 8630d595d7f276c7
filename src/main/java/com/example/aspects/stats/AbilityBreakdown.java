package com.example.aspects.stats;

import com.example.aspects.model.Ability;

/**
 * Trace of how one ability's final value was produced. Recomputed on every
 * derivation; never stored.
 */
public record AbilityBreakdown(
    Ability ability,
    int base,
    double titles,
    double afterTitles,
    double blessingMultiplier,
    double blessingAdd,
    int calculated,
    int equipmentRaw,
    int perStatCap,
    int equipmentCapped,
    double other,
    int finalValue,
    int mod
) {
}

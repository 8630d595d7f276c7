package com.example.aspects.skill;

import com.example.aspects.model.DamageType;

import java.util.List;

/**
 * Buff or debuff configuration. Debuffs negate the computed values and may
 * also deal damage that ignores armor and veil.
 */
public record BuffConfig(List<EffectEntry> entries, boolean stackable, int durationRounds,
                         boolean dealsDamage, DamageType damageType) {

    public BuffConfig {
        entries = entries != null ? List.copyOf(entries) : List.of();
        durationRounds = Math.max(0, durationRounds);
        if (damageType == null) damageType = DamageType.PHYSICAL;
    }

    public static BuffConfig buff(List<EffectEntry> entries, boolean stackable, int durationRounds) {
        return new BuffConfig(entries, stackable, durationRounds, false, null);
    }
}

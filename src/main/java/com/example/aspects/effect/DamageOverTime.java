package com.example.aspects.effect;

import com.example.aspects.model.DamageType;

/**
 * Per-round damage payload carried by a debuff. Applied at the applier's turn,
 * straight to health.
 */
public record DamageOverTime(int amount, DamageType damageType, String applierId) {

    public DamageOverTime merge(DamageOverTime other) {
        if (other == null) return this;
        return new DamageOverTime(amount + other.amount, damageType, other.applierId != null ? other.applierId : applierId);
    }
}

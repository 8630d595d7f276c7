package com.example.aspects.effect;

import com.example.aspects.model.Modifier;

import java.util.List;
import java.util.Objects;

/**
 * Immutable description of an effect to apply. The ledger turns it into an
 * {@link ActiveEffect} or merges it into an existing one.
 */
public record EffectSpec(
    String name,
    String originId,
    EffectCategory category,
    List<Modifier> changes,
    int durationRounds,
    StackPolicy stackPolicy,
    DamageOverTime dot
) {
    public EffectSpec {
        Objects.requireNonNull(name, "name");
        changes = changes != null ? List.copyOf(changes) : List.of();
        if (category == null) category = EffectCategory.TEMPORARY;
        if (stackPolicy == null) stackPolicy = StackPolicy.KEEP_HIGHER;
        durationRounds = Math.max(0, durationRounds);
    }

    public static EffectSpec equipment(String name, String itemId, List<Modifier> changes) {
        return new EffectSpec(name, itemId, EffectCategory.EQUIPMENT, changes, 0, StackPolicy.KEEP_HIGHER, null);
    }

    /** Sum of absolute change values plus any DoT amount. */
    public double magnitude() {
        return ActiveEffect.magnitudeOf(changes, dot);
    }
}

package com.example.aspects.model;

/**
 * An augment bonus that modifies its host item's own armor or veil bonus,
 * either flat or as a percentage of the host's value.
 */
public record ItemBonus(Field field, Mode mode, double value) {

    public enum Field { ARMOR_BONUS, VEIL_BONUS }

    public enum Mode { FLAT, PERCENT }
}

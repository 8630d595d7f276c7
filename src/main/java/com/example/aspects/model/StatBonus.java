package com.example.aspects.model;

/** A flat bonus to one ability, as granted by gear or augments. */
public record StatBonus(Ability ability, int value) {
}

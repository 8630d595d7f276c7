package com.example.aspects.skill;

/** A skill's to-hit formula (null when it has none) and damage formula. */
public record RollFormulas(String hit, String damage) {

    public boolean hasHit() { return hit != null; }
}

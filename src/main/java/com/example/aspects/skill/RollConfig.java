package com.example.aspects.skill;

import com.example.aspects.model.Ability;
import com.example.aspects.model.ResourceType;

/**
 * Roll configuration of an active skill.
 *
 * @param math      formula family
 * @param dice      dice expression, e.g. {@code 4d6}
 * @param diceBonus flat multiplier on the damage formula
 * @param ability   ability used by formula families that take one (magic projectile, generic)
 * @param resource  resource paid
 * @param cost      amount paid, after the effects resolve
 */
public record RollConfig(SkillMath math, String dice, double diceBonus, Ability ability, ResourceType resource, int cost) {

    public RollConfig {
        if (math == null) math = SkillMath.GENERIC;
        if (dice == null || dice.isBlank()) dice = "1d20";
        if (diceBonus == 0) diceBonus = 1;
        if (ability == null) ability = Ability.INTELLIGENCE;
        if (resource == null) resource = ResourceType.MANA;
        cost = Math.max(0, cost);
    }
}

package com.example.aspects.skill;

import com.example.aspects.model.Ability;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Formula table: one pure builder per {@link SkillMath}. Formulas reference
 * ability modifiers as variables ({@code @dexterity.mod}, and
 * {@code @ability.mod} for the skill's configured ability) so the same text
 * can be evaluated against any caster's bindings.
 * <p>
 * With primary P and secondary S:
 * <pre>
 *   hit    = (d20/100)*(P*0.9 + S*0.3) + P*0.9 + S*0.3
 *   damage = ((dice/50)*(P*0.9 + S*0.3) + P*0.9 + S*0.3) * bonus
 * </pre>
 * Weapon families use their own damage shape (strength-led), and ability
 * scaled families use {@code ((dice/100)*A + A) * bonus}.
 */
public final class SkillFormulas {

    public static final String ABILITY_VARIABLE = "ability.mod";

    @FunctionalInterface
    interface FormulaBuilder {
        RollFormulas build(String dice, double diceBonus);
    }

    private static final Map<SkillMath, FormulaBuilder> TABLE;

    static {
        Map<SkillMath, FormulaBuilder> m = new EnumMap<>(SkillMath.class);
        m.put(SkillMath.DEX_WEAPON, (dice, bonus) -> new RollFormulas(
            hit(Ability.DEXTERITY, Ability.STRENGTH),
            "((" + group(dice) + "/50*(" + v(Ability.STRENGTH) + "*0.9+" + v(Ability.DEXTERITY) + "*0.3))+"
                + v(Ability.STRENGTH) + "+" + v(Ability.DEXTERITY) + "*0.3)*" + num(bonus)));
        m.put(SkillMath.STR_WEAPON, (dice, bonus) -> new RollFormulas(
            hit(Ability.STRENGTH, Ability.DEXTERITY),
            "((" + group(dice) + "/50*" + v(Ability.STRENGTH) + ")+" + v(Ability.STRENGTH) + "+"
                + v(Ability.STRENGTH) + "*0.3)*" + num(bonus)));
        m.put(SkillMath.PHYS_RANGED, (dice, bonus) -> weighted(SkillMath.PHYS_RANGED, dice, bonus));
        m.put(SkillMath.MAGIC_PROJECTILE, (dice, bonus) -> new RollFormulas(
            hit(Ability.INTELLIGENCE, Ability.PERCEPTION), scaled(dice, bonus)));
        m.put(SkillMath.MAGIC_MELEE, (dice, bonus) -> weighted(SkillMath.MAGIC_MELEE, dice, bonus));
        m.put(SkillMath.WISDOM_DEXTERITY, (dice, bonus) -> weighted(SkillMath.WISDOM_DEXTERITY, dice, bonus));
        m.put(SkillMath.GENERIC, (dice, bonus) -> new RollFormulas(null, scaled(dice, bonus)));
        TABLE = Collections.unmodifiableMap(m);
    }

    private SkillFormulas() {}

    public static RollFormulas build(RollConfig roll) {
        FormulaBuilder builder = TABLE.getOrDefault(roll.math(), TABLE.get(SkillMath.GENERIC));
        return builder.build(roll.dice(), roll.diceBonus());
    }

    private static RollFormulas weighted(SkillMath math, String dice, double bonus) {
        String weights = v(math.primary) + "*0.9+" + v(math.secondary) + "*0.3";
        return new RollFormulas(hit(math.primary, math.secondary),
            "((" + group(dice) + "/50*(" + weights + "))+" + weights + ")*" + num(bonus));
    }

    private static String hit(Ability primary, Ability secondary) {
        String weights = v(primary) + "*0.9+" + v(secondary) + "*0.3";
        return "((d20/100)*(" + weights + "))+" + weights;
    }

    private static String scaled(String dice, double bonus) {
        String a = "@" + ABILITY_VARIABLE;
        return "((" + group(dice) + "/100*" + a + ")+" + a + ")*" + num(bonus);
    }

    private static String v(Ability a) {
        return "@" + a.modVariable();
    }

    private static String group(String dice) {
        return "(" + dice + ")";
    }

    private static String num(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}

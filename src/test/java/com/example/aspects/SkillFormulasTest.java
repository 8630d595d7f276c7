package com.example.aspects;

import com.example.aspects.model.Ability;
import com.example.aspects.model.ResourceType;
import com.example.aspects.roll.FormulaRoller;
import com.example.aspects.skill.RollConfig;
import com.example.aspects.skill.RollFormulas;
import com.example.aspects.skill.SkillFormulas;
import com.example.aspects.skill.SkillMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SkillFormulas Tests")
class SkillFormulasTest {

    /** d20 shows 10, every other die shows 5. */
    private final FormulaRoller roller = new FormulaRoller(sides -> sides == 20 ? 10 : 5);

    private static RollConfig config(SkillMath math, String dice) {
        return new RollConfig(math, dice, 1, Ability.INTELLIGENCE, ResourceType.MANA, 0);
    }

    private static Map<String, Double> mods(double str, double dex, double intel, double per, double ability) {
        Map<String, Double> b = new HashMap<>();
        b.put("strength.mod", str);
        b.put("dexterity.mod", dex);
        b.put("intelligence.mod", intel);
        b.put("perception.mod", per);
        b.put(SkillFormulas.ABILITY_VARIABLE, ability);
        return b;
    }

    @ParameterizedTest
    @EnumSource(value = SkillMath.class, names = "GENERIC", mode = EnumSource.Mode.EXCLUDE)
    @DisplayName("Every weapon and spell family has a to-hit formula")
    void familiesHaveHit(SkillMath math) {
        RollFormulas f = SkillFormulas.build(config(math, "1d6"));
        assertTrue(f.hasHit());
        assertTrue(f.hit().contains("d20"));
        assertTrue(f.damage().contains("(1d6)"));
    }

    @Test
    @DisplayName("Generic skills have no to-hit roll")
    void genericHasNoHit() {
        RollFormulas f = SkillFormulas.build(config(SkillMath.GENERIC, "2d4"));
        assertFalse(f.hasHit());
        assertTrue(f.damage().contains("@ability.mod"));
    }

    @Test
    @DisplayName("Magic projectile damage scales the dice by the configured ability")
    void magicProjectile() {
        RollFormulas f = SkillFormulas.build(config(SkillMath.MAGIC_PROJECTILE, "4d6"));
        // 4d6 = 20: (20/100*50)+50
        assertEquals(60.0, roller.evaluate(f.damage(), mods(0, 0, 0, 0, 50)).total(), 1e-9);
        // int 20, per 10: weights 18+3 = 21; (10/100*21)+21
        assertEquals(23.1, roller.evaluate(f.hit(), mods(0, 0, 20, 10, 0)).total(), 1e-9);
    }

    @Test
    @DisplayName("Dex weapon damage is strength-led")
    void dexWeapon() {
        RollFormulas f = SkillFormulas.build(config(SkillMath.DEX_WEAPON, "2d10"));
        // dice 10, str 20, dex 10: (10/50*(18+3)) + 20 + 3
        assertEquals(27.2, roller.evaluate(f.damage(), mods(20, 10, 0, 0, 0)).total(), 1e-9);
        // primary dex 10, secondary str 20: weights 9+6 = 15; (10/100*15)+15
        assertEquals(16.5, roller.evaluate(f.hit(), mods(20, 10, 0, 0, 0)).total(), 1e-9);
    }

    @Test
    @DisplayName("Str weapon damage ignores dexterity")
    void strWeapon() {
        RollFormulas f = SkillFormulas.build(config(SkillMath.STR_WEAPON, "1d10"));
        // dice 5, str 10: (5/50*10) + 10 + 3
        assertEquals(14.0, roller.evaluate(f.damage(), mods(10, 99, 0, 0, 0)).total(), 1e-9);
    }

    @Test
    @DisplayName("The dice bonus multiplies the whole damage")
    void diceBonus() {
        RollFormulas f = SkillFormulas.build(new RollConfig(SkillMath.GENERIC, "1d4", 2.5, Ability.WISDOM, ResourceType.MANA, 0));
        // (5/100*10)+10 = 10.5, x2.5
        assertEquals(26.25, roller.evaluate(f.damage(), mods(0, 0, 0, 0, 10)).total(), 1e-9);
    }

    @Test
    @DisplayName("Unknown skill types fall back to generic")
    void unknownType() {
        assertEquals(SkillMath.GENERIC, SkillMath.fromKey("telekinesis"));
        assertEquals(SkillMath.MAGIC_PROJECTILE, SkillMath.fromKey("magic_projectile"));
    }
}

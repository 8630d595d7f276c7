package com.example.aspects;

import com.example.aspects.effect.EffectCategory;
import com.example.aspects.effect.EffectLedger;
import com.example.aspects.effect.EffectSpec;
import com.example.aspects.effect.StackPolicy;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.ActorType;
import com.example.aspects.model.Defense;
import com.example.aspects.model.FeatureItem;
import com.example.aspects.model.Modifier;
import com.example.aspects.model.ProgressionType;
import com.example.aspects.model.Rank;
import com.example.aspects.model.ResourceType;
import com.example.aspects.model.Stat;
import com.example.aspects.persistence.RulesConfig;
import com.example.aspects.stats.DerivedStats;
import com.example.aspects.stats.StatEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StatEngine Tests")
class StatEngineTest {

    private StatEngine engine;
    private EffectLedger ledger;
    private Actor actor;

    @BeforeEach
    void setUp() {
        engine = new StatEngine(RulesConfig.defaults());
        ledger = new EffectLedger(null);
        actor = new Actor("a1", "Aria", ActorType.CHARACTER);
    }

    private void effect(String name, EffectCategory category, Modifier... changes) {
        ledger.applyEffect(actor, new EffectSpec(name, name, category, List.of(changes), 0, StackPolicy.STACK, null));
    }

    private void allAbilities(int base) {
        for (Ability a : Ability.values()) actor.setBaseAbility(a, base);
    }

    @Test
    @DisplayName("Curve is 735 at the midpoint")
    void curveMidpoint() {
        assertEquals(735.0, StatEngine.curve(500), 1e-9);
    }

    @ParameterizedTest
    @CsvSource({"-200", "0", "5", "100", "499", "1000", "5000"})
    @DisplayName("Curve is strictly increasing")
    void curveIsMonotonic(int value) {
        assertTrue(StatEngine.curve(value + 1) > StatEngine.curve(value));
    }

    @ParameterizedTest
    @EnumSource(Ability.class)
    @DisplayName("A fresh actor derives every ability from its default base")
    void defaultsDeriveFromBase(Ability ability) {
        DerivedStats stats = engine.deriveStats(actor);
        assertEquals(Actor.DEFAULT_ABILITY_BASE, stats.finalValue(ability));
        long expected = Math.round(StatEngine.curve(Actor.DEFAULT_ABILITY_BASE) * (ability == Ability.TOUGHNESS ? 0.5 : 1.0));
        assertEquals(expected, stats.mod(ability));
    }

    @Test
    @DisplayName("Toughness modifier is half the curve")
    void toughnessIsHalved() {
        actor.setBaseAbility(Ability.TOUGHNESS, 300);
        actor.setBaseAbility(Ability.STRENGTH, 300);
        DerivedStats stats = engine.deriveStats(actor);
        assertEquals(Math.round(StatEngine.curve(300) * 0.5), stats.mod(Ability.TOUGHNESS));
        assertEquals(Math.round(StatEngine.curve(300)), stats.mod(Ability.STRENGTH));
    }

    @Test
    @DisplayName("Vitality modifier is boosted only at the configured race rank")
    void vitalityBoostAtRankE() {
        actor.setBaseAbility(Ability.VITALITY, 100);
        long plain = Math.round(StatEngine.curve(100));
        assertEquals(plain, engine.deriveStats(actor).mod(Ability.VITALITY));

        actor.getProgression(ProgressionType.RACE).setLevel(25);
        DerivedStats boosted = engine.deriveStats(actor);
        assertEquals(Rank.E, boosted.rank(ProgressionType.RACE));
        assertEquals(Math.round(StatEngine.curve(100) * 1.25), boosted.mod(Ability.VITALITY));

        actor.getProgression(ProgressionType.RACE).setLevel(100);
        assertEquals(plain, engine.deriveStats(actor).mod(Ability.VITALITY));
    }

    @Test
    @DisplayName("Titles add before blessings multiply")
    void titlesThenBlessings() {
        allAbilities(100);
        effect("Dragonslayer", EffectCategory.TITLE, Modifier.add(Stat.STRENGTH, 20));
        effect("Boon", EffectCategory.BLESSING, Modifier.multiply(Stat.STRENGTH, 1.5), Modifier.add(Stat.STRENGTH, 10));
        DerivedStats stats = engine.deriveStats(actor);
        assertEquals(120.0, stats.breakdown(Ability.STRENGTH).afterTitles(), 1e-9);
        assertEquals(190, stats.breakdown(Ability.STRENGTH).calculated());
        assertEquals(190, stats.finalValue(Ability.STRENGTH));
    }

    @Test
    @DisplayName("Blessing multipliers multiply together")
    void blessingMultipliersCompound() {
        allAbilities(100);
        effect("First", EffectCategory.BLESSING, Modifier.multiply(Stat.WISDOM, 2));
        effect("Second", EffectCategory.BLESSING, Modifier.multiply(Stat.WISDOM, 1.5));
        assertEquals(300, engine.deriveStats(actor).finalValue(Ability.WISDOM));
    }

    @Test
    @DisplayName("Equipment is capped at 30% of the calculated value")
    void perStatEquipmentCap() {
        allAbilities(100);
        effect("Belt (Equipment)", EffectCategory.EQUIPMENT, Modifier.add(Stat.STRENGTH, 50));
        DerivedStats stats = engine.deriveStats(actor);
        assertEquals(50, stats.breakdown(Ability.STRENGTH).equipmentRaw());
        assertEquals(30, stats.breakdown(Ability.STRENGTH).equipmentCapped());
        assertEquals(130, stats.finalValue(Ability.STRENGTH));
    }

    @Test
    @DisplayName("Total equipment is capped at 20% of all calculated values")
    void globalEquipmentCap() {
        allAbilities(100);
        for (Ability a : Ability.values()) {
            effect(a.key + " ring (Equipment)", EffectCategory.EQUIPMENT, Modifier.add(Stat.of(a), 25));
        }
        DerivedStats stats = engine.deriveStats(actor);
        DerivedStats.Summary summary = stats.getSummary();
        assertEquals(900, summary.totalCalculated());
        assertEquals(180, summary.globalCap());
        assertEquals(225, summary.totalEquipmentRaw());
        assertTrue(summary.totalEquipmentCapped() <= 180);
        assertTrue(summary.totalEquipmentCapped() >= 180 - Ability.values().length);
        for (Ability a : Ability.values()) {
            int fin = stats.finalValue(a);
            assertTrue(fin >= 119 && fin <= 120, a + " final " + fin);
        }
    }

    @Test
    @DisplayName("Temporary and passive effects bypass the equipment caps")
    void otherContributionsUncapped() {
        allAbilities(100);
        effect("Rage", EffectCategory.TEMPORARY, Modifier.add(Stat.STRENGTH, 80));
        effect("Trained", EffectCategory.PASSIVE, Modifier.add(Stat.STRENGTH, 5));
        assertEquals(185, engine.deriveStats(actor).finalValue(Ability.STRENGTH));
    }

    @Test
    @DisplayName("Negative finals are kept and give a negative modifier")
    void negativeFinalsNotClamped() {
        effect("Curse", EffectCategory.TEMPORARY, Modifier.add(Stat.STRENGTH, -100));
        DerivedStats stats = engine.deriveStats(actor);
        assertEquals(-95, stats.finalValue(Ability.STRENGTH));
        assertTrue(stats.mod(Ability.STRENGTH) < 0);
    }

    @Test
    @DisplayName("Disabled and malformed contributions are ignored")
    void ignoresDisabledAndMalformed() {
        effect("Bad", EffectCategory.TEMPORARY, Modifier.add(Stat.STRENGTH, Double.NaN), Modifier.add(null, 10));
        effect("Off", EffectCategory.TEMPORARY, Modifier.add(Stat.DEXTERITY, 40));
        ledger.setDisabled(actor, ledger.find(actor, "Off", "Off").getId(), true);
        DerivedStats stats = assertDoesNotThrow(() -> engine.deriveStats(actor));
        assertEquals(5, stats.finalValue(Ability.STRENGTH));
        assertEquals(5, stats.finalValue(Ability.DEXTERITY));
    }

    @Test
    @DisplayName("Resource maxima come from vitality, willpower and endurance")
    void resourceMaxima() {
        actor.setBaseAbility(Ability.VITALITY, 100);
        actor.setBaseAbility(Ability.WILLPOWER, 50);
        actor.setBaseAbility(Ability.ENDURANCE, 200);
        actor.getResource(ResourceType.HEALTH).setMax(10_000);
        actor.getResource(ResourceType.HEALTH).setCurrent(10_000);
        DerivedStats stats = engine.refresh(actor);
        assertEquals(stats.mod(Ability.VITALITY), stats.resourceMax(ResourceType.HEALTH));
        assertEquals(stats.mod(Ability.WILLPOWER), stats.resourceMax(ResourceType.MANA));
        assertEquals(stats.mod(Ability.ENDURANCE), stats.resourceMax(ResourceType.STAMINA));
        assertEquals(stats.mod(Ability.VITALITY), actor.getResource(ResourceType.HEALTH).getCurrent());
    }

    @Test
    @DisplayName("Defenses weigh a secondary ability at 0.3 and scale by 1.1")
    void defenses() {
        allAbilities(100);
        actor.setBaseAbility(Ability.DEXTERITY, 200);
        effect("Shield", EffectCategory.TEMPORARY, Modifier.add(Stat.MELEE_DEFENSE, 4));
        DerivedStats stats = engine.deriveStats(actor);
        int dex = stats.mod(Ability.DEXTERITY);
        int str = stats.mod(Ability.STRENGTH);
        int per = stats.mod(Ability.PERCEPTION);
        assertEquals(Math.round((dex + 0.3 * str) * 1.1) + 4, stats.defense(Defense.MELEE));
        assertEquals(Math.round((0.3 * dex + per) * 1.1), stats.defense(Defense.RANGED));
    }

    @Test
    @DisplayName("Armor and veil add effect bonuses to the stored base")
    void armorAndVeil() {
        actor.setArmorBase(10);
        actor.setVeilBase(3);
        effect("Plate (Equipment)", EffectCategory.EQUIPMENT, Modifier.add(Stat.ARMOR, 6));
        DerivedStats stats = engine.deriveStats(actor);
        assertEquals(16, stats.getArmor());
        assertEquals(3, stats.getVeil());
    }

    @Test
    @DisplayName("Ranges and carry capacity derive from modifiers")
    void rangesAndCarry() {
        allAbilities(100);
        FeatureItem rock = new FeatureItem("rock", "Rock");
        rock.setWeight(2.25);
        rock.setQuantity(3);
        actor.addItem(rock);
        DerivedStats stats = engine.deriveStats(actor);
        int per = stats.mod(Ability.PERCEPTION);
        int end = stats.mod(Ability.ENDURANCE);
        int str = stats.mod(Ability.STRENGTH);
        assertEquals(Math.round(40 + per / 10.0), stats.getCastingRange());
        assertEquals(Math.round(35 + end / 10.0), stats.getWalkRange());
        assertEquals(stats.getWalkRange() * 2, stats.getSprintRange());
        assertEquals(Math.round(50 + str + 0.5 * end), stats.getCarryCapacity());
        assertEquals(6.8, stats.getCarryWeight(), 1e-9);
        assertFalse(stats.isEncumbered());
    }

    @ParameterizedTest
    @CsvSource({"0, G", "9, G", "10, F", "24, F", "25, E", "99, E", "100, D", "250, C", "399, B", "400, A", "999, S"})
    @DisplayName("Rank derives from level breakpoints")
    void rankBreakpoints(int level, Rank expected) {
        actor.getProgression(ProgressionType.CLASS).setLevel(level);
        assertEquals(expected, engine.deriveStats(actor).rank(ProgressionType.CLASS));
    }

    @Test
    @DisplayName("Derivation does not modify the actor")
    void derivationIsPure() {
        actor.getResource(ResourceType.HEALTH).setMax(50);
        actor.getResource(ResourceType.HEALTH).setCurrent(50);
        engine.deriveStats(actor);
        assertEquals(50, actor.getResource(ResourceType.HEALTH).getMax());
        assertEquals(5, actor.getBaseAbility(Ability.VITALITY));
    }
}

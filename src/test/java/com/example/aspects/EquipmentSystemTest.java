package com.example.aspects;

import com.example.aspects.effect.ActiveEffect;
import com.example.aspects.equipment.EquipmentSystem;
import com.example.aspects.equipment.SlotCheck;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.AugmentItem;
import com.example.aspects.model.DamageType;
import com.example.aspects.model.EquipmentSlot;
import com.example.aspects.model.GearItem;
import com.example.aspects.model.ItemBonus;
import com.example.aspects.model.Rarity;
import com.example.aspects.model.StatBonus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EquipmentSystem Tests")
class EquipmentSystemTest {

    private TestSession session;
    private EquipmentSystem equipment;
    private Actor hero;

    @BeforeEach
    void setUp() {
        session = new TestSession();
        equipment = session.equipment;
        hero = session.actor("hero", 20);
        hero.setOwnerId("p1");
    }

    private GearItem gear(String id, EquipmentSlot slot, int progress) {
        GearItem g = new GearItem(id, id);
        g.setSlot(slot);
        g.setProgress(progress);
        hero.addItem(g);
        equipment.initializeNewGear(g);
        return g;
    }

    private ActiveEffect equipmentEffect(GearItem g) {
        return session.ledger.find(hero, g.getId(), g.getName() + EquipmentSystem.EFFECT_SUFFIX);
    }

    @Test
    @DisplayName("Equipping twice is the same as equipping once")
    void equipIsIdempotent() {
        GearItem helm = gear("helm", EquipmentSlot.HEAD, 10);
        helm.setArmorBonus(3);
        assertTrue(equipment.equip("helm"));
        assertTrue(equipment.equip("helm"));
        assertEquals(1, hero.getEffects().size());
        assertEquals(3, session.engine.deriveStats(hero).getArmor());
    }

    @Test
    @DisplayName("Equipment bonuses live in one effect that unequipping removes")
    void equipmentEffectLifecycle() {
        GearItem ring = gear("ring", EquipmentSlot.RING, 10);
        ring.addStatBonus(Ability.STRENGTH, 4);
        int before = session.engine.deriveStats(hero).finalValue(Ability.STRENGTH);

        equipment.equip("ring");
        assertNotNull(equipmentEffect(ring));
        assertTrue(session.engine.deriveStats(hero).finalValue(Ability.STRENGTH) > before);

        equipment.unequip("ring");
        assertNull(equipmentEffect(ring));
        assertEquals(before, session.engine.deriveStats(hero).finalValue(Ability.STRENGTH));
    }

    @Test
    @DisplayName("A two-handed weapon needs both hands free")
    void twoHandedNeedsEmptyHands() {
        gear("dagger", EquipmentSlot.HANDS, 10);
        GearItem axe = gear("axe", EquipmentSlot.HANDS, 10);
        axe.setTwoHanded(true);

        assertTrue(equipment.equip("dagger"));
        SlotCheck check = equipment.canEquip(hero, axe);
        assertFalse(check.allowed());
        assertFalse(equipment.equip("axe"));
        assertFalse(axe.isEquipped());
    }

    @Test
    @DisplayName("Nothing fits beside a two-handed weapon")
    void nothingBesideTwoHanded() {
        GearItem axe = gear("axe", EquipmentSlot.HANDS, 10);
        axe.setTwoHanded(true);
        GearItem shield = gear("shield", EquipmentSlot.HANDS, 10);

        assertTrue(equipment.equip("axe"));
        assertEquals("axe is using both hands.", equipment.canEquip(hero, shield).reason());
    }

    @ParameterizedTest
    @CsvSource({"HEAD, 1", "HANDS, 2", "RING, 10", "TRINKET, 2"})
    @DisplayName("Slots hold exactly their capacity")
    void slotCapacity(EquipmentSlot slot, int capacity) {
        for (int i = 0; i < capacity; i++) {
            gear(slot.key + i, slot, 10);
            assertTrue(equipment.equip(slot.key + i));
        }
        gear("extra", slot, 10);
        assertFalse(equipment.equip("extra"));
        assertTrue(equipment.slotSummary(hero).get(slot).isFull());
    }

    @Test
    @DisplayName("Overstriking a weapon subtracts the excess over three times its progress")
    void weaponOverstrike() {
        GearItem axe = gear("axe", EquipmentSlot.HANDS, 100);
        equipment.equip("axe");

        assertEquals(0, equipment.degradeWeaponOnAttack(hero, axe, 300));
        assertEquals(100, axe.getDurability().getValue());
        assertEquals(50, equipment.degradeWeaponOnAttack(hero, axe, 350));
        assertEquals(50, axe.getDurability().getValue());
    }

    @Test
    @DisplayName("Durability damage spreads over the armor pieces only")
    void durabilitySpreadsOverArmor() {
        GearItem helm = gear("helm", EquipmentSlot.HEAD, 50);
        helm.setArmorBonus(4);
        GearItem chest = gear("chest", EquipmentSlot.CHEST, 50);
        chest.setArmorBonus(6);
        GearItem cloak = gear("cloak", EquipmentSlot.BACK, 50);
        cloak.setVeilBonus(2);
        GearItem shield = gear("shield", EquipmentSlot.HANDS, 50);
        shield.setArmorBonus(5);
        for (String id : List.of("helm", "chest", "cloak", "shield")) equipment.equip(id);

        assertEquals(2, equipment.degradeDurability(hero, 20, DamageType.PHYSICAL));

        assertEquals(40, helm.getDurability().getValue());
        assertEquals(40, chest.getDurability().getValue());
        assertEquals(50, cloak.getDurability().getValue());
        assertEquals(50, shield.getDurability().getValue());
    }

    @Test
    @DisplayName("Broken gear stops contributing until a repair kit brings it back")
    void breakAndRepair() {
        GearItem helm = gear("helm", EquipmentSlot.HEAD, 10);
        helm.setArmorBonus(3);
        equipment.equip("helm");
        GearItem kit = new GearItem("kit", "Repair Kit");
        kit.setRepairKit(true);
        kit.setRepairAmount(25);
        hero.addItem(kit);

        equipment.degradeDurability(hero, 10, DamageType.PHYSICAL);
        assertTrue(helm.isBroken());
        assertNull(equipmentEffect(helm));
        assertEquals(0, session.engine.deriveStats(hero).getArmor());

        assertTrue(equipment.repair("helm", "kit"));
        assertEquals(10, helm.getDurability().getValue());
        assertNotNull(equipmentEffect(helm));
        assertEquals(3, session.engine.deriveStats(hero).getArmor());
        assertTrue(session.store.findItem("kit").isEmpty());
    }

    @Test
    @DisplayName("Bulk repair only touches the listed materials")
    void repairAllByMaterial() {
        GearItem helm = gear("helm", EquipmentSlot.HEAD, 50);
        helm.setMaterial("iron");
        GearItem cloak = gear("cloak", EquipmentSlot.BACK, 50);
        cloak.setMaterial("cloth");
        equipment.equip("helm");
        equipment.equip("cloak");
        helm.getDurability().setValue(30);
        cloak.getDurability().setValue(30);

        assertEquals(10, equipment.repairAllEquipped(hero, 10, List.of("Iron")));
        assertEquals(40, helm.getDurability().getValue());
        assertEquals(30, cloak.getDurability().getValue());
    }

    @ParameterizedTest
    @CsvSource({"10", "25", "49", "50"})
    @DisplayName("Repairing by the amount just lost restores the original durability")
    void degradeThenRepair(int amount) {
        GearItem helm = gear("helm", EquipmentSlot.HEAD, 50);
        helm.setArmorBonus(4);
        equipment.equip("helm");

        equipment.degradeDurability(hero, amount, DamageType.PHYSICAL);
        assertEquals(50 - amount, helm.getDurability().getValue());

        assertEquals(amount, equipment.repairAllEquipped(hero, amount, List.of()));
        assertEquals(50, helm.getDurability().getValue());
        assertNotNull(equipmentEffect(helm));
    }

    @Test
    @DisplayName("Repairs never push durability past its maximum")
    void repairCappedAtMax() {
        GearItem helm = gear("helm", EquipmentSlot.HEAD, 50);
        equipment.equip("helm");
        helm.getDurability().setValue(45);

        assertEquals(5, equipment.repairAllEquipped(hero, 100, List.of()));
        assertEquals(50, helm.getDurability().getValue());
        assertEquals(0, equipment.repairAllEquipped(hero, 100, List.of()));
    }

    @Test
    @DisplayName("Bulk repair brings broken gear back online along with its bonuses")
    void repairAllRevivesBroken() {
        GearItem helm = gear("helm", EquipmentSlot.HEAD, 20);
        helm.setArmorBonus(3);
        GearItem chest = gear("chest", EquipmentSlot.CHEST, 50);
        chest.setArmorBonus(5);
        equipment.equip("helm");
        equipment.equip("chest");
        chest.getDurability().setValue(30);

        equipment.degradeDurability(hero, 40, DamageType.PHYSICAL);
        assertTrue(helm.isBroken());
        assertNull(equipmentEffect(helm));
        assertEquals(10, chest.getDurability().getValue());
        assertEquals(5, session.engine.deriveStats(hero).getArmor());

        assertEquals(20, equipment.repairAllEquipped(hero, 20, List.of()));

        assertEquals(10, helm.getDurability().getValue());
        assertEquals(20, chest.getDurability().getValue());
        assertFalse(helm.isBroken());
        assertNotNull(equipmentEffect(helm));
        assertEquals(8, session.engine.deriveStats(hero).getArmor());
    }

    @ParameterizedTest
    @CsvSource({"COMMON, 0", "RARE, 2", "MYTHIC, 5"})
    @DisplayName("New gear gets full durability and augment slots from its rarity")
    void newGear(Rarity rarity, int slots) {
        GearItem g = new GearItem("g", "g");
        g.setRarity(rarity);
        g.setProgress(40);
        equipment.initializeNewGear(g);
        assertEquals(slots, g.getAugmentSlots());
        assertEquals(40, g.getDurability().getMax());
        assertEquals(40, g.getDurability().getValue());
    }

    @Test
    @DisplayName("Augments add their bonuses to the host and vanish from it when deleted")
    void augments() {
        GearItem chest = gear("chest", EquipmentSlot.CHEST, 30);
        chest.setRarity(Rarity.UNCOMMON);
        equipment.initializeNewGear(chest);
        chest.setArmorBonus(6);
        equipment.equip("chest");
        AugmentItem rune = new AugmentItem("rune", "Rune");
        rune.getStatBonuses().add(new StatBonus(Ability.STRENGTH, 2));
        rune.getItemBonuses().add(new ItemBonus(ItemBonus.Field.VEIL_BONUS, ItemBonus.Mode.FLAT, 4));
        rune.getItemBonuses().add(new ItemBonus(ItemBonus.Field.ARMOR_BONUS, ItemBonus.Mode.PERCENT, 50));
        hero.addItem(rune);

        assertTrue(equipment.slotAugment("chest", "rune"));
        assertEquals(4, session.engine.deriveStats(hero).getVeil());
        assertEquals(9, session.engine.deriveStats(hero).getArmor());

        AugmentItem second = new AugmentItem("second", "Second");
        hero.addItem(second);
        assertFalse(equipment.slotAugment("chest", "second"), "uncommon gear has one slot");

        assertTrue(equipment.deleteItem("rune"));
        assertTrue(chest.getAugmentIds().isEmpty());
        assertEquals(0, session.engine.deriveStats(hero).getVeil());
        assertEquals(6, session.engine.deriveStats(hero).getArmor());
    }
}

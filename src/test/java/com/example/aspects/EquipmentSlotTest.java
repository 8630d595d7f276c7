package com.example.aspects;

import com.example.aspects.model.EquipmentSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EquipmentSlot Tests")
class EquipmentSlotTest {

    @Test
    @DisplayName("All slots have unique IDs and keys")
    void allSlotsAreUnique() {
        EquipmentSlot[] slots = EquipmentSlot.values();
        for (int i = 0; i < slots.length; i++) {
            for (int j = i + 1; j < slots.length; j++) {
                assertNotEquals(slots[i].id, slots[j].id, slots[i] + " and " + slots[j] + " have the same ID");
                assertNotEquals(slots[i].key, slots[j].key, slots[i] + " and " + slots[j] + " have the same key");
            }
        }
    }

    @ParameterizedTest
    @EnumSource(EquipmentSlot.class)
    @DisplayName("Every slot round-trips through its id and key and holds at least one item")
    void lookups(EquipmentSlot slot) {
        assertEquals(slot, EquipmentSlot.fromId(slot.getId()));
        assertEquals(slot, EquipmentSlot.fromKey(slot.getKey()));
        assertFalse(slot.getDisplayName().isEmpty());
        assertTrue(slot.defaultCapacity >= 1);
    }

    @ParameterizedTest
    @CsvSource({
        "HEAD, HEAD",
        "'  chest  ', CHEST",
        "weapon, HANDS",
        "main_hand, HANDS",
        "off_hand, HANDS",
        "boots, FEET",
        "finger, RING",
        "Trinket, TRINKET"
    })
    @DisplayName("fromKey accepts names, aliases and stray whitespace")
    void fromKeyAliases(String input, EquipmentSlot expected) {
        assertEquals(expected, EquipmentSlot.fromKey(input));
    }

    @Test
    @DisplayName("Unknown lookups return null")
    void unknown() {
        assertNull(EquipmentSlot.fromKey(null));
        assertNull(EquipmentSlot.fromKey("tail"));
        assertNull(EquipmentSlot.fromKey(""));
        assertNull(EquipmentSlot.fromId(0));
        assertNull(EquipmentSlot.fromId(100));
    }

    @Test
    @DisplayName("Only the hand slot carries the two-handed rule")
    void handsOnly() {
        for (EquipmentSlot slot : EquipmentSlot.values()) {
            assertEquals(slot == EquipmentSlot.HANDS, slot.isHands());
        }
        assertEquals(2, EquipmentSlot.HANDS.defaultCapacity);
    }
}

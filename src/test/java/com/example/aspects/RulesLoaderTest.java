package com.example.aspects;

import com.example.aspects.model.EquipmentSlot;
import com.example.aspects.model.Rank;
import com.example.aspects.model.Rarity;
import com.example.aspects.persistence.RulesConfig;
import com.example.aspects.persistence.RulesLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RulesLoader Tests")
class RulesLoaderTest {

    @Test
    @DisplayName("The bundled rules file matches the built-in defaults")
    void bundledRules() {
        RulesConfig loaded = RulesLoader.load();
        RulesConfig defaults = RulesConfig.defaults();

        assertEquals(defaults.getRankFloors(), loaded.getRankFloors());
        for (EquipmentSlot slot : EquipmentSlot.values()) {
            assertEquals(defaults.slotCapacity(slot), loaded.slotCapacity(slot), slot.key);
        }
        for (Rarity rarity : Rarity.values()) {
            assertEquals(defaults.augmentSlotsFor(rarity), loaded.augmentSlotsFor(rarity), rarity.key);
        }
        assertEquals(Rank.E, loaded.getVitalityBoostRank());
    }

    @Test
    @DisplayName("A missing resource falls back to defaults")
    void missingResource() {
        RulesConfig config = RulesLoader.load("/data/does-not-exist.yaml");
        assertEquals(RulesConfig.defaults().getRankFloors(), config.getRankFloors());
        assertEquals(10, config.slotCapacity(EquipmentSlot.RING));
    }

    @Test
    @DisplayName("Malformed sections keep their defaults while valid entries apply")
    void malformedSections() {
        RulesConfig config = RulesLoader.load("/data/bad-rules.yaml");

        assertEquals(RulesConfig.defaults().getRankFloors(), config.getRankFloors());
        assertEquals(4, config.slotCapacity(EquipmentSlot.RING));
        assertEquals(1, config.slotCapacity(EquipmentSlot.HEAD));
        assertEquals(7, config.augmentSlotsFor(Rarity.RARE));
        assertEquals(0, config.augmentSlotsFor(Rarity.COMMON));
        assertEquals(Rank.E, config.getVitalityBoostRank());
    }
}

package com.example.aspects.persistence;

import com.example.aspects.model.EquipmentSlot;
import com.example.aspects.model.Rank;
import com.example.aspects.model.Rarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Loads {@link RulesConfig} from a classpath YAML resource. Any section that
 * is missing or malformed keeps its built-in default.
 */
public final class RulesLoader {

    private static final Logger logger = LoggerFactory.getLogger(RulesLoader.class);

    public static final String DEFAULT_RESOURCE = "/data/rules.yaml";

    private RulesLoader() {}

    public static RulesConfig load() {
        return load(DEFAULT_RESOURCE);
    }

    @SuppressWarnings("unchecked")
    public static RulesConfig load(String resource) {
        try (InputStream in = RulesLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("[RulesLoader] {} not found on classpath, using defaults", resource);
                return RulesConfig.defaults();
            }
            Object parsed = new Yaml().load(in);
            if (!(parsed instanceof Map)) {
                logger.warn("[RulesLoader] {} is not a mapping, using defaults", resource);
                return RulesConfig.defaults();
            }
            RulesConfig config = fromMap((Map<String, Object>) parsed);
            logger.info("[RulesLoader] Loaded rules from {}", resource);
            return config;
        } catch (Exception e) {
            logger.warn("[RulesLoader] Failed to load {}: {}", resource, e.getMessage());
            return RulesConfig.defaults();
        }
    }

    static RulesConfig fromMap(Map<String, Object> root) {
        NavigableMap<Integer, Rank> floors = new TreeMap<>();
        for (Map.Entry<String, Object> e : YamlValues.getMap(root, "ranks").entrySet()) {
            Rank rank = Rank.fromKey(e.getKey());
            int minLevel = YamlValues.toInt(e.getValue(), -1);
            if (rank == null || minLevel < 0) {
                logger.warn("[RulesLoader] Ignoring rank breakpoint {}={}", e.getKey(), e.getValue());
                continue;
            }
            floors.put(minLevel, rank);
        }
        if (floors.isEmpty() || !isMonotonic(floors)) {
            if (!floors.isEmpty()) logger.warn("[RulesLoader] Rank breakpoints are not monotonic, using defaults");
            floors = RulesConfig.defaultRankFloors();
        }

        Map<EquipmentSlot, Integer> slots = RulesConfig.defaultSlotCapacities();
        for (Map.Entry<String, Object> e : YamlValues.getMap(root, "slots").entrySet()) {
            EquipmentSlot slot = EquipmentSlot.fromKey(e.getKey());
            int max = YamlValues.toInt(e.getValue(), -1);
            if (slot == null || max < 0) {
                logger.warn("[RulesLoader] Ignoring slot capacity {}={}", e.getKey(), e.getValue());
                continue;
            }
            slots.put(slot, max);
        }

        Map<Rarity, Integer> rarities = RulesConfig.defaultRarityAugmentSlots();
        for (Map.Entry<String, Object> e : YamlValues.getMap(root, "rarities").entrySet()) {
            Rarity rarity = Rarity.fromKey(e.getKey());
            int augments = YamlValues.toInt(e.getValue(), -1);
            if (!rarity.key.equalsIgnoreCase(e.getKey()) || augments < 0) {
                logger.warn("[RulesLoader] Ignoring rarity {}={}", e.getKey(), e.getValue());
                continue;
            }
            rarities.put(rarity, augments);
        }

        Rank boost = Rank.fromKey(YamlValues.getString(root, "vitalityBoostRank", "E"));
        if (boost == null) {
            logger.warn("[RulesLoader] Unknown vitalityBoostRank, using E");
            boost = Rank.E;
        }
        return new RulesConfig(floors, slots, rarities, boost);
    }

    private static boolean isMonotonic(NavigableMap<Integer, Rank> floors) {
        Rank previous = null;
        for (Rank r : floors.values()) {
            if (previous != null && r.ordinal() <= previous.ordinal()) return false;
            previous = r;
        }
        return true;
    }
}

package com.example.aspects.persistence;

import com.example.aspects.model.EquipmentSlot;
import com.example.aspects.model.Rank;
import com.example.aspects.model.Rarity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Tunable rule tables: level to rank breakpoints, slot capacities, rarity
 * augment slots and the rank that boosts the vitality modifier.
 * Use {@link #defaults()} or {@link RulesLoader#load()}.
 */
public class RulesConfig {

    private final NavigableMap<Integer, Rank> rankFloors;
    private final Map<EquipmentSlot, Integer> slotCapacities;
    private final Map<Rarity, Integer> rarityAugmentSlots;
    private final Rank vitalityBoostRank;

    public RulesConfig(NavigableMap<Integer, Rank> rankFloors,
                       Map<EquipmentSlot, Integer> slotCapacities,
                       Map<Rarity, Integer> rarityAugmentSlots,
                       Rank vitalityBoostRank) {
        this.rankFloors = Collections.unmodifiableNavigableMap(new TreeMap<>(rankFloors));
        this.slotCapacities = Collections.unmodifiableMap(new EnumMap<>(slotCapacities));
        this.rarityAugmentSlots = Collections.unmodifiableMap(new EnumMap<>(rarityAugmentSlots));
        this.vitalityBoostRank = vitalityBoostRank;
    }

    public static RulesConfig defaults() {
        return new RulesConfig(defaultRankFloors(), defaultSlotCapacities(), defaultRarityAugmentSlots(), Rank.E);
    }

    static NavigableMap<Integer, Rank> defaultRankFloors() {
        NavigableMap<Integer, Rank> m = new TreeMap<>();
        m.put(0, Rank.G);
        m.put(10, Rank.F);
        m.put(25, Rank.E);
        m.put(100, Rank.D);
        m.put(200, Rank.C);
        m.put(300, Rank.B);
        m.put(400, Rank.A);
        m.put(500, Rank.S);
        return m;
    }

    static Map<EquipmentSlot, Integer> defaultSlotCapacities() {
        Map<EquipmentSlot, Integer> m = new EnumMap<>(EquipmentSlot.class);
        for (EquipmentSlot s : EquipmentSlot.values()) m.put(s, s.defaultCapacity);
        return m;
    }

    static Map<Rarity, Integer> defaultRarityAugmentSlots() {
        Map<Rarity, Integer> m = new EnumMap<>(Rarity.class);
        for (Rarity r : Rarity.values()) m.put(r, r.defaultAugmentSlots);
        return m;
    }

    /** Rank for a level; levels below the first breakpoint get the lowest rank. */
    public Rank rankForLevel(int level) {
        Map.Entry<Integer, Rank> e = rankFloors.floorEntry(level);
        if (e != null) return e.getValue();
        return rankFloors.isEmpty() ? Rank.G : rankFloors.firstEntry().getValue();
    }

    public int slotCapacity(EquipmentSlot slot) {
        if (slot == null) return 0;
        return slotCapacities.getOrDefault(slot, slot.defaultCapacity);
    }

    public int augmentSlotsFor(Rarity rarity) {
        if (rarity == null) return 0;
        return rarityAugmentSlots.getOrDefault(rarity, rarity.defaultAugmentSlots);
    }

    public Rank getVitalityBoostRank() { return vitalityBoostRank; }

    public NavigableMap<Integer, Rank> getRankFloors() { return rankFloors; }
}

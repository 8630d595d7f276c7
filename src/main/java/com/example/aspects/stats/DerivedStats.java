package com.example.aspects.stats;

import com.example.aspects.model.Ability;
import com.example.aspects.model.DamageType;
import com.example.aspects.model.Defense;
import com.example.aspects.model.ProgressionType;
import com.example.aspects.model.Rank;
import com.example.aspects.model.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Output of {@link StatEngine#deriveStats}. A read-only snapshot.
 */
public class DerivedStats {
    private final Map<Ability, AbilityBreakdown> abilities;
    private final Map<ResourceType, Integer> resourceMaxima;
    private final Map<Defense, Integer> defenses;
    private final int armor;
    private final int veil;
    private final int castingRange;
    private final int walkRange;
    private final int carryCapacity;
    private final double carryWeight;
    private final Map<ProgressionType, Rank> ranks;
    private final Summary summary;

    /** Session-wide totals behind the equipment caps. */
    public record Summary(int totalCalculated, int globalCap, int totalEquipmentRaw, int totalEquipmentCapped) {
    }

    DerivedStats(Map<Ability, AbilityBreakdown> abilities,
                 Map<ResourceType, Integer> resourceMaxima,
                 Map<Defense, Integer> defenses,
                 int armor, int veil,
                 int castingRange, int walkRange,
                 int carryCapacity, double carryWeight,
                 Map<ProgressionType, Rank> ranks,
                 Summary summary) {
        this.abilities = Collections.unmodifiableMap(new EnumMap<>(abilities));
        this.resourceMaxima = Collections.unmodifiableMap(new EnumMap<>(resourceMaxima));
        this.defenses = Collections.unmodifiableMap(new EnumMap<>(defenses));
        this.armor = armor;
        this.veil = veil;
        this.castingRange = castingRange;
        this.walkRange = walkRange;
        this.carryCapacity = carryCapacity;
        this.carryWeight = carryWeight;
        this.ranks = Collections.unmodifiableMap(new EnumMap<>(ranks));
        this.summary = summary;
    }

    public AbilityBreakdown breakdown(Ability ability) { return abilities.get(ability); }
    public Map<Ability, AbilityBreakdown> getBreakdowns() { return abilities; }

    public int finalValue(Ability ability) { return abilities.get(ability).finalValue(); }
    public int mod(Ability ability) { return abilities.get(ability).mod(); }

    public int resourceMax(ResourceType type) { return resourceMaxima.getOrDefault(type, 0); }

    public int defense(Defense defense) { return defenses.getOrDefault(defense, 0); }

    public int getArmor() { return armor; }
    public int getVeil() { return veil; }

    /** Armor for physical damage, veil for magical. */
    public int mitigation(DamageType type) {
        return type == DamageType.MAGICAL ? veil : armor;
    }

    public int getCastingRange() { return castingRange; }
    public int getWalkRange() { return walkRange; }
    public int getSprintRange() { return walkRange * 2; }

    public int getCarryCapacity() { return carryCapacity; }
    public double getCarryWeight() { return carryWeight; }
    public boolean isEncumbered() { return carryWeight > carryCapacity; }

    public Rank rank(ProgressionType type) { return ranks.get(type); }

    public Summary getSummary() { return summary; }
}

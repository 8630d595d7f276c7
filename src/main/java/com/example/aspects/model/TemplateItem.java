package com.example.aspects.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * A race, class or profession template.
 * <p>
 * Class and profession templates grant the same gains every level. Race
 * templates key their gains and free points by rank, so a race grows
 * differently at G than at E; a race entry for a rank overrides the flat
 * values for levels inside that rank.
 */
public class TemplateItem extends Item {
    private final ProgressionType progressionType;
    private final Map<Ability, Integer> gains = new EnumMap<>(Ability.class);
    private int freePointsPerLevel;
    private int tier;
    private final Map<Rank, Map<Ability, Integer>> rankGains = new EnumMap<>(Rank.class);
    private final Map<Rank, Integer> rankFreePoints = new EnumMap<>(Rank.class);

    public TemplateItem(String id, String name, ProgressionType progressionType) {
        super(id, name);
        this.progressionType = progressionType;
    }

    @Override
    public ItemKind getKind() { return ItemKind.TEMPLATE; }

    public ProgressionType getProgressionType() { return progressionType; }

    public void setGain(Ability ability, int value) { gains.put(ability, value); }

    public void setFreePointsPerLevel(int freePointsPerLevel) { this.freePointsPerLevel = freePointsPerLevel; }

    /** Class tier, or 0 when the template is not tiered. */
    public int getTier() { return tier; }
    public void setTier(int tier) { this.tier = Math.max(0, tier); }

    /**
     * Highest level a class of this tier may reach: 24 for tier 1, 99 for
     * tier 2, 199 for tier 3. Untiered and higher tiers are uncapped.
     */
    public int maxLevel() {
        switch (tier) {
            case 1: return 24;
            case 2: return 99;
            case 3: return 199;
            default: return Integer.MAX_VALUE;
        }
    }

    public void setRankGain(Rank rank, Ability ability, int value) {
        rankGains.computeIfAbsent(rank, r -> new EnumMap<>(Ability.class)).put(ability, value);
    }

    public void setRankFreePoints(Rank rank, int value) { rankFreePoints.put(rank, value); }

    /** Per-level gain for an ability while the progression sits at {@code rank}. */
    public int gainAt(Rank rank, Ability ability) {
        Map<Ability, Integer> byRank = rank != null ? rankGains.get(rank) : null;
        if (byRank != null) return byRank.getOrDefault(ability, 0);
        return gains.getOrDefault(ability, 0);
    }

    public int freePointsAt(Rank rank) {
        Integer byRank = rank != null ? rankFreePoints.get(rank) : null;
        return byRank != null ? byRank : freePointsPerLevel;
    }
}

package com.example.aspects.progression;

import com.example.aspects.model.Ability;
import com.example.aspects.model.ProgressionType;
import com.example.aspects.model.Rank;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Outcome of a level-up or free point allocation.
 */
public class LevelUpResult {
    private final boolean success;
    private final String failureMessage;
    private final ProgressionType type;
    private final int newLevel;
    private final Rank previousRank;
    private final Rank newRank;
    private final Map<Ability, Integer> gains;
    private final Map<Ability, Integer> allocated;
    private final int freePointsGained;

    private LevelUpResult(boolean success, String failureMessage, ProgressionType type, int newLevel,
                          Rank previousRank, Rank newRank, Map<Ability, Integer> gains,
                          Map<Ability, Integer> allocated, int freePointsGained) {
        this.success = success;
        this.failureMessage = failureMessage;
        this.type = type;
        this.newLevel = newLevel;
        this.previousRank = previousRank;
        this.newRank = newRank;
        this.gains = copy(gains);
        this.allocated = copy(allocated);
        this.freePointsGained = freePointsGained;
    }

    public static LevelUpResult success(ProgressionType type, int newLevel, Rank previousRank, Rank newRank,
                                        Map<Ability, Integer> gains, Map<Ability, Integer> allocated,
                                        int freePointsGained) {
        return new LevelUpResult(true, null, type, newLevel, previousRank, newRank, gains, allocated, freePointsGained);
    }

    public static LevelUpResult allocation(Map<Ability, Integer> allocated) {
        return new LevelUpResult(true, null, null, 0, null, null, null, allocated, 0);
    }

    public static LevelUpResult failure(ProgressionType type, String message) {
        return new LevelUpResult(false, message, type, 0, null, null, null, null, 0);
    }

    private static Map<Ability, Integer> copy(Map<Ability, Integer> source) {
        if (source == null || source.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }

    public boolean isSuccess() { return success; }
    public boolean isFailure() { return !success; }
    public String getFailureMessage() { return failureMessage; }
    public ProgressionType getType() { return type; }
    public int getNewLevel() { return newLevel; }
    public Rank getPreviousRank() { return previousRank; }
    public Rank getNewRank() { return newRank; }

    /** True when the level-up crossed a rank breakpoint. */
    public boolean isRankChanged() {
        return previousRank != null && newRank != null && previousRank != newRank;
    }

    /** Template gains applied to base abilities (allocated free points not included). */
    public Map<Ability, Integer> getGains() { return gains; }

    /** Free points spent on abilities, whether chosen by the caller or at random. */
    public Map<Ability, Integer> getAllocated() { return allocated; }

    public int getFreePointsGained() { return freePointsGained; }
}

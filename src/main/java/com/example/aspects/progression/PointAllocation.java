package com.example.aspects.progression;

/** What happens to the free points a level-up grants. */
public enum PointAllocation {
    /** Spend the caller's explicit allocation; anything left stays in the pool. */
    MANUAL,
    /** Spend every newly granted point on randomly chosen abilities. */
    RANDOM,
    /** Keep the new points in the pool for later. */
    SAVE
}

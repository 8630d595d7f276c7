package com.example.aspects.model;

/**
 * Letter-graded progression tiers, lowest first.
 */
public enum Rank {
    G, F, E, D, C, B, A, S;

    public static Rank fromKey(String key) {
        if (key == null || key.isBlank()) return null;
        try {
            return valueOf(key.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}

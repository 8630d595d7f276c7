package com.example.aspects.roll;

import java.util.List;

/**
 * Outcome of evaluating one formula. {@code total} is unrounded; callers round
 * where the rules say so.
 */
public record RollResult(String formula, double total, List<DieResult> dice) {

    public RollResult {
        dice = dice != null ? List.copyOf(dice) : List.of();
    }

    public static RollResult fixed(String formula, double total) {
        return new RollResult(formula, total, List.of());
    }

    public long rounded() {
        return Math.round(total);
    }
}

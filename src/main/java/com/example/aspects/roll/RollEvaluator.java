package com.example.aspects.roll;

import java.util.Map;

/**
 * Evaluates a roll formula against a variable binding context.
 * Formulas support {@code + - * / ( )}, dice terms such as {@code 4d6} or
 * {@code d20}, and {@code @name} variables resolved from the bindings.
 */
@FunctionalInterface
public interface RollEvaluator {

    RollResult evaluate(String formula, Map<String, Double> bindings);
}

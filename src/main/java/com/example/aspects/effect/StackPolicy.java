package com.example.aspects.effect;

/**
 * What happens when an effect with the same origin and name is applied again.
 */
public enum StackPolicy {
    /** Merge changes into the existing effect, adding values per (stat, op). */
    STACK,
    /** Replace only when the new total magnitude is strictly greater. */
    KEEP_HIGHER
}

package com.example.aspects.effect;

public enum ApplyOutcome {
    /** No matching effect existed; a new one was created. */
    CREATED,
    /** Stackable: values were added into the existing effect. */
    MERGED,
    /** Non-stackable: the new effect was stronger and replaced the old one. */
    UPGRADED,
    /** Non-stackable: the existing effect was at least as strong. */
    UNCHANGED
}

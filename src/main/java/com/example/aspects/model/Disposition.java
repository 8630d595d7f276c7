package com.example.aspects.model;

public enum Disposition {
    FRIENDLY, NEUTRAL, HOSTILE;

    /** Friendly and hostile oppose each other; neutral opposes nothing. */
    public boolean opposes(Disposition other) {
        return (this == FRIENDLY && other == HOSTILE) || (this == HOSTILE && other == FRIENDLY);
    }
}

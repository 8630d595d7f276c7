package com.example.aspects.model;

/** Durability of a gear item, value clamped to [0, max]. */
public class Durability {
    private int value;
    private int max;

    public Durability(int value, int max) {
        this.max = Math.max(0, max);
        this.value = clamp(value);
    }

    public int getValue() { return value; }
    public int getMax() { return max; }

    public void setValue(int value) { this.value = clamp(value); }

    public void setMax(int max) {
        this.max = Math.max(0, max);
        this.value = clamp(value);
    }

    /** Broken means a tracked durability (max above zero) that has run out. */
    public boolean isBroken() {
        return max > 0 && value <= 0;
    }

    public boolean isDamaged() {
        return max > 0 && value < max;
    }

    private int clamp(int v) {
        return Math.max(0, Math.min(v, max));
    }

    @Override
    public String toString() {
        return value + "/" + max;
    }
}

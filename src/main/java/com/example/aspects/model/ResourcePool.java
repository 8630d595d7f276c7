package com.example.aspects.model;

/**
 * A resource pool (health, stamina, mana). The current value is always
 * clamped to [min, max].
 */
public class ResourcePool {
    private int min;
    private int max;
    private int current;

    public ResourcePool(int current, int max) {
        this(current, 0, max);
    }

    public ResourcePool(int current, int min, int max) {
        this.min = min;
        this.max = Math.max(min, max);
        this.current = clamp(current);
    }

    public int getCurrent() { return current; }
    public int getMin() { return min; }
    public int getMax() { return max; }

    public void setCurrent(int value) { this.current = clamp(value); }

    /** Changes the maximum and re-clamps the current value. */
    public void setMax(int max) {
        this.max = Math.max(min, max);
        this.current = clamp(current);
    }

    /** Adds (or with a negative amount removes) and returns the change actually applied. */
    public int adjust(int amount) {
        int before = current;
        current = clamp(current + amount);
        return current - before;
    }

    private int clamp(int v) {
        return Math.max(min, Math.min(v, max));
    }

    @Override
    public String toString() {
        return current + "/" + max;
    }
}

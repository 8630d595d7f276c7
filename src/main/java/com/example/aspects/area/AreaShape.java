package com.example.aspects.area;

public enum AreaShape {
    CIRCLE(false), CONE(true), RAY(true), RECT(false);

    private final boolean directed;

    AreaShape(boolean directed) {
        this.directed = directed;
    }

    /** Directed shapes originate at the caster; only their direction is aimed. */
    public boolean isDirected() { return directed; }

    public static AreaShape fromKey(String key) {
        if (key == null) return null;
        for (AreaShape s : values()) if (s.name().equalsIgnoreCase(key.trim())) return s;
        return null;
    }
}

package com.example.aspects.skill;

public enum ChainTrigger {
    ALWAYS, ON_HIT, ON_MISS;

    public static ChainTrigger fromKey(String key) {
        if (key == null) return ALWAYS;
        String k = key.trim().toLowerCase().replace('-', '_');
        for (ChainTrigger t : values()) if (t.name().toLowerCase().equals(k)) return t;
        return ALWAYS;
    }

    /**
     * Whether a target qualifies. {@code hit} is null when no attack was
     * rolled against it; only ALWAYS fires then.
     */
    public boolean fires(Boolean hit) {
        switch (this) {
            case ON_HIT: return Boolean.TRUE.equals(hit);
            case ON_MISS: return Boolean.FALSE.equals(hit);
            default: return true;
        }
    }
}

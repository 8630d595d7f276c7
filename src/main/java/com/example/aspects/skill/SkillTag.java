package com.example.aspects.skill;

/** Capabilities a skill can carry. A skill may have several, dispatched in this order. */
public enum SkillTag {
    ATTACK, RESTORATION, BUFF, DEBUFF, REPAIR;

    public static SkillTag fromKey(String key) {
        if (key == null) return null;
        for (SkillTag t : values()) if (t.name().equalsIgnoreCase(key.trim())) return t;
        return null;
    }
}

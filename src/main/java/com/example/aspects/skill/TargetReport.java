package com.example.aspects.skill;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What a skill did to one target, as seen by the caster's process.
 */
public class TargetReport {
    private final String targetId;
    private final String targetName;
    private Boolean hit;
    private int damage;
    private int restored;
    private final List<String> lines = new ArrayList<>();

    public TargetReport(String targetId, String targetName) {
        this.targetId = targetId;
        this.targetName = targetName;
    }

    public String getTargetId() { return targetId; }
    public String getTargetName() { return targetName; }

    /** Attack result against this target; null when no attack was rolled. */
    public Boolean getHit() { return hit; }
    public void setHit(boolean hit) { this.hit = hit; }

    /** Damage computed for this target (attack damage or debuff damage). */
    public int getDamage() { return damage; }
    public void addDamage(int amount) { this.damage += amount; }

    /** Resource restored as far as the read model shows. */
    public int getRestored() { return restored; }
    public void setRestored(int restored) { this.restored = restored; }

    public List<String> getLines() { return Collections.unmodifiableList(lines); }
    public void addLine(String line) { lines.add(line); }
}

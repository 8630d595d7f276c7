package com.example.aspects.model;

/**
 * Level and template reference for one of an actor's race, class or profession.
 * The rank is not stored; it is derived from the level.
 */
public class Progression {
    private final ProgressionType type;
    private int level;
    private String templateId;

    public Progression(ProgressionType type, int level, String templateId) {
        this.type = type;
        this.level = Math.max(0, level);
        this.templateId = templateId;
    }

    public ProgressionType getType() { return type; }
    public int getLevel() { return level; }
    public void setLevel(int level) { this.level = Math.max(0, level); }
    public String getTemplateId() { return templateId; }
    public void setTemplateId(String templateId) { this.templateId = templateId; }
}

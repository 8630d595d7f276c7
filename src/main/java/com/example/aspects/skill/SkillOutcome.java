package com.example.aspects.skill;

import com.example.aspects.area.AreaTemplate;
import com.example.aspects.roll.RollResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of one skill activation.
 */
public class SkillOutcome {

    public enum Status { COMPLETED, DESCRIBED, ABORTED }

    private final Status status;
    private final String skillId;
    private final ResolutionStage stage;
    private final String message;
    private final RollResult hitRoll;
    private final RollResult damageRoll;
    private final List<TargetReport> targets;
    private final AreaTemplate template;
    private final int resourceSpent;
    private final List<SkillOutcome> chained = new ArrayList<>();

    private SkillOutcome(Status status, String skillId, ResolutionStage stage, String message,
                         RollResult hitRoll, RollResult damageRoll, List<TargetReport> targets,
                         AreaTemplate template, int resourceSpent) {
        this.status = status;
        this.skillId = skillId;
        this.stage = stage;
        this.message = message;
        this.hitRoll = hitRoll;
        this.damageRoll = damageRoll;
        this.targets = targets != null ? List.copyOf(targets) : List.of();
        this.template = template;
        this.resourceSpent = resourceSpent;
    }

    public static SkillOutcome described(String skillId, String description) {
        return new SkillOutcome(Status.DESCRIBED, skillId, ResolutionStage.DONE, description, null, null, null, null, 0);
    }

    /** Aborted before any mutation. {@code stage} is where it stopped. */
    public static SkillOutcome aborted(String skillId, ResolutionStage stage, String message) {
        return new SkillOutcome(Status.ABORTED, skillId, stage, message, null, null, null, null, 0);
    }

    public static SkillOutcome completed(String skillId, RollResult hitRoll, RollResult damageRoll,
                                         List<TargetReport> targets, AreaTemplate template, int resourceSpent) {
        return new SkillOutcome(Status.COMPLETED, skillId, ResolutionStage.DONE, null, hitRoll, damageRoll,
            targets, template, resourceSpent);
    }

    public Status getStatus() { return status; }
    public boolean isCompleted() { return status == Status.COMPLETED; }
    public boolean isAborted() { return status == Status.ABORTED; }
    public String getSkillId() { return skillId; }

    /** DONE for finished activations, otherwise the stage that aborted. */
    public ResolutionStage getStage() { return stage; }
    public String getMessage() { return message; }
    public RollResult getHitRoll() { return hitRoll; }
    public RollResult getDamageRoll() { return damageRoll; }
    public List<TargetReport> getTargets() { return targets; }
    public AreaTemplate getTemplate() { return template; }
    public int getResourceSpent() { return resourceSpent; }

    public List<SkillOutcome> getChained() { return Collections.unmodifiableList(chained); }

    void addChained(SkillOutcome outcome) { chained.add(outcome); }

    public TargetReport reportFor(String targetId) {
        for (TargetReport r : targets) if (r.getTargetId().equals(targetId)) return r;
        return null;
    }
}

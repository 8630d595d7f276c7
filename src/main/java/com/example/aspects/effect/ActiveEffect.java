package com.example.aspects.effect;

import com.example.aspects.model.Modifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * An effect record attached to an actor. Mutated only by the {@link EffectLedger}.
 */
public class ActiveEffect {
    private final String id;
    private final String name;
    private final String originId;
    private final EffectCategory category;
    private final StackPolicy stackPolicy;
    private final List<Modifier> changes = new ArrayList<>();
    private int durationRounds;
    private int startRound;
    private int startTurn;
    private boolean disabled;
    private DamageOverTime dot;

    public ActiveEffect(EffectSpec spec, int startRound, int startTurn) {
        this(UUID.randomUUID().toString(), spec, startRound, startTurn);
    }

    public ActiveEffect(String id, EffectSpec spec, int startRound, int startTurn) {
        this.id = id;
        this.name = spec.name();
        this.originId = spec.originId();
        this.category = spec.category();
        this.stackPolicy = spec.stackPolicy();
        this.changes.addAll(spec.changes());
        this.durationRounds = spec.durationRounds();
        this.startRound = startRound;
        this.startTurn = startTurn;
        this.dot = spec.dot();
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getOriginId() { return originId; }
    public EffectCategory getCategory() { return category; }
    public StackPolicy getStackPolicy() { return stackPolicy; }
    public List<Modifier> getChanges() { return Collections.unmodifiableList(changes); }
    public int getDurationRounds() { return durationRounds; }
    public int getStartRound() { return startRound; }
    public int getStartTurn() { return startTurn; }
    public boolean isDisabled() { return disabled; }
    public DamageOverTime getDot() { return dot; }

    public void setDisabled(boolean disabled) { this.disabled = disabled; }

    public boolean matches(String originId, String name) {
        return this.name.equals(name) && (this.originId == null ? originId == null : this.originId.equals(originId));
    }

    /** Round-limited effects expire once {@code currentRound - startRound >= duration}. */
    public boolean isExpired(int currentRound) {
        if (category == EffectCategory.EQUIPMENT || durationRounds <= 0) return false;
        return currentRound - startRound >= durationRounds;
    }

    public double magnitude() {
        return magnitudeOf(changes, dot);
    }

    void replaceChanges(List<Modifier> newChanges) {
        changes.clear();
        changes.addAll(newChanges);
    }

    void refresh(int durationRounds, int startRound, int startTurn) {
        this.durationRounds = durationRounds;
        this.startRound = startRound;
        this.startTurn = startTurn;
    }

    void setDot(DamageOverTime dot) { this.dot = dot; }

    static double magnitudeOf(List<Modifier> changes, DamageOverTime dot) {
        double total = 0;
        for (Modifier m : changes) total += Math.abs(m.value());
        if (dot != null) total += Math.abs(dot.amount());
        return total;
    }

    @Override
    public String toString() {
        return "ActiveEffect[" + name + " from " + originId + ", " + category + ", " + changes + "]";
    }
}

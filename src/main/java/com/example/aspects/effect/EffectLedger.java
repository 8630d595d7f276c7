package com.example.aspects.effect;

import com.example.aspects.combat.TurnNotifier;
import com.example.aspects.model.Actor;
import com.example.aspects.model.Modifier;
import com.example.aspects.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Creates, merges, expires and removes the effects attached to an actor.
 * Effects from the same origin and name are one effect: a reapplication
 * either stacks into it or replaces it when stronger, never duplicates it.
 */
public class EffectLedger {

    private static final Logger logger = LoggerFactory.getLogger(EffectLedger.class);

    private final TurnNotifier turns;

    public EffectLedger(TurnNotifier turns) {
        this.turns = turns;
    }

    public ApplyOutcome applyEffect(Actor target, EffectSpec spec) {
        int round = turns != null ? turns.currentRound() : 0;
        int turn = turns != null ? turns.currentTurn() : 0;
        ActiveEffect existing = find(target, spec.originId(), spec.name());

        if (existing == null) {
            ActiveEffect created = new ActiveEffect(spec, round, turn);
            target.getEffects().add(created);
            logger.debug("[EffectLedger] Created {} on {}", spec.name(), target.getId());
            return ApplyOutcome.CREATED;
        }

        if (spec.stackPolicy() == StackPolicy.STACK) {
            existing.replaceChanges(mergeChanges(existing.getChanges(), spec.changes()));
            if (spec.dot() != null) {
                existing.setDot(existing.getDot() != null ? existing.getDot().merge(spec.dot()) : spec.dot());
            }
            existing.refresh(spec.durationRounds(), round, turn);
            logger.debug("[EffectLedger] Stacked {} on {} -> {}", spec.name(), target.getId(), existing.getChanges());
            return ApplyOutcome.MERGED;
        }

        if (spec.magnitude() > existing.magnitude()) {
            existing.replaceChanges(spec.changes());
            existing.setDot(spec.dot());
            existing.refresh(spec.durationRounds(), round, turn);
            logger.debug("[EffectLedger] Upgraded {} on {}", spec.name(), target.getId());
            return ApplyOutcome.UPGRADED;
        }
        logger.debug("[EffectLedger] Kept stronger {} on {} ({} >= {})", spec.name(), target.getId(),
            existing.magnitude(), spec.magnitude());
        return ApplyOutcome.UNCHANGED;
    }

    /** Removes every effect created by {@code originId}. Returns how many were removed. */
    public int removeEffectsByOrigin(Actor target, String originId) {
        if (originId == null) return 0;
        int removed = 0;
        for (Iterator<ActiveEffect> it = target.getEffects().iterator(); it.hasNext(); ) {
            if (originId.equals(it.next().getOriginId())) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) logger.debug("[EffectLedger] Removed {} effect(s) from {} on {}", removed, originId, target.getId());
        return removed;
    }

    /**
     * Deletes the target's round-limited effects whose duration has run out.
     * Called when the target's own turn ends.
     */
    public List<ActiveEffect> tickExpiry(Actor target, int currentRound) {
        List<ActiveEffect> expired = new ArrayList<>();
        for (Iterator<ActiveEffect> it = target.getEffects().iterator(); it.hasNext(); ) {
            ActiveEffect e = it.next();
            if (e.isExpired(currentRound)) {
                it.remove();
                expired.add(e);
            }
        }
        if (!expired.isEmpty()) logger.info("[EffectLedger] Expired {} effect(s) on {}", expired.size(), target.getId());
        return expired;
    }

    /**
     * Applies every damage-over-time payload on {@code target} that was
     * applied by {@code applierId}. Damage goes straight to health, clamped at
     * zero. Returns the health actually lost.
     */
    public int applyDamageOverTime(Actor target, String applierId) {
        int total = 0;
        for (ActiveEffect e : target.getEffects()) {
            DamageOverTime dot = e.getDot();
            if (dot == null || e.isDisabled() || applierId == null || !applierId.equals(dot.applierId())) continue;
            total += Math.max(0, dot.amount());
        }
        if (total == 0) return 0;
        int lost = -target.getResource(ResourceType.HEALTH).adjust(-total);
        logger.info("[EffectLedger] DoT from {} dealt {} to {}", applierId, lost, target.getId());
        return lost;
    }

    public boolean setDisabled(Actor target, String effectId, boolean disabled) {
        for (ActiveEffect e : target.getEffects()) {
            if (e.getId().equals(effectId)) {
                e.setDisabled(disabled);
                return true;
            }
        }
        return false;
    }

    public List<ActiveEffect> byCategory(Actor target, EffectCategory category) {
        List<ActiveEffect> out = new ArrayList<>();
        for (ActiveEffect e : target.getEffects()) if (e.getCategory() == category) out.add(e);
        return out;
    }

    public ActiveEffect find(Actor target, String originId, String name) {
        for (ActiveEffect e : target.getEffects()) {
            if (e.matches(originId, name)) return e;
        }
        return null;
    }

    static List<Modifier> mergeChanges(List<Modifier> current, List<Modifier> incoming) {
        List<Modifier> merged = new ArrayList<>(current);
        for (Modifier add : incoming) {
            boolean found = false;
            for (int i = 0; i < merged.size(); i++) {
                Modifier m = merged.get(i);
                if (m.sameKey(add)) {
                    merged.set(i, m.withValue(m.value() + add.value()));
                    found = true;
                    break;
                }
            }
            if (!found) merged.add(add);
        }
        return merged;
    }
}

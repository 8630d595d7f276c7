package com.example.aspects.progression;

import com.example.aspects.chat.ChatMessage;
import com.example.aspects.chat.Notifier;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.Progression;
import com.example.aspects.model.ProgressionType;
import com.example.aspects.model.Rank;
import com.example.aspects.model.TemplateItem;
import com.example.aspects.persistence.EntityStore;
import com.example.aspects.stats.StatEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Level-up mechanics for race, class and profession.
 * <ol>
 *   <li>the progression's level goes up by the requested number of levels</li>
 *   <li>each level's template gains are added to the base abilities (race
 *       templates use the gains of the rank reached at that level)</li>
 *   <li>each level's free points are added to the pool</li>
 *   <li>free points are spent per the {@link PointAllocation}</li>
 *   <li>ranks and resource maxima are re-derived and a chat card is posted</li>
 * </ol>
 * Everything is validated before anything changes. Tiered classes stop at
 * their tier's level cap.
 */
public class LevelingService {

    private static final Logger logger = LoggerFactory.getLogger(LevelingService.class);

    private final EntityStore store;
    private final StatEngine engine;
    private final Notifier notifier;
    private final Random random;

    public LevelingService(EntityStore store, StatEngine engine, Notifier notifier) {
        this(store, engine, notifier, new Random());
    }

    public LevelingService(EntityStore store, StatEngine engine, Notifier notifier, Random random) {
        this.store = store;
        this.engine = engine;
        this.notifier = notifier;
        this.random = random;
    }

    public LevelUpResult levelUp(Actor actor, ProgressionType type) {
        return levelUp(actor, type, Collections.emptyMap());
    }

    public LevelUpResult levelUp(Actor actor, ProgressionType type, Map<Ability, Integer> allocation) {
        return levelUp(actor, type, 1, allocation, PointAllocation.MANUAL);
    }

    public LevelUpResult levelUp(Actor actor, ProgressionType type, int levels, PointAllocation method) {
        return levelUp(actor, type, levels, Collections.emptyMap(), method);
    }

    public LevelUpResult levelUp(Actor actor, ProgressionType type, int levels,
                                 Map<Ability, Integer> allocation, PointAllocation method) {
        if (levels < 1) return LevelUpResult.failure(type, "Level count must be at least 1.");
        Progression progression = actor.getProgression(type);
        TemplateItem template = template(actor, progression);
        if (template == null) {
            logger.warn("[LevelingService] {} has no {} template ({}), level-up skipped",
                actor.getName(), type.key, progression.getTemplateId());
            return LevelUpResult.failure(type, "No " + type.key + " template.");
        }

        int oldLevel = progression.getLevel();
        int newLevel = oldLevel + levels;
        if (type == ProgressionType.CLASS && newLevel > template.maxLevel()) {
            return LevelUpResult.failure(type, "Tier " + template.getTier() + " classes cannot exceed level "
                + template.maxLevel() + ".");
        }

        Map<Ability, Integer> gains = new EnumMap<>(Ability.class);
        int freeGained = 0;
        for (int level = oldLevel + 1; level <= newLevel; level++) {
            Rank rank = type == ProgressionType.RACE ? engine.getRules().rankForLevel(level) : null;
            freeGained += Math.max(0, template.freePointsAt(rank));
            for (Ability a : Ability.values()) {
                int gain = template.gainAt(rank, a);
                if (gain != 0) gains.merge(a, gain, Integer::sum);
            }
        }

        Map<Ability, Integer> spent;
        if (method == PointAllocation.RANDOM) {
            spent = randomAllocation(freeGained);
        } else if (method == PointAllocation.SAVE) {
            spent = Collections.emptyMap();
        } else {
            String invalid = validate(allocation, actor.getFreePoints() + freeGained);
            if (invalid != null) return LevelUpResult.failure(type, invalid);
            spent = allocation != null ? allocation : Collections.emptyMap();
        }

        for (Map.Entry<Ability, Integer> g : gains.entrySet()) {
            actor.setBaseAbility(g.getKey(), actor.getBaseAbility(g.getKey()) + g.getValue());
        }
        progression.setLevel(newLevel);
        actor.setFreePoints(actor.getFreePoints() + freeGained);
        spend(actor, spent);
        engine.refresh(actor);
        store.saveActor(actor);

        Rank previousRank = engine.getRules().rankForLevel(oldLevel);
        Rank newRank = engine.getRules().rankForLevel(newLevel);
        LevelUpResult result = LevelUpResult.success(type, newLevel, previousRank, newRank, gains, spent, freeGained);
        logger.info("[LevelingService] {} reached {} level {} (rank {})", actor.getName(), type.key, newLevel, newRank);
        announce(actor, oldLevel, result);
        return result;
    }

    /**
     * Levels every actor in turn. A failure for one actor is recorded and the
     * rest still level.
     */
    public BulkLevelUpResult bulkLevelUp(Collection<Actor> actors, ProgressionType type, int levels,
                                         PointAllocation method) {
        BulkLevelUpResult bulk = new BulkLevelUpResult();
        for (Actor actor : actors) {
            try {
                LevelUpResult result = levelUp(actor, type, levels, Collections.emptyMap(), method);
                if (result.isSuccess()) bulk.addSuccess(actor.getName());
                else bulk.addFailure(actor.getName(), result.getFailureMessage());
            } catch (RuntimeException e) {
                logger.error("[LevelingService] Bulk level-up failed for {}", actor.getName(), e);
                bulk.addFailure(actor.getName(), e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        }
        logger.info("[LevelingService] Bulk {} level-up: {} succeeded, {} failed", type.key,
            bulk.getSucceeded().size(), bulk.getFailed().size());
        notifier.post(ChatMessage.of("System", "Level Up", bulk.summary()));
        return bulk;
    }

    /** Spends free points without levelling. */
    public LevelUpResult allocateFreePoints(Actor actor, Map<Ability, Integer> allocation) {
        String invalid = validate(allocation, actor.getFreePoints());
        if (invalid != null) return LevelUpResult.failure(null, invalid);
        spend(actor, allocation);
        engine.refresh(actor);
        store.saveActor(actor);
        return LevelUpResult.allocation(allocation);
    }

    /** Spends {@code points} of the actor's pool one at a time on random abilities. */
    public LevelUpResult allocateRandomly(Actor actor, int points) {
        if (points < 0 || points > actor.getFreePoints()) {
            return LevelUpResult.failure(null, "Not enough free points (" + points + " requested, "
                + actor.getFreePoints() + " available).");
        }
        Map<Ability, Integer> spent = randomAllocation(points);
        spend(actor, spent);
        engine.refresh(actor);
        store.saveActor(actor);
        notifier.notice(actor.getOwnerId(), "Randomly allocated " + points + " stat points.");
        return LevelUpResult.allocation(spent);
    }

    private Map<Ability, Integer> randomAllocation(int points) {
        Ability[] abilities = Ability.values();
        Map<Ability, Integer> out = new EnumMap<>(Ability.class);
        for (int i = 0; i < points; i++) {
            out.merge(abilities[random.nextInt(abilities.length)], 1, Integer::sum);
        }
        return out;
    }

    private void announce(Actor actor, int oldLevel, LevelUpResult result) {
        StringBuilder text = new StringBuilder(actor.getName()).append(" levelled up! ")
            .append(result.getType().key).append(": level ").append(oldLevel)
            .append(" -> ").append(result.getNewLevel())
            .append(" (rank ").append(result.getNewRank()).append(").");
        if (result.isRankChanged()) {
            text.append(" Rank breakpoint: ").append(result.getPreviousRank())
                .append(" -> ").append(result.getNewRank()).append('.');
        }
        if (result.getFreePointsGained() > 0) {
            text.append(" Free points gained: ").append(result.getFreePointsGained()).append('.');
        }
        if (actor.getFreePoints() > 0) {
            text.append(" Unspent free points: ").append(actor.getFreePoints()).append('.');
        }
        notifier.post(ChatMessage.of(actor.getName(), "Level Up", text.toString()));
    }

    private TemplateItem template(Actor actor, Progression progression) {
        String id = progression.getTemplateId();
        if (id == null) return null;
        Optional<TemplateItem> owned = actor.findItem(id).filter(TemplateItem.class::isInstance).map(TemplateItem.class::cast);
        if (owned.isPresent()) return owned.get();
        Optional<TemplateItem> shared = store.findItem(id, TemplateItem.class);
        return shared.filter(t -> t.getProgressionType() == progression.getType()).orElse(null);
    }

    private static String validate(Map<Ability, Integer> allocation, int available) {
        if (allocation == null || allocation.isEmpty()) return null;
        int total = 0;
        for (Map.Entry<Ability, Integer> e : allocation.entrySet()) {
            int points = e.getValue() != null ? e.getValue() : 0;
            if (points < 0) return "Cannot allocate negative points to " + e.getKey().displayName + ".";
            total += points;
        }
        if (total > available) return "Not enough free points (" + total + " requested, " + available + " available).";
        return null;
    }

    private static void spend(Actor actor, Map<Ability, Integer> allocation) {
        if (allocation == null) return;
        int total = 0;
        for (Map.Entry<Ability, Integer> e : allocation.entrySet()) {
            int points = e.getValue() != null ? e.getValue() : 0;
            actor.setBaseAbility(e.getKey(), actor.getBaseAbility(e.getKey()) + points);
            total += points;
        }
        actor.setFreePoints(actor.getFreePoints() - total);
    }
}

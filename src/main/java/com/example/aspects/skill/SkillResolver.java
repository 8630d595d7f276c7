package com.example.aspects.skill;

import com.example.aspects.area.AreaPlacer;
import com.example.aspects.area.AreaSpec;
import com.example.aspects.area.AreaTargeting;
import com.example.aspects.area.AreaTemplate;
import com.example.aspects.area.PlacementRequest;
import com.example.aspects.area.PlacementResult;
import com.example.aspects.authority.AuthorityRouter;
import com.example.aspects.authority.Intent;
import com.example.aspects.chat.ChatMessage;
import com.example.aspects.chat.Notifier;
import com.example.aspects.combat.TurnNotifier;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.GearItem;
import com.example.aspects.model.Item;
import com.example.aspects.model.ResourcePool;
import com.example.aspects.persistence.EntityStore;
import com.example.aspects.roll.FormulaException;
import com.example.aspects.roll.RollEvaluator;
import com.example.aspects.roll.RollResult;
import com.example.aspects.stats.DerivedStats;
import com.example.aspects.stats.StatEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Turns a skill activation into rolls, targets and intents.
 * <p>
 * Stages run in order: resource check, formula building, roll evaluation,
 * optional area placement, tag dispatch, resource deduction. The hit and
 * damage rolls are evaluated exactly once and shared by every tag and every
 * target. Nothing is mutated before dispatch, so any abort (missing
 * resource, cancelled placement, no target) costs nothing. The cost is paid
 * once, after dispatch. Chained skills then run against the same targets
 * without cost and cannot chain further.
 */
public class SkillResolver {

    private static final Logger logger = LoggerFactory.getLogger(SkillResolver.class);

    private final EntityStore store;
    private final StatEngine engine;
    private final RollEvaluator evaluator;
    private final AreaPlacer placer;
    private final AreaTargeting targeting;
    private final TagHandlerRegistry handlers;
    private final AuthorityRouter router;
    private final Notifier notifier;
    private final TurnNotifier turns;

    public SkillResolver(EntityStore store, StatEngine engine, RollEvaluator evaluator, AreaPlacer placer,
                         AreaTargeting targeting, TagHandlerRegistry handlers, AuthorityRouter router,
                         Notifier notifier, TurnNotifier turns) {
        this.store = store;
        this.engine = engine;
        this.evaluator = evaluator;
        this.placer = placer;
        this.targeting = targeting;
        this.handlers = handlers;
        this.router = router;
        this.notifier = notifier;
        this.turns = turns;
    }

    /**
     * Activates {@code skillId} for {@code casterId}. The future is already
     * complete unless the skill needs area placement, in which case it
     * completes once the user confirms or cancels.
     *
     * @param explicitTargetId selected target, or null
     */
    public CompletableFuture<SkillOutcome> resolveSkillActivation(String skillId, String casterId, String explicitTargetId) {
        Optional<Actor> casterOpt = store.findActor(casterId);
        if (casterOpt.isEmpty()) {
            logger.warn("[SkillResolver] Unknown caster {}", casterId);
            return abort(skillId, ResolutionStage.IDLE, "Unknown caster.");
        }
        Actor caster = casterOpt.get();
        SkillItem skill = findSkill(caster, skillId);
        if (skill == null) {
            logger.warn("[SkillResolver] {} has no skill {}", caster.getName(), skillId);
            return abort(skillId, ResolutionStage.IDLE, "Unknown skill.");
        }

        if (skill.isPassive()) {
            notifier.post(ChatMessage.of(caster.getName(), skill.getName(), skill.getDescription()));
            return CompletableFuture.completedFuture(SkillOutcome.described(skillId, skill.getDescription()));
        }

        GearItem weapon = null;
        if (skill.getRequiredWeaponId() != null) {
            weapon = equippedWeapon(caster, skill.getRequiredWeaponId());
            if (weapon == null) {
                return abort(skillId, ResolutionStage.IDLE, skill.getName() + " requires its weapon to be equipped.");
            }
        }

        List<Actor> singleTargets = null;
        if (skill.getArea() == null) {
            singleTargets = singleTarget(caster, skill, explicitTargetId);
            if (singleTargets == null) return abort(skillId, ResolutionStage.IDLE, "No valid target.");
        }

        RollConfig roll = skill.getRoll();
        ResourcePool pool = caster.getResource(roll.resource());
        if (pool.getCurrent() < roll.cost()) {
            logger.debug("[SkillResolver] {} lacks {} for {} ({} < {})", caster.getName(), roll.resource().key,
                skill.getName(), pool.getCurrent(), roll.cost());
            return abort(skillId, ResolutionStage.VALIDATING_RESOURCE, "Not enough " + roll.resource().key + ".");
        }

        DerivedStats casterStats = engine.deriveStats(caster);
        Rolls rolls;
        try {
            rolls = evaluate(skill, casterStats);
        } catch (FormulaException e) {
            logger.warn("[SkillResolver] {} has a broken formula: {}", skill.getName(), e.getMessage());
            return abort(skillId, ResolutionStage.ROLL_EVALUATING, "Could not roll " + skill.getName() + ".");
        }

        if (singleTargets != null) {
            return CompletableFuture.completedFuture(finish(caster, skill, weapon, rolls, singleTargets, null));
        }

        AreaSpec area = skill.getArea();
        int range = casterStats.getCastingRange();
        if (!targeting.directedShapeInRange(area, range)) {
            return abort(skillId, ResolutionStage.AREA_PLACEMENT, "Out of range.");
        }
        PlacementRequest request = new PlacementRequest(UUID.randomUUID().toString(), caster.getId(),
            router.getParticipantId(), caster.getPosition(), area, range, turns.currentRound());
        final GearItem requiredWeapon = weapon;
        CompletableFuture<PlacementResult> placement;
        try {
            placement = placer.place(request);
        } catch (RuntimeException e) {
            placement = CompletableFuture.failedFuture(e);
        }
        // Only placement failures abort here; errors after dispatch surface on the returned future.
        return placement.handle((result, error) -> {
            if (error != null || result == null) {
                logger.error("[SkillResolver] Placement for {} failed", skill.getName(), error);
                notifier.warn(router.getParticipantId(), "Placement failed.");
                return SkillOutcome.aborted(skillId, ResolutionStage.AREA_PLACEMENT, "Placement failed.");
            }
            return afterPlacement(caster, skill, requiredWeapon, rolls, result);
        });
    }

    private SkillOutcome afterPlacement(Actor caster, SkillItem skill, GearItem weapon, Rolls rolls, PlacementResult result) {
        switch (result.status()) {
            case CANCELLED:
                notifier.notice(router.getParticipantId(), skill.getName() + " cancelled.");
                return SkillOutcome.aborted(skill.getId(), ResolutionStage.AREA_PLACEMENT, "Placement cancelled.");
            case OUT_OF_RANGE:
                notifier.warn(router.getParticipantId(), "Out of range.");
                return SkillOutcome.aborted(skill.getId(), ResolutionStage.AREA_PLACEMENT, "Out of range.");
            default:
                break;
        }
        AreaTemplate template = result.template();
        List<Actor> targets = targeting.selectTargets(caster, template, store.actors());
        if (targets.isEmpty() && !onlyCasterHandlers(skill)) {
            notifier.warn(router.getParticipantId(), "No valid targets in the area.");
            return SkillOutcome.aborted(skill.getId(), ResolutionStage.TAG_DISPATCH, "No valid targets in the area.");
        }
        return finish(caster, skill, weapon, rolls, targets, template);
    }

    private SkillOutcome finish(Actor caster, SkillItem skill, GearItem weapon, Rolls rolls,
                                List<Actor> targets, AreaTemplate template) {
        List<TargetReport> reports = dispatch(caster, skill, rolls, targets);

        if (weapon != null && skill.hasTag(SkillTag.ATTACK) && !targets.isEmpty()) {
            router.submit(new Intent.DegradeWeapon(caster.getId(), weapon.getId(), (int) Math.round(rolls.damage.total())));
        }

        RollConfig roll = skill.getRoll();
        if (roll.cost() > 0) {
            router.submit(new Intent.SpendResource(caster.getId(), roll.resource(), roll.cost(), skill.getName()));
        }

        if (template != null) {
            if (template.isTimed()) {
                router.submit(new Intent.CreateTemplate(template));
            } else {
                logger.debug("[SkillResolver] Instantaneous template {} discarded", template.id());
            }
        }

        SkillOutcome outcome = SkillOutcome.completed(skill.getId(), rolls.hit, rolls.damage, reports, template, roll.cost());
        runChains(caster, skill, targets, outcome);
        logger.info("[SkillResolver] {} used {} on {} target(s)", caster.getName(), skill.getName(), targets.size());
        return outcome;
    }

    private List<TargetReport> dispatch(Actor caster, SkillItem skill, Rolls rolls, List<Actor> targets) {
        TagContext ctx = new TagContext(caster, skill, rolls.hit, rolls.damage, engine, router, notifier);
        postRollCard(caster, skill, rolls);

        Map<String, TargetReport> reports = new LinkedHashMap<>();
        for (Actor target : targets) {
            TargetReport report = reports.computeIfAbsent(target.getId(), id -> new TargetReport(id, target.getName()));
            for (SkillTag tag : skill.getTags()) {
                TagHandler handler = handler(tag);
                if (handler == null || handler.appliesOnceToCaster(skill)) continue;
                handler.handle(ctx, target, report);
            }
        }
        for (SkillTag tag : skill.getTags()) {
            TagHandler handler = handler(tag);
            if (handler == null || !handler.appliesOnceToCaster(skill)) continue;
            TargetReport report = reports.computeIfAbsent(caster.getId(), id -> new TargetReport(id, caster.getName()));
            handler.handle(ctx, caster, report);
        }
        return new ArrayList<>(reports.values());
    }

    private void runChains(Actor caster, SkillItem parent, List<Actor> targets, SkillOutcome outcome) {
        for (ChainEntry entry : parent.getChains()) {
            SkillItem chained = findSkill(caster, entry.skillId());
            if (chained == null) {
                chained = store.findItem(entry.skillId(), SkillItem.class).orElse(null);
            }
            if (chained == null || chained.isPassive()) {
                logger.warn("[SkillResolver] {} chains to unusable skill {}", parent.getName(), entry.skillId());
                continue;
            }
            List<Actor> qualifying = new ArrayList<>();
            for (Actor t : targets) {
                TargetReport r = outcome.reportFor(t.getId());
                if (entry.trigger().fires(r != null ? r.getHit() : null)) qualifying.add(t);
            }
            if (qualifying.isEmpty()) continue;

            Rolls rolls;
            try {
                rolls = evaluate(chained, engine.deriveStats(caster));
            } catch (FormulaException e) {
                logger.warn("[SkillResolver] Chained {} has a broken formula: {}", chained.getName(), e.getMessage());
                continue;
            }
            List<TargetReport> reports = dispatch(caster, chained, rolls, qualifying);
            GearItem weapon = chained.getRequiredWeaponId() != null ? equippedWeapon(caster, chained.getRequiredWeaponId()) : null;
            if (weapon != null && chained.hasTag(SkillTag.ATTACK)) {
                router.submit(new Intent.DegradeWeapon(caster.getId(), weapon.getId(), (int) Math.round(rolls.damage.total())));
            }
            outcome.addChained(SkillOutcome.completed(chained.getId(), rolls.hit, rolls.damage, reports, null, 0));
            logger.debug("[SkillResolver] {} chained into {} ({})", parent.getName(), chained.getName(), entry.trigger());
        }
    }

    private Rolls evaluate(SkillItem skill, DerivedStats casterStats) {
        RollConfig roll = skill.getRoll();
        RollFormulas formulas = SkillFormulas.build(roll);
        Map<String, Double> bindings = bindings(casterStats, roll.ability());
        RollResult hit = formulas.hasHit() ? evaluator.evaluate(formulas.hit(), bindings) : null;
        RollResult damage = evaluator.evaluate(formulas.damage(), bindings);
        return new Rolls(hit, damage);
    }

    static Map<String, Double> bindings(DerivedStats stats, Ability configured) {
        Map<String, Double> b = new HashMap<>();
        for (Ability a : Ability.values()) b.put(a.modVariable(), (double) stats.mod(a));
        b.put(SkillFormulas.ABILITY_VARIABLE, (double) stats.mod(configured));
        return b;
    }

    /** Explicit target if given; otherwise the caster, unless a tag needs someone else. */
    private List<Actor> singleTarget(Actor caster, SkillItem skill, String explicitTargetId) {
        if (explicitTargetId != null) {
            Optional<Actor> target = store.findActor(explicitTargetId);
            if (target.isEmpty()) return null;
            List<Actor> out = new ArrayList<>();
            out.add(target.get());
            return out;
        }
        if (skill.hasTag(SkillTag.ATTACK) || skill.hasTag(SkillTag.DEBUFF)) return null;
        List<Actor> out = new ArrayList<>();
        out.add(caster);
        return out;
    }

    private boolean onlyCasterHandlers(SkillItem skill) {
        if (skill.getTags().isEmpty()) return false;
        for (SkillTag tag : skill.getTags()) {
            TagHandler h = handler(tag);
            if (h == null || !h.appliesOnceToCaster(skill)) return false;
        }
        return true;
    }

    private TagHandler handler(SkillTag tag) {
        TagHandler h = handlers.get(tag);
        if (h == null) logger.warn("[SkillResolver] No handler registered for tag {}", tag);
        return h;
    }

    /** A skill the caster owns, or one granted by gear the caster has equipped. */
    SkillItem findSkill(Actor caster, String skillId) {
        Optional<Item> owned = caster.findItem(skillId);
        if (owned.isPresent() && owned.get() instanceof SkillItem) return (SkillItem) owned.get();
        for (GearItem g : caster.getEquippedGear()) {
            if (!g.isBroken() && g.getGrantedSkillIds().contains(skillId)) {
                return store.findItem(skillId, SkillItem.class).orElse(null);
            }
        }
        return null;
    }

    private static GearItem equippedWeapon(Actor caster, String weaponId) {
        for (GearItem g : caster.getEquippedGear()) if (g.getId().equals(weaponId)) return g;
        return null;
    }

    private void postRollCard(Actor caster, SkillItem skill, Rolls rolls) {
        StringBuilder sb = new StringBuilder();
        if (rolls.hit != null) sb.append("To hit ").append(Math.round(rolls.hit.total())).append(". ");
        sb.append("Roll ").append(Math.round(rolls.damage.total())).append('.');
        notifier.post(ChatMessage.of(caster.getName(), skill.getName(), sb.toString()));
    }

    private CompletableFuture<SkillOutcome> abort(String skillId, ResolutionStage stage, String message) {
        notifier.warn(router.getParticipantId(), message);
        return CompletableFuture.completedFuture(SkillOutcome.aborted(skillId, stage, message));
    }

    private static final class Rolls {
        final RollResult hit;
        final RollResult damage;

        Rolls(RollResult hit, RollResult damage) {
            this.hit = hit;
            this.damage = damage;
        }
    }
}

package com.example.aspects;

import com.example.aspects.area.AreaPlacer;
import com.example.aspects.area.AreaTargeting;
import com.example.aspects.area.TemplateStore;
import com.example.aspects.authority.AuthorityRouter;
import com.example.aspects.authority.Intent;
import com.example.aspects.authority.IntentExecutor;
import com.example.aspects.authority.MessageChannel;
import com.example.aspects.authority.SessionRoles;
import com.example.aspects.chat.Notifier;
import com.example.aspects.combat.TurnNotifier;
import com.example.aspects.effect.EffectLedger;
import com.example.aspects.effect.RoundSweeper;
import com.example.aspects.equipment.EquipmentSystem;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.Item;
import com.example.aspects.model.ProgressionType;
import com.example.aspects.persistence.EntityStore;
import com.example.aspects.persistence.RulesConfig;
import com.example.aspects.progression.LevelUpResult;
import com.example.aspects.progression.LevelingService;
import com.example.aspects.progression.PointAllocation;
import com.example.aspects.roll.RollEvaluator;
import com.example.aspects.skill.SkillOutcome;
import com.example.aspects.skill.SkillResolver;
import com.example.aspects.skill.TagHandlerRegistry;
import com.example.aspects.stats.DerivedStats;
import com.example.aspects.stats.StatEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One participant's view of the rules engine. Wires the stat engine, effect
 * ledger, equipment, authority routing and skill resolution over a shared
 * store and message channel.
 */
public class RulesEngine {

    private static final Logger logger = LoggerFactory.getLogger(RulesEngine.class);

    private final EntityStore store;
    private final StatEngine engine;
    private final EffectLedger ledger;
    private final EquipmentSystem equipment;
    private final AuthorityRouter router;
    private final SkillResolver resolver;
    private final LevelingService leveling;
    private final RoundSweeper sweeper;
    private final TurnNotifier turns;

    public RulesEngine(String participantId, SessionRoles roles, MessageChannel channel, EntityStore store,
                       TemplateStore templates, RulesConfig rules, RollEvaluator evaluator, AreaPlacer placer,
                       Notifier notifier, TurnNotifier turns) {
        Objects.requireNonNull(participantId, "participantId");
        this.store = Objects.requireNonNull(store, "store");
        this.turns = Objects.requireNonNull(turns, "turns");
        this.engine = new StatEngine(rules);
        this.ledger = new EffectLedger(turns);
        this.equipment = new EquipmentSystem(store, ledger, engine, notifier);
        IntentExecutor executor = new IntentExecutor(store, ledger, equipment, engine, templates, notifier);
        this.router = new AuthorityRouter(participantId, roles, channel, store, executor);
        this.resolver = new SkillResolver(store, engine, evaluator, placer, new AreaTargeting(),
            TagHandlerRegistry.withDefaults(), router, notifier, turns);
        this.leveling = new LevelingService(store, engine, notifier);
        this.sweeper = new RoundSweeper(router, store, ledger, engine, templates, notifier);
        turns.addListener(sweeper);
        logger.info("[RulesEngine] Participant {} ready (authority: {})", participantId, router.isAuthority());
    }

    /** Derived stats of an actor, or null when the actor is unknown. */
    public DerivedStats deriveStats(String actorId) {
        return store.findActor(actorId).map(engine::deriveStats).orElse(null);
    }

    /**
     * Equips an item. Gear on an actor this participant does not own is
     * forwarded to the authority, and the call returns false because nothing
     * changed locally.
     */
    public boolean equip(String itemId) {
        String owner = ownerActorId(itemId);
        if (owner == null) return false;
        Intent intent = new Intent.EquipItem(owner, itemId);
        if (!appliesLocally(intent)) return forward(intent);
        return equipment.equip(itemId);
    }

    public boolean unequip(String itemId) {
        String owner = ownerActorId(itemId);
        if (owner == null) return false;
        Intent intent = new Intent.UnequipItem(owner, itemId);
        if (!appliesLocally(intent)) return forward(intent);
        return equipment.unequip(itemId);
    }

    public boolean repair(String itemId, String kitId) {
        String owner = ownerActorId(itemId);
        if (owner == null) return false;
        Intent intent = new Intent.RepairItem(owner, itemId, kitId);
        if (!appliesLocally(intent)) return forward(intent);
        return equipment.repair(itemId, kitId);
    }

    private String ownerActorId(String itemId) {
        Optional<Item> item = store.findItem(itemId);
        if (item.isEmpty() || item.get().getOwnerId() == null) {
            logger.warn("[RulesEngine] No owned item {}", itemId);
            return null;
        }
        return item.get().getOwnerId();
    }

    private boolean appliesLocally(Intent intent) {
        return router.isAuthority() || router.ownsTarget(intent);
    }

    private boolean forward(Intent intent) {
        logger.debug("[RulesEngine] {} on {} needs the authority", intent.kind(), intent.targetActorId());
        router.submit(intent);
        return false;
    }

    public CompletableFuture<SkillOutcome> resolveSkillActivation(String skillId, String casterId, String explicitTargetId) {
        return resolver.resolveSkillActivation(skillId, casterId, explicitTargetId);
    }

    public LevelUpResult levelUp(String actorId, ProgressionType type, Map<Ability, Integer> allocation) {
        Actor actor = store.findActor(actorId).orElse(null);
        if (actor == null) return LevelUpResult.failure(type, "Unknown actor.");
        return leveling.levelUp(actor, type, allocation);
    }

    public LevelUpResult levelUp(String actorId, ProgressionType type, int levels, PointAllocation method) {
        Actor actor = store.findActor(actorId).orElse(null);
        if (actor == null) return LevelUpResult.failure(type, "Unknown actor.");
        return leveling.levelUp(actor, type, levels, method);
    }

    /** Stops observing turn changes. */
    public void close() {
        turns.removeListener(sweeper);
    }

    public StatEngine getStatEngine() { return engine; }
    public EffectLedger getLedger() { return ledger; }
    public EquipmentSystem getEquipment() { return equipment; }
    public AuthorityRouter getRouter() { return router; }
    public SkillResolver getResolver() { return resolver; }
    public LevelingService getLeveling() { return leveling; }
}

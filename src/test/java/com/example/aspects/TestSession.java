package com.example.aspects;

import com.example.aspects.area.AreaPlacer;
import com.example.aspects.area.AreaTargeting;
import com.example.aspects.area.PlacementRequest;
import com.example.aspects.area.PlacementResult;
import com.example.aspects.area.TemplateStore;
import com.example.aspects.authority.AuthorityRouter;
import com.example.aspects.authority.IntentExecutor;
import com.example.aspects.authority.LocalMessageChannel;
import com.example.aspects.authority.SessionRoles;
import com.example.aspects.combat.CombatTracker;
import com.example.aspects.effect.EffectLedger;
import com.example.aspects.equipment.EquipmentSystem;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.ActorType;
import com.example.aspects.model.ResourceType;
import com.example.aspects.persistence.InMemoryEntityStore;
import com.example.aspects.persistence.RulesConfig;
import com.example.aspects.skill.SkillResolver;
import com.example.aspects.skill.TagHandlerRegistry;
import com.example.aspects.stats.StatEngine;

import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A single-process session where the local participant "gm" is the
 * authority. Wires the real collaborators around a scripted roll evaluator
 * and a scripted area placer.
 */
class TestSession {
    static final String GM = "gm";

    final InMemoryEntityStore store = new InMemoryEntityStore();
    final SessionRoles roles = new SessionRoles(GM);
    final LocalMessageChannel channel = new LocalMessageChannel();
    final CombatTracker tracker = new CombatTracker();
    final StatEngine engine = new StatEngine(RulesConfig.defaults());
    final EffectLedger ledger = new EffectLedger(tracker);
    final RecordingNotifier notifier = new RecordingNotifier();
    final EquipmentSystem equipment = new EquipmentSystem(store, ledger, engine, notifier);
    final TemplateStore templates = new TemplateStore();
    final IntentExecutor executor = new IntentExecutor(store, ledger, equipment, engine, templates, notifier);
    final AuthorityRouter router = new AuthorityRouter(GM, roles, channel, store, executor);
    final ScriptedRollEvaluator evaluator;
    Function<PlacementRequest, PlacementResult> placement = r -> PlacementResult.cancelled();
    final AreaPlacer placer = request -> CompletableFuture.completedFuture(placement.apply(request));
    final SkillResolver resolver;

    TestSession(double... rolls) {
        this.evaluator = new ScriptedRollEvaluator(rolls);
        this.resolver = new SkillResolver(store, engine, evaluator, placer, new AreaTargeting(),
            TagHandlerRegistry.withDefaults(), router, notifier, tracker);
    }

    /** Saved actor with every ability at {@code base}, pools refreshed and filled. */
    Actor actor(String id, int base) {
        Actor a = new Actor(id, id, ActorType.CHARACTER);
        for (Ability ab : Ability.values()) a.setBaseAbility(ab, base);
        store.saveActor(a);
        fill(a);
        return a;
    }

    void fill(Actor a) {
        engine.refresh(a);
        for (ResourceType r : ResourceType.values()) a.getResource(r).setCurrent(a.getResource(r).getMax());
    }
}

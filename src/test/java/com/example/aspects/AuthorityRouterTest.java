package com.example.aspects;

import com.example.aspects.area.AreaSpec;
import com.example.aspects.area.AreaTemplate;
import com.example.aspects.area.TargetingMode;
import com.example.aspects.area.TemplateStore;
import com.example.aspects.authority.AuthorityRouter;
import com.example.aspects.authority.Intent;
import com.example.aspects.authority.IntentExecutor;
import com.example.aspects.authority.LocalMessageChannel;
import com.example.aspects.authority.SessionRoles;
import com.example.aspects.combat.CombatTracker;
import com.example.aspects.effect.EffectLedger;
import com.example.aspects.equipment.EquipmentSystem;
import com.example.aspects.model.Ability;
import com.example.aspects.model.Actor;
import com.example.aspects.model.ActorType;
import com.example.aspects.model.Point;
import com.example.aspects.model.ResourceType;
import com.example.aspects.persistence.InMemoryEntityStore;
import com.example.aspects.persistence.RulesConfig;
import com.example.aspects.stats.StatEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuthorityRouter Tests")
class AuthorityRouterTest {

    private final InMemoryEntityStore store = new InMemoryEntityStore();
    private final SessionRoles roles = new SessionRoles("gm");
    private final LocalMessageChannel channel = new LocalMessageChannel();
    private final StatEngine engine = new StatEngine(RulesConfig.defaults());
    private final EffectLedger ledger = new EffectLedger(new CombatTracker());
    private final RecordingNotifier notifier = new RecordingNotifier();
    private final EquipmentSystem equipment = new EquipmentSystem(store, ledger, engine, notifier);
    private final TemplateStore templates = new TemplateStore();

    private CountingExecutor gmExecutor;
    private CountingExecutor playerExecutor;
    private AuthorityRouter gm;
    private AuthorityRouter player;
    private Actor monster;
    private Actor hero;

    /** Records which intents reached this participant's executor. */
    private class CountingExecutor extends IntentExecutor {
        final List<Intent> executed = new ArrayList<>();

        CountingExecutor() {
            super(store, ledger, equipment, engine, templates, notifier);
        }

        @Override
        public void execute(Intent intent) {
            executed.add(intent);
            super.execute(intent);
        }
    }

    private Actor actor(String id, String owner) {
        Actor a = new Actor(id, id, ActorType.CHARACTER);
        a.setOwnerId(owner);
        for (Ability ab : Ability.values()) a.setBaseAbility(ab, 20);
        store.saveActor(a);
        engine.refresh(a);
        a.getResource(ResourceType.MANA).setCurrent(a.getResource(ResourceType.MANA).getMax());
        return a;
    }

    @BeforeEach
    void setUp() {
        gmExecutor = new CountingExecutor();
        playerExecutor = new CountingExecutor();
        gm = new AuthorityRouter("gm", roles, channel, store, gmExecutor);
        player = new AuthorityRouter("p1", roles, channel, store, playerExecutor);
        monster = actor("monster", "gm");
        hero = actor("hero", "p1");
    }

    private static Intent spend(String actorId) {
        return new Intent.SpendResource(actorId, ResourceType.MANA, 3, "test");
    }

    @Test
    @DisplayName("Intents on actors the player does not own are forwarded to the authority")
    void forwardsToAuthority() {
        int before = monster.getResource(ResourceType.MANA).getCurrent();

        player.submit(spend("monster"));

        assertEquals(1, gmExecutor.executed.size());
        assertTrue(playerExecutor.executed.isEmpty());
        assertEquals(before - 3, monster.getResource(ResourceType.MANA).getCurrent());
    }

    @Test
    @DisplayName("Owners apply intents on their own actors without the authority")
    void ownerExecutesLocally() {
        int before = hero.getResource(ResourceType.MANA).getCurrent();

        player.submit(spend("hero"));

        assertEquals(1, playerExecutor.executed.size());
        assertTrue(gmExecutor.executed.isEmpty());
        assertEquals(before - 3, hero.getResource(ResourceType.MANA).getCurrent());
    }

    @Test
    @DisplayName("The authority applies everything itself, exactly once")
    void authorityExecutesOnce() {
        gm.submit(spend("hero"));
        gm.submit(spend("monster"));

        assertEquals(2, gmExecutor.executed.size());
        assertTrue(playerExecutor.executed.isEmpty());
    }

    @Test
    @DisplayName("Scene-level intents always go to the authority")
    void sceneIntentsForwarded() {
        AreaTemplate template = new AreaTemplate("t1", "hero", AreaSpec.circle(10, TargetingMode.ALL).withDuration(1),
            new Point(0, 0), 0, 1);

        player.submit(new Intent.CreateTemplate(template));

        assertEquals(1, gmExecutor.executed.size());
        assertTrue(templates.find("t1").isPresent());
    }

    @Test
    @DisplayName("After a handover the new authority receives forwarded intents")
    void transferAuthority() {
        roles.transferAuthority("p1");
        assertTrue(player.isAuthority());
        assertFalse(gm.isAuthority());

        gm.submit(spend("hero"));

        assertEquals(1, playerExecutor.executed.size());
        assertTrue(gmExecutor.executed.isEmpty());
    }

    @Test
    @DisplayName("An intent naming a missing item is skipped and later ones still run")
    void missingItemSkipped() {
        gm.submit(new Intent.DegradeWeapon("monster", "no-such-weapon", 10));
        gm.submit(spend("monster"));

        assertEquals(2, gmExecutor.executed.size());
        assertTrue(notifier.warnings.isEmpty());
    }
}

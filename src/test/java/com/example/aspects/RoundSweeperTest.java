package com.example.aspects;

import com.example.aspects.area.AreaSpec;
import com.example.aspects.area.AreaTemplate;
import com.example.aspects.area.TargetingMode;
import com.example.aspects.authority.AuthorityRouter;
import com.example.aspects.combat.TurnChange;
import com.example.aspects.effect.DamageOverTime;
import com.example.aspects.effect.EffectCategory;
import com.example.aspects.effect.EffectSpec;
import com.example.aspects.effect.RoundSweeper;
import com.example.aspects.effect.StackPolicy;
import com.example.aspects.model.Actor;
import com.example.aspects.model.DamageType;
import com.example.aspects.model.Modifier;
import com.example.aspects.model.Point;
import com.example.aspects.model.ResourceType;
import com.example.aspects.model.Stat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RoundSweeper Tests")
class RoundSweeperTest {

    private TestSession session;
    private RoundSweeper sweeper;
    private Actor caster;
    private Actor target;

    @BeforeEach
    void setUp() {
        session = new TestSession();
        sweeper = new RoundSweeper(session.router, session.store, session.ledger, session.engine,
            session.templates, session.notifier);
        session.tracker.addListener(sweeper);
        caster = session.actor("caster", 30);
        target = session.actor("target", 30);
    }

    private void poison(int duration) {
        session.ledger.applyEffect(target, new EffectSpec("Venom", "venom", EffectCategory.TEMPORARY,
            List.of(Modifier.add(Stat.MELEE_DEFENSE, -3)), duration, StackPolicy.STACK,
            new DamageOverTime(5, DamageType.PHYSICAL, caster.getId())));
    }

    @Test
    @DisplayName("A two-round poison ticks on the applier's turn and wears off at the end of the target's")
    void damageOverTimeLifecycle() {
        session.tracker.start(List.of("caster", "target"));
        poison(2);
        int health = target.getResource(ResourceType.HEALTH).getCurrent();

        session.tracker.nextTurn();
        assertEquals(health, target.getResource(ResourceType.HEALTH).getCurrent());

        session.tracker.nextTurn();
        assertEquals(health - 5, target.getResource(ResourceType.HEALTH).getCurrent());
        assertNotNull(session.ledger.find(target, "venom", "Venom"));

        session.tracker.nextTurn();
        session.tracker.nextTurn();
        assertNull(session.ledger.find(target, "venom", "Venom"));
        assertEquals(health - 5, target.getResource(ResourceType.HEALTH).getCurrent());
        assertTrue(session.notifier.postedContaining("Venom has worn off."));
    }

    @Test
    @DisplayName("The same turn change is processed only once")
    void idempotentPerTurn() {
        poison(5);
        int health = target.getResource(ResourceType.HEALTH).getCurrent();
        TurnChange change = new TurnChange(2, 0, "target", "caster", true);

        sweeper.onTurnChange(change);
        sweeper.onTurnChange(change);

        assertEquals(health - 5, target.getResource(ResourceType.HEALTH).getCurrent());
    }

    @Test
    @DisplayName("Only the authority writes")
    void nonAuthorityIgnores() {
        poison(5);
        int health = target.getResource(ResourceType.HEALTH).getCurrent();
        AuthorityRouter player = new AuthorityRouter("p1", session.roles, session.channel, session.store, session.executor);
        RoundSweeper playerSweeper = new RoundSweeper(player, session.store, session.ledger, session.engine,
            session.templates, session.notifier);

        playerSweeper.onTurnChange(new TurnChange(2, 0, "target", "caster", true));

        assertEquals(health, target.getResource(ResourceType.HEALTH).getCurrent());
    }

    @Test
    @DisplayName("Timed templates are removed when their last round is over")
    void templatesSwept() {
        session.templates.create(new AreaTemplate("wall", "caster",
            AreaSpec.rect(20, TargetingMode.ALL).withDuration(1), new Point(0, 0), 0, 1));
        session.tracker.start(List.of("caster", "target"));

        session.tracker.nextTurn();
        assertTrue(session.templates.find("wall").isPresent());

        session.tracker.nextTurn();
        assertTrue(session.templates.find("wall").isEmpty());
    }
}

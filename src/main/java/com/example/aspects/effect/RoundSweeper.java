package com.example.aspects.effect;

import com.example.aspects.area.TemplateStore;
import com.example.aspects.authority.AuthorityRouter;
import com.example.aspects.chat.ChatMessage;
import com.example.aspects.chat.Notifier;
import com.example.aspects.combat.TurnChange;
import com.example.aspects.combat.TurnListener;
import com.example.aspects.model.Actor;
import com.example.aspects.persistence.EntityStore;
import com.example.aspects.stats.StatEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Round-boundary bookkeeping driven by turn changes: effect expiry when the
 * target's turn ends, damage-over-time when the applier's turn starts, and
 * template expiry when a new round begins.
 * <p>
 * Every participant receives the same turn events; only the authority writes,
 * and each (round, turn) is processed at most once.
 */
public class RoundSweeper implements TurnListener {

    private static final Logger logger = LoggerFactory.getLogger(RoundSweeper.class);

    private final AuthorityRouter router;
    private final EntityStore store;
    private final EffectLedger ledger;
    private final StatEngine engine;
    private final TemplateStore templates;
    private final Notifier notifier;

    private int lastRound = -1;
    private int lastTurn = -1;

    public RoundSweeper(AuthorityRouter router, EntityStore store, EffectLedger ledger,
                        StatEngine engine, TemplateStore templates, Notifier notifier) {
        this.router = router;
        this.store = store;
        this.ledger = ledger;
        this.engine = engine;
        this.templates = templates;
        this.notifier = notifier;
    }

    @Override
    public void onTurnChange(TurnChange change) {
        if (!router.isAuthority()) return;
        if (change.round() == lastRound && change.turn() == lastTurn) {
            logger.debug("[RoundSweeper] Round {} turn {} already processed", change.round(), change.turn());
            return;
        }
        lastRound = change.round();
        lastTurn = change.turn();

        if (change.endedCombatantId() != null) {
            store.findActor(change.endedCombatantId()).ifPresent(a -> expire(a, change.round()));
        }
        if (change.startedCombatantId() != null) {
            applyDamageOverTime(change.startedCombatantId());
        }
        if (change.roundChanged()) {
            templates.sweepExpired(change.round());
        }
    }

    private void expire(Actor actor, int round) {
        List<ActiveEffect> expired = ledger.tickExpiry(actor, round);
        if (expired.isEmpty()) return;
        engine.refresh(actor);
        for (ActiveEffect e : expired) {
            notifier.post(ChatMessage.of(actor.getName(), e.getName(), e.getName() + " has worn off."));
        }
    }

    private void applyDamageOverTime(String applierId) {
        for (Actor target : store.actors()) {
            int dealt = ledger.applyDamageOverTime(target, applierId);
            if (dealt > 0) {
                notifier.post(ChatMessage.of(target.getName(), "Damage over time",
                    target.getName() + " takes " + dealt + " damage."));
            }
        }
    }
}

package com.example.aspects.authority;

import com.example.aspects.model.Actor;
import com.example.aspects.persistence.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Single-writer routing for one participant.
 * <p>
 * The authority executes every intent itself, in arrival order. Any other
 * participant executes locally only intents that touch an actor it owns and
 * forwards the rest over the channel without waiting for a reply. Intents
 * submitted while one is executing are queued behind it rather than nested.
 */
public class AuthorityRouter {

    private static final Logger logger = LoggerFactory.getLogger(AuthorityRouter.class);

    private final String participantId;
    private final SessionRoles roles;
    private final MessageChannel channel;
    private final EntityStore store;
    private final IntentExecutor executor;

    private final Deque<Intent> pending = new ArrayDeque<>();
    private boolean draining;

    public AuthorityRouter(String participantId, SessionRoles roles, MessageChannel channel,
                           EntityStore store, IntentExecutor executor) {
        this.participantId = participantId;
        this.roles = roles;
        this.channel = channel;
        this.store = store;
        this.executor = executor;
        channel.on(this::receive);
    }

    public String getParticipantId() { return participantId; }

    public boolean isAuthority() {
        return roles.isAuthority(participantId);
    }

    public void submit(Intent intent) {
        if (isAuthority() || ownsTarget(intent)) {
            enqueue(intent);
            return;
        }
        logger.debug("[AuthorityRouter] {} forwarding {} for {}", participantId, intent.kind(), intent.targetActorId());
        channel.emit(new Envelope(participantId, intent));
    }

    /** True when this participant may apply the intent without the authority. */
    public boolean ownsTarget(Intent intent) {
        String target = intent.targetActorId();
        if (target == null) return false;
        Optional<Actor> actor = store.findActor(target);
        return actor.isPresent() && actor.get().isOwnedBy(participantId);
    }

    private void receive(Envelope envelope) {
        if (!isAuthority() || participantId.equals(envelope.senderId())) return;
        logger.debug("[AuthorityRouter] Authority received {} from {}", envelope.intent().kind(), envelope.senderId());
        enqueue(envelope.intent());
    }

    private void enqueue(Intent intent) {
        pending.addLast(intent);
        if (draining) return;
        draining = true;
        try {
            Intent next;
            while ((next = pending.pollFirst()) != null) {
                try {
                    executor.execute(next);
                } catch (RuntimeException e) {
                    logger.error("[AuthorityRouter] Failed to execute {}", next.kind(), e);
                }
            }
        } finally {
            draining = false;
        }
    }
}

package com.example.aspects.authority;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Single-process channel that delivers every envelope to every subscriber,
 * including the sender, in emission order.
 */
public class LocalMessageChannel implements MessageChannel {

    private static final Logger logger = LoggerFactory.getLogger(LocalMessageChannel.class);

    private final List<Consumer<Envelope>> handlers = new CopyOnWriteArrayList<>();

    @Override
    public void emit(Envelope envelope) {
        logger.debug("[LocalMessageChannel] {} -> {}", envelope.senderId(), envelope.intent().kind());
        for (Consumer<Envelope> h : handlers) {
            try {
                h.accept(envelope);
            } catch (RuntimeException e) {
                logger.error("[LocalMessageChannel] Handler failed for {}", envelope.intent().kind(), e);
            }
        }
    }

    @Override
    public void on(Consumer<Envelope> handler) {
        handlers.add(handler);
    }
}

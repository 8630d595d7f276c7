package com.example.aspects.authority;

import java.util.function.Consumer;

/**
 * Broadcast channel between participants. Delivery is asynchronous from the
 * sender's point of view; the sender never waits for a reply.
 */
public interface MessageChannel {

    void emit(Envelope envelope);

    void on(Consumer<Envelope> handler);
}

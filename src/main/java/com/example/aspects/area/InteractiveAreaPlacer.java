package com.example.aspects.area;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Opens a {@link PlacementSession} per request and hands it to the
 * presentation layer, which feeds it pointer and key events.
 */
public class InteractiveAreaPlacer implements AreaPlacer {

    private final Consumer<PlacementSession> sessionOpened;
    private PlacementSession active;

    public InteractiveAreaPlacer(Consumer<PlacementSession> sessionOpened) {
        this.sessionOpened = sessionOpened;
    }

    @Override
    public CompletableFuture<PlacementResult> place(PlacementRequest request) {
        if (active != null) active.cancel();
        PlacementSession session = new PlacementSession(request);
        active = session;
        sessionOpened.accept(session);
        return session.result();
    }

    /** The session awaiting input, or null. */
    public PlacementSession getActive() {
        return active != null && active.isOpen() ? active : null;
    }
}

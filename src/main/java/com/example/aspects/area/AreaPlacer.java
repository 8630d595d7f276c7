package com.example.aspects.area;

import java.util.concurrent.CompletableFuture;

/**
 * Interactive placement of an area template. The returned future completes
 * when the user confirms or cancels; there is no timeout.
 */
@FunctionalInterface
public interface AreaPlacer {

    CompletableFuture<PlacementResult> place(PlacementRequest request);
}

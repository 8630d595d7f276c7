package com.example.aspects.area;

import java.util.Optional;

/** How an interactive placement ended. */
public record PlacementResult(Status status, AreaTemplate template) {

    public enum Status { CONFIRMED, CANCELLED, OUT_OF_RANGE }

    public static PlacementResult confirmed(AreaTemplate template) {
        return new PlacementResult(Status.CONFIRMED, template);
    }

    public static PlacementResult cancelled() {
        return new PlacementResult(Status.CANCELLED, null);
    }

    public static PlacementResult outOfRange(AreaTemplate attempted) {
        return new PlacementResult(Status.OUT_OF_RANGE, attempted);
    }

    public Optional<AreaTemplate> confirmedTemplate() {
        return status == Status.CONFIRMED ? Optional.of(template) : Optional.empty();
    }
}

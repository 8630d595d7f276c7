package com.example.aspects.area;

import com.example.aspects.model.Point;

/**
 * A placed area: an AreaSpec fixed at an origin and direction.
 * For circles and rects the origin is the placement point; for cones and rays
 * it is the caster's position.
 */
public record AreaTemplate(
    String id,
    String casterId,
    AreaSpec spec,
    Point origin,
    double direction,
    int createdRound
) {

    public AreaShape shape() { return spec.shape(); }

    public boolean isTimed() { return spec.durationRounds() > 0; }

    public boolean isExpired(int currentRound) {
        return isTimed() && currentRound - createdRound >= spec.durationRounds();
    }

    public AreaTemplate moveTo(Point newOrigin) {
        return new AreaTemplate(id, casterId, spec, newOrigin, direction, createdRound);
    }

    public AreaTemplate aim(double newDirection) {
        return new AreaTemplate(id, casterId, spec, origin, newDirection, createdRound);
    }
}

package com.example.aspects.area;

import com.example.aspects.model.Point;

/**
 * What the placement UI needs to start an interactive placement.
 */
public record PlacementRequest(String templateId, String casterId, String participantId,
                               Point casterPosition, AreaSpec spec, int castingRange, int round) {
}

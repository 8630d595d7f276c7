package com.example.aspects.area;

import com.example.aspects.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * One pointer-driven placement. Pointer moves update the live preview;
 * {@link #confirm()} finalizes it and {@link #cancel()} (secondary click or
 * escape) aborts it. Circles and rects follow the pointer; cones and rays stay
 * on the caster and only turn toward it.
 */
public class PlacementSession {

    private static final Logger logger = LoggerFactory.getLogger(PlacementSession.class);

    private final PlacementRequest request;
    private final CompletableFuture<PlacementResult> result = new CompletableFuture<>();
    private AreaTemplate preview;

    public PlacementSession(PlacementRequest request) {
        this.request = request;
        this.preview = new AreaTemplate(request.templateId(), request.casterId(), request.spec(),
            request.casterPosition(), 0.0, request.round());
    }

    public PlacementRequest getRequest() { return request; }

    public AreaTemplate getPreview() { return preview; }

    public CompletableFuture<PlacementResult> result() { return result; }

    public boolean isOpen() { return !result.isDone(); }

    public void pointerMoved(Point pointer) {
        if (!isOpen() || pointer == null) return;
        if (request.spec().shape().isDirected()) {
            if (!pointer.equals(request.casterPosition())) {
                preview = preview.aim(request.casterPosition().bearingTo(pointer));
            }
        } else {
            preview = preview.moveTo(pointer);
        }
    }

    /**
     * Finalizes the preview. Placed shapes must be within casting range of
     * the caster; an out-of-range confirmation ends the session without a template.
     */
    public void confirm() {
        if (!isOpen()) return;
        if (!request.spec().shape().isDirected()) {
            double distance = request.casterPosition().distanceTo(preview.origin());
            if (distance > request.castingRange() + AreaGeometry.EPSILON) {
                logger.debug("[PlacementSession] {} placed {} ft away, range {}", preview.id(), distance, request.castingRange());
                result.complete(PlacementResult.outOfRange(preview));
                return;
            }
        }
        result.complete(PlacementResult.confirmed(preview));
    }

    public void cancel() {
        if (!isOpen()) return;
        logger.debug("[PlacementSession] {} cancelled", preview.id());
        result.complete(PlacementResult.cancelled());
    }
}

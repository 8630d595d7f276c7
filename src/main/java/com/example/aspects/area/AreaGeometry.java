package com.example.aspects.area;

import com.example.aspects.model.Point;

/**
 * Containment tests for placed templates. Boundaries are inclusive: a point
 * exactly on the edge is inside. A small tolerance absorbs floating-point
 * error from the trigonometry.
 */
public final class AreaGeometry {

    static final double EPSILON = 1e-9;

    private AreaGeometry() {}

    public static boolean contains(AreaTemplate template, Point p) {
        AreaSpec spec = template.spec();
        switch (spec.shape()) {
            case CIRCLE:
                return inCircle(template.origin(), spec.size() / 2.0, p);
            case CONE:
                return inCone(template.origin(), template.direction(), spec.size(), spec.angle(), p);
            case RAY:
                return inRay(template.origin(), template.direction(), spec.size(), spec.width(), p);
            case RECT:
                return inRect(template.origin(), spec.size(), p);
            default:
                return false;
        }
    }

    static boolean inCircle(Point center, double radius, Point p) {
        return center.distanceTo(p) <= radius + EPSILON;
    }

    static boolean inCone(Point apex, double direction, double length, double angle, Point p) {
        double distance = apex.distanceTo(p);
        if (distance > length + EPSILON) return false;
        if (distance <= EPSILON) return true;
        double offset = Math.abs(normalize(apex.bearingTo(p) - direction));
        return offset <= angle / 2.0 + EPSILON;
    }

    static boolean inRay(Point start, double direction, double length, double width, Point p) {
        double rad = Math.toRadians(direction);
        double dx = p.x() - start.x();
        double dy = p.y() - start.y();
        double along = dx * Math.cos(rad) + dy * Math.sin(rad);
        double across = -dx * Math.sin(rad) + dy * Math.cos(rad);
        return along >= -EPSILON && along <= length + EPSILON && Math.abs(across) <= width / 2.0 + EPSILON;
    }

    /**
     * The rect is a square laid out from its diagonal at a fixed 45 degrees,
     * which keeps it grid-aligned: side = diagonal / sqrt(2), centered on the
     * placement point.
     */
    static boolean inRect(Point center, double diagonal, Point p) {
        double half = rectSide(diagonal) / 2.0;
        return Math.abs(p.x() - center.x()) <= half + EPSILON && Math.abs(p.y() - center.y()) <= half + EPSILON;
    }

    public static double rectSide(double diagonal) {
        return diagonal / Math.sqrt(2.0);
    }

    /** Wraps an angle into [-180, 180). */
    static double normalize(double degrees) {
        double d = (degrees + 180.0) % 360.0;
        if (d < 0) d += 360.0;
        return d - 180.0;
    }
}

package com.example.aspects.model;

/** A scene position in feet. */
public record Point(double x, double y) {

    public double distanceTo(Point other) {
        return Math.hypot(other.x - x, other.y - y);
    }

    /** Bearing from this point to the other, in degrees, 0 along +x, counter-clockwise. */
    public double bearingTo(Point other) {
        return Math.toDegrees(Math.atan2(other.y - y, other.x - x));
    }
}

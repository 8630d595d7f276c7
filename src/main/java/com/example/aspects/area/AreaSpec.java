package com.example.aspects.area;

/**
 * Area-of-effect descriptor on a skill.
 *
 * @param shape          template shape
 * @param size           circle diameter, cone/ray length, or rect diagonal, in feet
 * @param width          ray width in feet
 * @param angle          cone opening angle in degrees
 * @param mode           allegiance filter
 * @param durationRounds 0 for instantaneous templates
 */
public record AreaSpec(AreaShape shape, double size, double width, double angle, TargetingMode mode, int durationRounds) {

    public static final double DEFAULT_RAY_WIDTH = 5.0;
    public static final double DEFAULT_CONE_ANGLE = 53.13;

    public AreaSpec {
        if (shape == null) shape = AreaShape.CIRCLE;
        if (mode == null) mode = TargetingMode.ALL;
        if (width <= 0) width = DEFAULT_RAY_WIDTH;
        if (angle <= 0) angle = DEFAULT_CONE_ANGLE;
        size = Math.max(0, size);
        durationRounds = Math.max(0, durationRounds);
    }

    public static AreaSpec circle(double diameter, TargetingMode mode) {
        return new AreaSpec(AreaShape.CIRCLE, diameter, 0, 0, mode, 0);
    }

    public static AreaSpec cone(double length, double angle, TargetingMode mode) {
        return new AreaSpec(AreaShape.CONE, length, 0, angle, mode, 0);
    }

    public static AreaSpec ray(double length, double width, TargetingMode mode) {
        return new AreaSpec(AreaShape.RAY, length, width, 0, mode, 0);
    }

    public static AreaSpec rect(double diagonal, TargetingMode mode) {
        return new AreaSpec(AreaShape.RECT, diagonal, 0, 0, mode, 0);
    }

    public AreaSpec withDuration(int rounds) {
        return new AreaSpec(shape, size, width, angle, mode, rounds);
    }
}

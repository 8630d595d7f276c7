package com.example.aspects.model;

/**
 * One change carried by an effect: apply {@code value} to {@code stat} using {@code op}.
 */
public record Modifier(Stat stat, Op op, double value) {

    public Modifier {
        if (op == null) op = Op.ADD;
    }

    public static Modifier add(Stat stat, double value) {
        return new Modifier(stat, Op.ADD, value);
    }

    public static Modifier multiply(Stat stat, double value) {
        return new Modifier(stat, Op.MULTIPLY, value);
    }

    public Modifier withValue(double newValue) {
        return new Modifier(stat, op, newValue);
    }

    /** Two changes merge when they target the same stat with the same operation. */
    public boolean sameKey(Modifier other) {
        return other != null && stat == other.stat && op == other.op;
    }

    public enum Op {
        ADD, MULTIPLY, OVERRIDE;

        public static Op fromKey(String key) {
            if (key == null) return ADD;
            switch (key.trim().toLowerCase()) {
                case "multiply": case "mult": case "1": return MULTIPLY;
                case "override": case "5": return OVERRIDE;
                default: return ADD;
            }
        }
    }
}

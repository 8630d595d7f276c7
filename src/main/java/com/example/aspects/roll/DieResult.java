package com.example.aspects.roll;

/** One die term of a roll, e.g. {@code 4d6 -> [3, 5, 1, 6]}. */
public record DieResult(int count, int sides, int[] faces, int total) {

    @Override
    public String toString() {
        return count + "d" + sides + "=" + total;
    }
}

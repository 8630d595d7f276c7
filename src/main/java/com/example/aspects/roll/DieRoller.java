package com.example.aspects.roll;

import java.util.concurrent.ThreadLocalRandom;

/** Source of single die results, 1..sides inclusive. */
@FunctionalInterface
public interface DieRoller {

    int roll(int sides);

    static DieRoller random() {
        return sides -> ThreadLocalRandom.current().nextInt(1, sides + 1);
    }
}

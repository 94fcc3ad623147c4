package model;

import java.util.Random;

/** Uniform source in [0, 1). Every random draw in the engine goes through one of these. */
@FunctionalInterface
public interface Dice {
    double next();

    static Dice seeded(long seed) {
        Random rng = new Random(seed);
        return rng::nextDouble;
    }
}

package com.hedgewise.backend.util;

import java.util.ArrayList;
import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Seedable factory for random generators. With a fixed seed every call to {@link #newGenerator()}
 * starts from the same state, so repeated simulations are reproducible.
 */
public class RandomSource {

    private final Long seed;
    private final AtomicLong sequence = new AtomicLong(System.nanoTime());

    public RandomSource(Long seed) {
        this.seed = seed;
    }

    public static RandomSource seeded(long seed) {
        return new RandomSource(seed);
    }

    public static RandomSource unseeded() {
        return new RandomSource(null);
    }

    public boolean isSeeded() {
        return seed != null;
    }

    public SplittableRandom newGenerator() {
        if (seed != null) {
            return new SplittableRandom(seed);
        }
        return new SplittableRandom(sequence.incrementAndGet() ^ System.nanoTime());
    }

    /**
     * Splits {@code count} independent generators off a fresh root, in order, before any work is dispatched.
     */
    public List<SplittableRandom> split(int count) {
        SplittableRandom root = newGenerator();
        List<SplittableRandom> generators = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            generators.add(root.split());
        }
        return generators;
    }
}

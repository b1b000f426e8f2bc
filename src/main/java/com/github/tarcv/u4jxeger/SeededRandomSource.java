package com.github.tarcv.u4jxeger;

import java.util.Random;

/**
 * {@link RandomSource} backed by {@link Random}.  Two sources created with the same seed
 * produce the same sequence of draws.
 */
public final class SeededRandomSource implements RandomSource {
    private final Random random;
    private final long seed;

    /**
     * Creates a source seeded from {@link System#nanoTime()}.
     */
    public SeededRandomSource() {
        this(System.nanoTime());
    }

    public SeededRandomSource(final long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public int nextInt(final int bound) {
        return random.nextInt(bound);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public String toString() {
        return "SeededRandomSource{seed=" + seed + "}";
    }
}

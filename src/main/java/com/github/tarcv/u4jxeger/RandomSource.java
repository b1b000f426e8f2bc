package com.github.tarcv.u4jxeger;

/**
 * Source of the random decisions made while generating strings.
 * Every sampling decision takes exactly one {@link #nextInt(int)} draw, which lets tests script
 * the outcome of a generation call draw by draw.
 * <p>
 * Implementations are not expected to be thread-safe.
 */
public interface RandomSource {
    /**
     * @param bound the upper bound (exclusive), must be positive
     * @return a uniformly distributed value in {@code [0, bound)}
     */
    int nextInt(int bound);
}

package com.github.tarcv.u4jxeger;

import com.ibm.icu.lang.UCharacter;

/**
 * Picks one code point uniformly from a character class given as flat inclusive (lo, hi) pairs.
 */
final class RangeSampler {
    /** Produced when a class has no usable code point. */
    static final int FALLBACK_CODE_POINT = ' ';

    private static final int SURROGATE_MIN = 0xd800;
    private static final int SURROGATE_MAX = 0xdfff;

    private RangeSampler() {
    }

    static int sample(final int[] ranges, final boolean negated,
                      final RandomSource random, final NegatedClassPolicy policy) {
        return sample(ranges, 0, ranges.length, negated, random, policy);
    }

    /**
     * A negated class never yields a surrogate code point.  Under {@link NegatedClassPolicy#APPROXIMATE_SUBSET}
     * a negated class that spans U+0000 to U+10FFFF also loses its first and last range.
     *
     * @param ranges  array holding the pairs from index {@code from}; an odd trailing element is ignored
     *                and pairs with hi &lt; lo are skipped
     * @param length  number of array elements taken from {@code from}
     * @param negated whether the class was written as a complement
     */
    static int sample(final int[] ranges, final int from, final int length, final boolean negated,
                      final RandomSource random, final NegatedClassPolicy policy) {
        int start = from;
        int end = from + (length & ~1);
        boolean spansAll = end - start >= 2
                && ranges[start] == 0
                && ranges[end - 1] == UCharacter.MAX_VALUE;
        if (negated && spansAll && policy == NegatedClassPolicy.APPROXIMATE_SUBSET) {
            start += 2;
            end -= 2;
        }
        boolean skipSurrogates = negated;

        long total = 0;
        for (int i = start; i + 1 < end; i += 2) {
            total += size(ranges[i], ranges[i + 1], skipSurrogates);
        }
        if (total <= 0) {
            return FALLBACK_CODE_POINT;
        }

        long k = random.nextInt((int) Math.min(total, Integer.MAX_VALUE));
        for (int i = start; i + 1 < end; i += 2) {
            int lo = ranges[i];
            int hi = ranges[i + 1];
            long n = size(lo, hi, skipSurrogates);
            if (k >= n) {
                k -= n;
                continue;
            }
            int cp = (int) (lo + k);
            if (skipSurrogates && lo <= SURROGATE_MAX && cp >= SURROGATE_MIN) {
                cp += SURROGATE_MAX - Math.max(lo, SURROGATE_MIN) + 1;
            }
            return cp;
        }
        return FALLBACK_CODE_POINT;
    }

    private static long size(final int lo, final int hi, final boolean skipSurrogates) {
        if (hi < lo) {
            return 0;
        }
        long n = (long) hi - lo + 1;
        if (skipSurrogates) {
            int overlapLo = Math.max(lo, SURROGATE_MIN);
            int overlapHi = Math.min(hi, SURROGATE_MAX);
            if (overlapLo <= overlapHi) {
                n -= overlapHi - overlapLo + 1;
            }
        }
        return n;
    }
}

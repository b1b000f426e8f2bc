package com.github.tarcv.u4jxeger;

final class RepetitionSampler {
    private RepetitionSampler() {
    }

    /**
     * Picks a repeat count in [min, max].  With {@code shortBias} every extra repetition takes
     * a coin flip, so counts halve in probability as they grow; otherwise the count is uniform.
     * An exact count is returned without drawing from {@code random}.
     *
     * @param max must be &gt;= min
     */
    static int sample(final int min, final int max, final boolean shortBias, final RandomSource random) {
        if (min == max) {
            return min;
        }
        if (shortBias) {
            int n = min;
            while (n < max) {
                if (random.nextInt(2) == 0) {
                    break;
                }
                n++;
            }
            return n;
        }
        long span = (long) max - min + 1;
        return (int) (min + random.nextInt((int) Math.min(span, Integer.MAX_VALUE)));
    }
}

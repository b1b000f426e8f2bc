package com.github.tarcv.u4jxeger;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable generation and parsing options of a {@link Xeger}.
 * <p>
 * Zero means "use the default" for {@code maxRepeat} and {@code maxDepth}, and "unlimited"
 * for {@code maxLength}.
 */
public final class XegerOptions {
    /** Repeat count used for *, + and {n,} when maxRepeat is 0. */
    public static final int DEFAULT_MAX_REPEAT = 10;
    /** Output length of {@link #defaults()}. */
    public static final int DEFAULT_MAX_LENGTH = 64;
    /** Dispatcher nesting depth used when maxDepth is 0. */
    public static final int DEFAULT_MAX_DEPTH = 4096;

    private static final XegerOptions DEFAULTS = builder().build();

    private final int maxLength;
    private final int maxRepeat;
    private final boolean shortBias;
    private final NegatedClassPolicy negatedClassPolicy;
    private final int maxDepth;
    private final Set<URegexpFlag> flags;

    private XegerOptions(final Builder builder) {
        this.maxLength = builder.maxLength;
        this.maxRepeat = builder.maxRepeat;
        this.shortBias = builder.shortBias;
        this.negatedClassPolicy = builder.negatedClassPolicy;
        this.maxDepth = builder.maxDepth;
        this.flags = Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
    }

    /**
     * Output capped at {@value #DEFAULT_MAX_LENGTH} code points, repeats capped at
     * {@value #DEFAULT_MAX_REPEAT}, short bias on, approximate negated classes, no flags.
     */
    public static XegerOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxLength(maxLength)
                .maxRepeat(maxRepeat)
                .shortBias(shortBias)
                .negatedClassPolicy(negatedClassPolicy)
                .maxDepth(maxDepth)
                .flags(flags);
    }

    /**
     * @return the output cap in code points, 0 when unlimited
     */
    public int maxLength() {
        return maxLength;
    }

    public int maxRepeat() {
        return maxRepeat;
    }

    /**
     * @return the repeat cap applied to *, + and unbounded {n,}
     */
    public int effectiveMaxRepeat() {
        return maxRepeat > 0 ? maxRepeat : DEFAULT_MAX_REPEAT;
    }

    public boolean shortBias() {
        return shortBias;
    }

    public NegatedClassPolicy negatedClassPolicy() {
        return negatedClassPolicy;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public int effectiveMaxDepth() {
        return maxDepth > 0 ? maxDepth : DEFAULT_MAX_DEPTH;
    }

    public Set<URegexpFlag> flags() {
        return flags;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof XegerOptions)) {
            return false;
        }
        XegerOptions that = (XegerOptions) o;
        return maxLength == that.maxLength
                && maxRepeat == that.maxRepeat
                && shortBias == that.shortBias
                && maxDepth == that.maxDepth
                && negatedClassPolicy == that.negatedClassPolicy
                && flags.equals(that.flags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxLength, maxRepeat, shortBias, negatedClassPolicy, maxDepth, flags);
    }

    @Override
    public String toString() {
        return "XegerOptions{" +
                "maxLength=" + maxLength +
                ", maxRepeat=" + maxRepeat +
                ", shortBias=" + shortBias +
                ", negatedClassPolicy=" + negatedClassPolicy +
                ", maxDepth=" + maxDepth +
                ", flags=" + flags +
                '}';
    }

    public static final class Builder {
        private int maxLength = DEFAULT_MAX_LENGTH;
        private int maxRepeat = 0;
        private boolean shortBias = true;
        private NegatedClassPolicy negatedClassPolicy = NegatedClassPolicy.APPROXIMATE_SUBSET;
        private int maxDepth = 0;
        private final EnumSet<URegexpFlag> flags = EnumSet.noneOf(URegexpFlag.class);

        private Builder() {
        }

        /**
         * @param maxLength output cap in code points, 0 for unlimited
         */
        public Builder maxLength(final int maxLength) {
            this.maxLength = nonNegative(maxLength, "maxLength");
            return this;
        }

        /**
         * @param maxRepeat repeat cap for *, + and {n,}, 0 for {@value #DEFAULT_MAX_REPEAT}
         */
        public Builder maxRepeat(final int maxRepeat) {
            this.maxRepeat = nonNegative(maxRepeat, "maxRepeat");
            return this;
        }

        public Builder shortBias(final boolean shortBias) {
            this.shortBias = shortBias;
            return this;
        }

        public Builder negatedClassPolicy(final NegatedClassPolicy policy) {
            this.negatedClassPolicy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        /**
         * @param maxDepth nesting depth past which nodes generate nothing, 0 for {@value #DEFAULT_MAX_DEPTH}
         */
        public Builder maxDepth(final int maxDepth) {
            this.maxDepth = nonNegative(maxDepth, "maxDepth");
            return this;
        }

        public Builder flags(final Collection<URegexpFlag> flags) {
            this.flags.clear();
            this.flags.addAll(flags);
            return this;
        }

        public Builder flag(final URegexpFlag flag) {
            this.flags.add(Objects.requireNonNull(flag, "flag"));
            return this;
        }

        public XegerOptions build() {
            return new XegerOptions(this);
        }

        private static int nonNegative(final int value, final String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must not be negative: " + value);
            }
            return value;
        }
    }
}

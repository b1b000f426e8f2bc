package com.github.tarcv.u4jxeger;

/**
 * How a character class that was negated in the pattern is sampled.
 * A class counts as negated when it is written as a complement: [^...], \P, \p{^...}, \D, \S, \W
 * or [:^name:], alone or inside a bracket expression.  Under either policy a negated class never
 * produces a code point from the surrogate block U+D800..U+DFFF.
 */
public enum NegatedClassPolicy {
    /**
     * When the class spans U+0000 to U+10FFFF, drop its first and last range and sample from the ones
     * in between.  Otherwise sample the class as stored.
     * Every result is outside the negated set, but most of the complement is never produced.
     * A class with nothing left in between produces a space.
     */
    APPROXIMATE_SUBSET,

    /**
     * Sample uniformly from the whole complement, minus the surrogate block U+D800..U+DFFF.
     */
    EXACT_COMPLEMENT
}

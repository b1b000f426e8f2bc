// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
package com.github.tarcv.u4jxeger;

import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Class `Xeger` generates random strings matching a regular expression.  It includes
 * factory methods for creating a Xeger object from the source (string) form
 * of a regular expression and a convenience method for one-off generation.
 * <p>
 * Every string returned by {@link #next()} matches the pattern, except when
 * <ul>
 *     <li>the {@link XegerOptions#maxLength() length cap} cut the string short, or</li>
 *     <li>a negated character class has nothing left to sample from under
 *         {@link NegatedClassPolicy#APPROXIMATE_SUBSET} and produced a space, or</li>
 *     <li>the pattern relies on anchors or word boundaries in a position where the
 *         generated neighbours do not satisfy them; these generate no text and
 *         their conditions are not enforced.</li>
 * </ul>
 * <p>
 * A Xeger is not safe for concurrent use, as every call advances its random source.
 * Threads should each use their own instance, obtained with {@link #withSeed(long)}
 * or {@link #withRandom(RandomSource)}; these share the parsed tree, which is immutable.
 */
public final class Xeger {
    private static final Logger LOGGER = Logger.getLogger(Xeger.class.getName());

    /**
     * The original pattern string.
     */
    private final String fPattern;
    /**
     * Options the pattern was compiled with, also used for every generation call.
     */
    private final XegerOptions fOptions;
    /**
     * The simplified syntax tree.
     */
    private final SyntaxTree fTree;
    private final RandomSource fRandom;

    private Xeger(final String pattern, final XegerOptions options, final SyntaxTree tree, final RandomSource random) {
        this.fPattern = pattern;
        this.fOptions = options;
        this.fTree = tree;
        this.fRandom = random;
    }

    /**
     * Compiles the regular expression in string form into a Xeger object.
     *
     * @param regex   The regular expression to be compiled.
     * @param options Generation options, including the {@link URegexpFlag} parse modes.
     * @param random  Source of every random decision made by {@link #next()}.
     * @return        A Xeger object for the compiled pattern.
     * @throws RegexParseException if the pattern is not valid
     */
    public static Xeger compile(final String regex, final XegerOptions options, final RandomSource random) {
        Objects.requireNonNull(options, "options");
        Objects.requireNonNull(random, "random");
        RegexNode parsed = RegexParser.parse(regex, options.flags());
        SyntaxTree tree = SyntaxTree.of(RegexSimplifier.simplify(parsed));
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("regex: %s simplified: %s%n%s", regex, tree, tree.dump()));
        }
        return new Xeger(regex, options, tree, random);
    }

    /**
     * Compiles the regular expression with a random source seeded from {@code seed}.
     * Two objects compiled from the same pattern, options and seed generate the same strings.
     */
    public static Xeger compile(final String regex, final XegerOptions options, final long seed) {
        return compile(regex, options, new SeededRandomSource(seed));
    }

    /**
     * Compiles the regular expression with a random source seeded from the current time.
     */
    public static Xeger compile(final String regex, final XegerOptions options) {
        return compile(regex, options, new SeededRandomSource());
    }

    /**
     * Compiles the regular expression with {@link XegerOptions#defaults()}.
     */
    public static Xeger compile(final String regex) {
        return compile(regex, XegerOptions.defaults());
    }

    /**
     * Generate one string matching a regular expression.  This convenience function
     * both compiles the regular expression and generates in a single operation.
     * Note that if the same pattern is needed repeatedly, this method will be
     * less efficient than creating and reusing a Xeger object.
     *
     * @param regex The regular expression
     * @return A string generated with {@link XegerOptions#defaults()}
     * @throws RegexParseException if the pattern is not valid
     */
    public static String generate(final String regex) {
        return compile(regex).next();
    }

    /**
     * Generates the next random string.  Never fails: everything that can go wrong
     * with a pattern is reported by {@link #compile}.
     */
    public String next() {
        MutableVector32 codePoints = new NodeDispatcher(fTree, fOptions, fRandom).generate(fTree.root());
        if (fOptions.maxLength() > 0) {
            codePoints.truncate(fOptions.maxLength());
        }
        String result = codePoints.toCodePointString();
        LOGGER.finest(() -> String.format("generated \"%s\" for %s", result, fPattern));
        return result;
    }

    /**
     * @return a generator for the same tree and options drawing from {@code random}
     */
    public Xeger withRandom(final RandomSource random) {
        return new Xeger(fPattern, fOptions, fTree, Objects.requireNonNull(random, "random"));
    }

    /**
     * @return a generator for the same tree and options with its own random source seeded from {@code seed}
     */
    public Xeger withSeed(final long seed) {
        return withRandom(new SeededRandomSource(seed));
    }

    /**
     * Returns the regular expression from which this object was compiled.
     */
    public String pattern() {
        return fPattern;
    }

    public XegerOptions options() {
        return fOptions;
    }

    public Set<URegexpFlag> flags() {
        return fOptions.flags();
    }

    public SyntaxTree tree() {
        return fTree;
    }

    @Override
    public String toString() {
        return "Xeger{" + fPattern + " => " + fTree + '}';
    }
}

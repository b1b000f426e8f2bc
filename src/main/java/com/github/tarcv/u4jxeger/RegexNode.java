package com.github.tarcv.u4jxeger;

import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable syntax tree node produced by {@link RegexParser} and rewritten by {@link RegexSimplifier}.
 * It never leaves the parsing stage: {@link SyntaxTree#of(RegexNode)} copies the final form into the arena.
 */
final class RegexNode {
    private static final int[] NO_DATA = new int[0];

    SyntaxKind kind;
    final List<RegexNode> children = new ArrayList<>(2);
    /** Code points of a LITERAL, flat (lo, hi) pairs of a CHAR_CLASS. */
    int[] data = NO_DATA;
    int min;
    int max;
    int captureIndex;
    String captureName;
    /** A CHAR_CLASS written as a complement: [^..], \P, \D, [:^..:] and the like. */
    boolean negated;

    RegexNode(final SyntaxKind kind) {
        this.kind = kind;
    }

    static RegexNode of(final SyntaxKind kind, final RegexNode... children) {
        RegexNode node = new RegexNode(kind);
        for (RegexNode child : children) {
            node.children.add(child);
        }
        return node;
    }

    static RegexNode literal(final int... codePoints) {
        RegexNode node = new RegexNode(SyntaxKind.LITERAL);
        node.data = codePoints.clone();
        return node;
    }

    static RegexNode charClass(final UnicodeSet set) {
        return charClass(set, false);
    }

    static RegexNode charClass(final UnicodeSet set, final boolean negated) {
        RegexNode node = new RegexNode(SyntaxKind.CHAR_CLASS);
        node.data = toRanges(set);
        node.negated = negated;
        return node;
    }

    static RegexNode repeat(final RegexNode child, final int min, final int max) {
        RegexNode node = of(SyntaxKind.REPEAT, child);
        node.min = min;
        node.max = max;
        return node;
    }

    static RegexNode capture(final int index, final String name, final RegexNode child) {
        RegexNode node = of(SyntaxKind.CAPTURE, child);
        node.captureIndex = index;
        node.captureName = name;
        return node;
    }

    static int[] toRanges(final UnicodeSet set) {
        int rangeCount = set.getRangeCount();
        int[] ranges = new int[rangeCount * 2];
        for (int i = 0; i < rangeCount; i++) {
            ranges[2 * i] = set.getRangeStart(i);
            ranges[2 * i + 1] = set.getRangeEnd(i);
        }
        return ranges;
    }

    boolean isSingleCodePoint() {
        return kind == SyntaxKind.LITERAL && data.length == 1;
    }

    RegexNode child() {
        return children.isEmpty() ? null : children.get(0);
    }

    @Override
    public String toString() {
        return SyntaxTree.of(this).toString();
    }
}

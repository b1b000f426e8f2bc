package com.github.tarcv.u4jxeger;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a parse tree into an equivalent canonical form.  Every rewrite keeps the set of
 * matched strings unchanged.
 */
final class RegexSimplifier {
    private RegexSimplifier() {
    }

    static RegexNode simplify(final RegexNode node) {
        if (node.kind == SyntaxKind.ALTERNATE) {
            List<RegexNode> branches = new ArrayList<>(node.children.size());
            collectBranches(node, branches);
            node.children.clear();
            node.children.addAll(branches);
        }
        for (int i = 0; i < node.children.size(); i++) {
            node.children.set(i, simplify(node.children.get(i)));
        }
        switch (node.kind) {
            case CHAR_CLASS:
                return simplifyClass(node);
            case CONCAT:
                return simplifyConcat(node);
            case ALTERNATE:
                return simplifyAlternate(node);
            case STAR:
            case PLUS:
            case QUEST:
                return simplifyUnary(node);
            case REPEAT:
                return simplifyRepeat(node);
            default:
                return node;
        }
    }

    /**
     * Nested alternations are unwrapped before their branches are simplified, so a group whose
     * branches later merge into a class still counts once per branch.
     */
    private static void collectBranches(final RegexNode node, final List<RegexNode> out) {
        for (RegexNode child : node.children) {
            if (child.kind == SyntaxKind.ALTERNATE) {
                collectBranches(child, out);
            } else {
                out.add(child);
            }
        }
    }

    /**
     * Empty class matches nothing, one code point is a literal, and the two classes that
     * '.' stands for are turned back into their dedicated kinds.
     */
    private static RegexNode simplifyClass(final RegexNode node) {
        int[] r = node.data;
        if (r.length == 0) {
            return new RegexNode(SyntaxKind.NO_MATCH);
        }
        if (r.length == 2 && r[0] == r[1]) {
            return RegexNode.literal(r[0]);
        }
        if (r.length == 2 && r[0] == 0 && r[1] == UCharacter.MAX_VALUE) {
            return new RegexNode(SyntaxKind.ANY_CHAR);
        }
        if (r.length == 4 && r[0] == 0 && r[1] == '\n' - 1 && r[2] == '\n' + 1 && r[3] == UCharacter.MAX_VALUE) {
            return new RegexNode(SyntaxKind.ANY_CHAR_NOT_NL);
        }
        return node;
    }

    private static RegexNode simplifyConcat(final RegexNode node) {
        List<RegexNode> flat = new ArrayList<>(node.children.size());
        for (RegexNode child : node.children) {
            if (child.kind == SyntaxKind.CONCAT) {
                flat.addAll(child.children);
            } else if (child.kind != SyntaxKind.EMPTY_MATCH) {
                flat.add(child);
            }
        }
        List<RegexNode> merged = new ArrayList<>(flat.size());
        for (RegexNode child : flat) {
            int last = merged.size() - 1;
            if (child.kind == SyntaxKind.LITERAL && last >= 0 && merged.get(last).kind == SyntaxKind.LITERAL) {
                merged.set(last, joinLiterals(merged.get(last), child));
            } else {
                merged.add(child);
            }
        }
        if (merged.isEmpty()) {
            return new RegexNode(SyntaxKind.EMPTY_MATCH);
        } else if (merged.size() == 1) {
            return merged.get(0);
        }
        node.children.clear();
        node.children.addAll(merged);
        return node;
    }

    private static RegexNode joinLiterals(final RegexNode a, final RegexNode b) {
        int[] joined = new int[a.data.length + b.data.length];
        System.arraycopy(a.data, 0, joined, 0, a.data.length);
        System.arraycopy(b.data, 0, joined, a.data.length, b.data.length);
        return RegexNode.literal(joined);
    }

    /**
     * Branches stay equally likely, so branches are only merged into a class when each one is
     * a distinct single code point.
     */
    private static RegexNode simplifyAlternate(final RegexNode node) {
        List<RegexNode> flat = new ArrayList<>(node.children.size());
        for (RegexNode child : node.children) {
            if (child.kind == SyntaxKind.ALTERNATE) {
                flat.addAll(child.children);
            } else {
                flat.add(child);
            }
        }
        if (flat.size() == 1) {
            return flat.get(0);
        }
        UnicodeSet singles = new UnicodeSet();
        boolean allSingles = true;
        for (RegexNode child : flat) {
            if (!child.isSingleCodePoint() || singles.contains(child.data[0])) {
                allSingles = false;
                break;
            }
            singles.add(child.data[0]);
        }
        if (allSingles) {
            return simplifyClass(RegexNode.charClass(singles));
        }
        node.children.clear();
        node.children.addAll(flat);
        return node;
    }

    /**
     * Doubled operators collapse: (?:x*)* is x*, and any mix of two of * + ? is x*.
     */
    private static RegexNode simplifyUnary(final RegexNode node) {
        RegexNode child = node.child();
        if (child == null) {
            return node;
        }
        if (child.kind == SyntaxKind.EMPTY_MATCH) {
            return child;
        }
        if (child.kind == SyntaxKind.STAR || child.kind == SyntaxKind.PLUS || child.kind == SyntaxKind.QUEST) {
            if (child.kind == node.kind) {
                return child;
            }
            return RegexNode.of(SyntaxKind.STAR, child.child());
        }
        return node;
    }

    private static RegexNode simplifyRepeat(final RegexNode node) {
        RegexNode child = node.child();
        if (child == null || child.kind == SyntaxKind.EMPTY_MATCH) {
            return new RegexNode(SyntaxKind.EMPTY_MATCH);
        }
        int min = node.min;
        int max = node.max;
        if (min == 0 && max == 0) {
            return new RegexNode(SyntaxKind.EMPTY_MATCH);
        }
        if (min == 1 && max == 1) {
            return child;
        }
        if (min == 0 && max == 1) {
            return simplifyUnary(RegexNode.of(SyntaxKind.QUEST, child));
        }
        if (min == 0 && max == SyntaxTree.UNBOUNDED) {
            return simplifyUnary(RegexNode.of(SyntaxKind.STAR, child));
        }
        if (min == 1 && max == SyntaxTree.UNBOUNDED) {
            return simplifyUnary(RegexNode.of(SyntaxKind.PLUS, child));
        }
        return node;
    }
}

package com.github.tarcv.u4jxeger;

/**
 * State of one generation call: walks a {@link SyntaxTree} from a node and appends
 * code points for it to a fresh buffer.
 * <p>
 * The length budget is checked before each node is entered, so the buffer can exceed it by the
 * tail of the last literal; {@link Xeger#next()} truncates the final result.
 */
final class NodeDispatcher {
    private static final int NEWLINE_ODDS = 10;
    private static final int PRINTABLE_MIN = 0x20;
    private static final int PRINTABLE_MAX = 0x7e;

    private final SyntaxTree tree;
    private final RandomSource random;
    private final int maxLength;
    private final int maxRepeat;
    private final boolean shortBias;
    private final NegatedClassPolicy negatedClassPolicy;
    private final int maxDepth;
    private final MutableVector32 buffer = new MutableVector32();
    private int depth;

    NodeDispatcher(final SyntaxTree tree, final XegerOptions options, final RandomSource random) {
        this.tree = tree;
        this.random = random;
        this.maxLength = options.maxLength();
        this.maxRepeat = options.effectiveMaxRepeat();
        this.shortBias = options.shortBias();
        this.negatedClassPolicy = options.negatedClassPolicy();
        this.maxDepth = options.effectiveMaxDepth();
    }

    /**
     * @return code points generated for the node, appended to everything generated before
     */
    MutableVector32 generate(final int node) {
        if (budgetReached() || depth >= maxDepth) {
            return buffer;
        }
        depth++;
        try {
            dispatch(node);
        } finally {
            depth--;
        }
        return buffer;
    }

    private boolean budgetReached() {
        return maxLength > 0 && buffer.size() >= maxLength;
    }

    private void dispatch(final int node) {
        SyntaxKind kind = tree.kind(node);
        if (kind == null || kind.isZeroWidth()) {
            return;     // unknown kinds and assertions produce no text
        }
        switch (kind) {
            case LITERAL:
                buffer.addElements(tree.rawData(), tree.dataStart(node), tree.dataLength(node));
                break;
            case CHAR_CLASS:
                buffer.addElement(RangeSampler.sample(tree.rawData(), tree.dataStart(node), tree.dataLength(node),
                        tree.isNegatedClass(node), random, negatedClassPolicy));
                break;
            case ANY_CHAR_NOT_NL:
                buffer.addElement(printable());
                break;
            case ANY_CHAR:
                if (random.nextInt(NEWLINE_ODDS) == 0) {
                    buffer.addElement('\n');
                } else {
                    buffer.addElement(printable());
                }
                break;
            case CONCAT:
                for (int i = 0; i < tree.childCount(node) && !budgetReached(); i++) {
                    generate(tree.child(node, i));
                }
                break;
            case ALTERNATE:
                int n = tree.childCount(node);
                if (n > 0) {
                    generate(tree.child(node, random.nextInt(n)));
                }
                break;
            case CAPTURE:
                if (tree.childCount(node) > 0) {
                    generate(tree.child(node, 0));
                }
                break;
            case STAR:
                repeat(node, 0, maxRepeat);
                break;
            case PLUS:
                repeat(node, 1, maxRepeat);
                break;
            case QUEST:
                if (tree.childCount(node) > 0 && random.nextInt(2) == 0) {
                    generate(tree.child(node, 0));
                }
                break;
            case REPEAT:
                int max = tree.max(node);
                repeat(node, tree.min(node), max == SyntaxTree.UNBOUNDED ? maxRepeat : max);
                break;
            default:
                break;
        }
    }

    private int printable() {
        return PRINTABLE_MIN + random.nextInt(PRINTABLE_MAX - PRINTABLE_MIN + 1);
    }

    private void repeat(final int node, final int min, final int max) {
        if (tree.childCount(node) == 0) {
            return;
        }
        int count = RepetitionSampler.sample(min, Math.max(min, max), shortBias, random);
        int child = tree.child(node, 0);
        for (int i = 0; i < count && !budgetReached(); i++) {
            generate(child);
        }
    }
}

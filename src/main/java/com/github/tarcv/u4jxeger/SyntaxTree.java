package com.github.tarcv.u4jxeger;

import com.ibm.icu.lang.UCharacter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable syntax tree of a simplified pattern, stored as an arena.
 * <p>
 * Nodes are identified by integer indices.  Children are always stored before their parent,
 * so the root has the highest index and walking the tree can never revisit a node.
 * A tree may be shared by any number of {@link Xeger} instances and threads.
 */
public final class SyntaxTree {
    static final int UNBOUNDED = -1;

    private final int[] kinds;
    private final int[] childStart;
    private final int[] childCount;
    private final int[] dataStart;
    private final int[] dataLength;
    private final int[] mins;
    private final int[] maxs;
    private final String[] captureNames;
    /** Child references of all nodes, each node owning a contiguous slice. */
    private final int[] children;
    /** Literal code points and class range pairs of all nodes, each node owning a contiguous slice. */
    private final int[] data;
    private final int root;

    private SyntaxTree(final Builder builder, final int root) {
        this.kinds = builder.kinds.toArray();
        this.childStart = builder.childStart.toArray();
        this.childCount = builder.childCount.toArray();
        this.dataStart = builder.dataStart.toArray();
        this.dataLength = builder.dataLength.toArray();
        this.mins = builder.mins.toArray();
        this.maxs = builder.maxs.toArray();
        this.captureNames = builder.captureNames.toArray(new String[0]);
        this.children = builder.children.toArray();
        this.data = builder.data.toArray();
        this.root = root;
    }

    /**
     * Copies a parse tree into a new arena.  The walk keeps its own stack, so deeply nested
     * parse trees do not consume call stack here.
     */
    static SyntaxTree of(final RegexNode rootNode) {
        Builder builder = new Builder();
        Map<RegexNode, Integer> assigned = new IdentityHashMap<>();
        Deque<RegexNode> stack = new ArrayDeque<>();
        stack.push(rootNode);
        while (!stack.isEmpty()) {
            RegexNode node = stack.peek();
            boolean ready = true;
            for (int i = node.children.size() - 1; i >= 0; i--) {
                RegexNode child = node.children.get(i);
                if (!assigned.containsKey(child)) {
                    stack.push(child);
                    ready = false;
                }
            }
            if (!ready) {
                continue;
            }
            stack.pop();
            if (assigned.containsKey(node)) {
                continue;
            }
            int[] childIds = new int[node.children.size()];
            for (int i = 0; i < childIds.length; i++) {
                childIds[i] = assigned.get(node.children.get(i));
            }
            int min = node.kind == SyntaxKind.CAPTURE ? node.captureIndex : node.min;
            int max = node.kind == SyntaxKind.CHAR_CLASS ? (node.negated ? 1 : 0) : node.max;
            assigned.put(node, builder.add(node.kind.ordinal(), childIds, node.data, min, max, node.captureName));
        }
        return builder.build(assigned.get(rootNode));
    }

    public int root() {
        return root;
    }

    /**
     * @return the number of nodes in the arena
     */
    public int size() {
        return kinds.length;
    }

    /**
     * @return the kind of the node, or null if the stored kind code is not a known {@link SyntaxKind}
     */
    public SyntaxKind kind(final int node) {
        return SyntaxKind.fromCode(kinds[node]);
    }

    public int childCount(final int node) {
        return childCount[node];
    }

    public int child(final int node, final int i) {
        if (i < 0 || i >= childCount[node]) {
            throw new IndexOutOfBoundsException("Child " + i + " of node " + node);
        }
        return children[childStart[node] + i];
    }

    /**
     * @return a copy of the node's payload: code points of a literal, (lo, hi) pairs of a character class
     */
    public int[] data(final int node) {
        int[] copy = new int[dataLength[node]];
        System.arraycopy(data, dataStart[node], copy, 0, copy.length);
        return copy;
    }

    int[] rawData() {
        //noinspection AssignmentOrReturnOfFieldWithMutableType
        return data; // callers read the node's slice in place; the array is never written after build
    }

    int dataStart(final int node) {
        return dataStart[node];
    }

    int dataLength(final int node) {
        return dataLength[node];
    }

    /**
     * Lower bound of a {@link SyntaxKind#REPEAT} node.
     */
    public int min(final int node) {
        return mins[node];
    }

    /**
     * Upper bound of a {@link SyntaxKind#REPEAT} node, -1 when unbounded.
     */
    public int max(final int node) {
        return maxs[node];
    }

    /**
     * True for a {@link SyntaxKind#CHAR_CLASS} node written as a complement, such as [^a] or \P{L}.
     */
    public boolean isNegatedClass(final int node) {
        return kinds[node] == SyntaxKind.CHAR_CLASS.ordinal() && maxs[node] != 0;
    }

    /**
     * 1-based group number of a {@link SyntaxKind#CAPTURE} node.
     */
    public int captureIndex(final int node) {
        return mins[node];
    }

    public String captureName(final int node) {
        return captureNames[node];
    }

    //--------------------------------------------------------------------------
    //
    //   Dumps.  toString() renders pattern syntax equivalent to the tree,
    //           dump() renders one operator per line for debug logging.
    //
    //--------------------------------------------------------------------------
    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        writeRegex(b, root);
        return b.toString();
    }

    public String dump() {
        StringBuilder b = new StringBuilder();
        dump(b, root, 0);
        return b.toString();
    }

    private void dump(final StringBuilder b, final int node, final int depth) {
        for (int i = 0; i < depth; i++) {
            b.append("  ");
        }
        b.append(SyntaxKind.opName(kinds[node]));
        SyntaxKind kind = kind(node);
        if (kind == SyntaxKind.LITERAL || kind == SyntaxKind.CHAR_CLASS) {
            b.append(' ');
            writeRegex(b, node);
        } else if (kind == SyntaxKind.REPEAT) {
            b.append(" {").append(mins[node]).append(',');
            if (maxs[node] != UNBOUNDED) {
                b.append(maxs[node]);
            }
            b.append('}');
        } else if (kind == SyntaxKind.CAPTURE) {
            b.append(" #").append(mins[node]);
            if (captureNames[node] != null) {
                b.append(" <").append(captureNames[node]).append('>');
            }
        }
        b.append('\n');
        for (int i = 0; i < childCount[node]; i++) {
            dump(b, child(node, i), depth + 1);
        }
    }

    private void writeRegex(final StringBuilder b, final int node) {
        SyntaxKind kind = kind(node);
        if (kind == null) {
            b.append("<invalid op ").append(kinds[node]).append('>');
            return;
        }
        switch (kind) {
            case NO_MATCH:
                b.append("[^\\x00-\\x{10FFFF}]");
                break;
            case EMPTY_MATCH:
                b.append("(?:)");
                break;
            case LITERAL:
                for (int i = 0; i < dataLength[node]; i++) {
                    escape(b, data[dataStart[node] + i], false);
                }
                break;
            case CHAR_CLASS:
                writeClass(b, node);
                break;
            case ANY_CHAR_NOT_NL:
                b.append("(?-s:.)");
                break;
            case ANY_CHAR:
                b.append("(?s:.)");
                break;
            case BEGIN_LINE:
                b.append("(?m:^)");
                break;
            case END_LINE:
                b.append("(?m:$)");
                break;
            case BEGIN_TEXT:
                b.append("\\A");
                break;
            case END_TEXT:
                b.append("\\z");
                break;
            case WORD_BOUNDARY:
                b.append("\\b");
                break;
            case NO_WORD_BOUNDARY:
                b.append("\\B");
                break;
            case CAPTURE:
                if (captureNames[node] != null) {
                    b.append("(?P<").append(captureNames[node]).append('>');
                } else {
                    b.append('(');
                }
                if (childCount[node] > 0 && kind(child(node, 0)) != SyntaxKind.EMPTY_MATCH) {
                    writeRegex(b, child(node, 0));
                }
                b.append(')');
                break;
            case STAR:
            case PLUS:
            case QUEST:
            case REPEAT:
                writeRepetition(b, node, kind);
                break;
            case CONCAT:
                for (int i = 0; i < childCount[node]; i++) {
                    int sub = child(node, i);
                    if (kind(sub) == SyntaxKind.ALTERNATE) {
                        b.append("(?:");
                        writeRegex(b, sub);
                        b.append(')');
                    } else {
                        writeRegex(b, sub);
                    }
                }
                break;
            case ALTERNATE:
                for (int i = 0; i < childCount[node]; i++) {
                    if (i > 0) {
                        b.append('|');
                    }
                    writeRegex(b, child(node, i));
                }
                break;
        }
    }

    private void writeRepetition(final StringBuilder b, final int node, final SyntaxKind kind) {
        if (childCount[node] == 0) {
            b.append("(?:)");
        } else {
            int sub = child(node, 0);
            SyntaxKind subKind = kind(sub);
            boolean group = subKind == null
                    || subKind.isRepetition()
                    || subKind == SyntaxKind.CONCAT
                    || subKind == SyntaxKind.ALTERNATE
                    || (subKind == SyntaxKind.LITERAL && dataLength[sub] > 1);
            if (group) {
                b.append("(?:");
            }
            writeRegex(b, sub);
            if (group) {
                b.append(')');
            }
        }
        switch (kind) {
            case STAR:
                b.append('*');
                break;
            case PLUS:
                b.append('+');
                break;
            case QUEST:
                b.append('?');
                break;
            default:
                b.append('{').append(mins[node]);
                if (maxs[node] != mins[node]) {
                    b.append(',');
                    if (maxs[node] != UNBOUNDED) {
                        b.append(maxs[node]);
                    }
                }
                b.append('}');
        }
    }

    private void writeClass(final StringBuilder b, final int node) {
        int start = dataStart[node];
        int length = dataLength[node] & ~1;
        b.append('[');
        if (length == 0) {
            b.append("^\\x00-\\x{10FFFF}");
        } else if (data[start] == 0 && data[start + length - 1] == UCharacter.MAX_VALUE && length > 2) {
            // Print the gaps of a negated class.
            b.append('^');
            for (int i = start + 1; i < start + length - 1; i += 2) {
                writeRange(b, data[i] + 1, data[i + 1] - 1);
            }
        } else {
            for (int i = start; i < start + length; i += 2) {
                writeRange(b, data[i], data[i + 1]);
            }
        }
        b.append(']');
    }

    private static void writeRange(final StringBuilder b, final int lo, final int hi) {
        escape(b, lo, true);
        if (lo != hi) {
            b.append('-');
            escape(b, hi, true);
        }
    }

    private static void escape(final StringBuilder b, final int cp, final boolean inClass) {
        if (cp < 0x80 && (inClass ? "\\[]^-" : "\\.+*?()|[]{}^$").indexOf(cp) >= 0) {
            b.append('\\').appendCodePoint(cp);
            return;
        }
        switch (cp) {
            case '\t':
                b.append("\\t");
                return;
            case '\n':
                b.append("\\n");
                return;
            case '\f':
                b.append("\\f");
                return;
            case '\r':
                b.append("\\r");
                return;
            default:
                break;
        }
        if (cp >= 0x20 && cp < 0x7f || cp >= 0x80 && UCharacter.isPrintable(cp)) {
            b.appendCodePoint(cp);
        } else if (cp >= 0 && cp < 0x100) {
            b.append(String.format("\\x%02X", cp));
        } else {
            b.append(String.format("\\x{%X}", cp));
        }
    }

    //--------------------------------------------------------------------------
    //
    //   Builder.  Nodes must be added children first.
    //
    //--------------------------------------------------------------------------
    static final class Builder {
        private final MutableVector32 kinds = new MutableVector32();
        private final MutableVector32 childStart = new MutableVector32();
        private final MutableVector32 childCount = new MutableVector32();
        private final MutableVector32 dataStart = new MutableVector32();
        private final MutableVector32 dataLength = new MutableVector32();
        private final MutableVector32 mins = new MutableVector32();
        private final MutableVector32 maxs = new MutableVector32();
        private final List<String> captureNames = new ArrayList<>();
        private final MutableVector32 children = new MutableVector32();
        private final MutableVector32 data = new MutableVector32();

        int add(final SyntaxKind kind, final int... childIds) {
            return add(kind.ordinal(), childIds, new int[0], 0, 0, null);
        }

        /**
         * @param kindCode ordinal of a {@link SyntaxKind}; other values are stored as is and are no-ops
         *                 for generation
         * @param min      repeat lower bound, or group number for a capture
         * @return index of the new node
         */
        int add(final int kindCode, final int[] childIds, final int[] payload,
                final int min, final int max, final String captureName) {
            int id = kinds.size();
            for (int childId : childIds) {
                if (childId < 0 || childId >= id) {
                    throw new IllegalArgumentException("Child " + childId + " is not an earlier node of " + id);
                }
            }
            kinds.addElement(kindCode);
            childStart.addElement(children.size());
            childCount.addElement(childIds.length);
            children.addElements(childIds, 0, childIds.length);
            dataStart.addElement(data.size());
            dataLength.addElement(payload.length);
            data.addElements(payload, 0, payload.length);
            mins.addElement(min);
            maxs.addElement(max);
            captureNames.add(captureName);
            return id;
        }

        SyntaxTree build(final int root) {
            if (root < 0 || root >= kinds.size()) {
                throw new IllegalArgumentException("No node " + root);
            }
            return new SyntaxTree(this, root);
        }
    }
}

package com.github.tarcv.u4jxeger;

import com.ibm.icu.lang.UCharacter;
import com.ibm.icu.text.UnicodeSet;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.github.tarcv.u4jxeger.UErrorCode.*;
import static com.github.tarcv.u4jxeger.URegexpFlag.*;

/**
 * Recursive descent parser from pattern text to a {@link RegexNode} tree.
 * <p>
 * The accepted syntax is the RE2 flavour of Perl regular expressions: no backreferences,
 * no lookaround, possessive quantifiers or atomic groups.
 */
final class RegexParser {
    /** Largest count allowed in {n,m}, also the largest product of nested counts. */
    static final int MAX_REPEAT = 1000;
    /** Deepest allowed group nesting. */
    static final int MAX_NESTING_DEPTH = 1000;

    private static final int EOX = -1;  // end of expression
    private static final int PARSE_CONTEXT_LEN = 16;

    private final String regex;
    private final int[] pattern;        // code points of regex
    private final EnumSet<URegexpFlag> flags;
    private int pos;
    private int nesting;
    private int ncap;
    private final Set<String> capNames = new HashSet<>();

    private RegexParser(final String regex, final Set<URegexpFlag> flags) {
        this.regex = regex;
        this.pattern = regex.codePoints().toArray();
        this.flags = flags.isEmpty() ? EnumSet.noneOf(URegexpFlag.class) : EnumSet.copyOf(flags);
    }

    static RegexNode parse(final String regex, final Set<URegexpFlag> flags) {
        if (regex == null) {
            throw new UErrorException(U_ILLEGAL_ARGUMENT_ERROR, "pattern is null");
        }
        RegexParser parser = new RegexParser(regex, flags);
        if (flags.contains(UREGEX_LITERAL)) {
            return parser.literalPattern();
        }
        RegexNode root = parser.parseAlternation();
        if (parser.peek() == ')') {
            throw parser.error(U_REGEX_MISMATCHED_PAREN, "unexpected )", parser.pos);
        }
        return root;
    }

    private RegexNode literalPattern() {
        List<RegexNode> items = new ArrayList<>(pattern.length);
        for (int cp : pattern) {
            items.add(literal(cp));
        }
        return concat(items);
    }

    //------------------------------------------------------------------------------
    //
    //   Expressions
    //
    //------------------------------------------------------------------------------
    private RegexNode parseAlternation() {
        List<RegexNode> branches = new ArrayList<>(2);
        branches.add(parseConcat());
        while (peek() == '|') {
            pos++;
            branches.add(parseConcat());
        }
        if (branches.size() == 1) {
            return branches.get(0);
        }
        RegexNode alt = new RegexNode(SyntaxKind.ALTERNATE);
        alt.children.addAll(branches);
        return alt;
    }

    private RegexNode parseConcat() {
        List<RegexNode> items = new ArrayList<>();
        while (true) {
            int c = peek();
            if (c == EOX || c == '|' || c == ')') {
                break;
            }
            RegexNode atom = parseAtom();
            if (atom == null) {
                continue;       // flag group such as (?i), produces nothing
            }
            items.add(parseQuantifier(atom));
        }
        return concat(items);
    }

    private static RegexNode concat(final List<RegexNode> items) {
        if (items.isEmpty()) {
            return new RegexNode(SyntaxKind.EMPTY_MATCH);
        } else if (items.size() == 1) {
            return items.get(0);
        }
        RegexNode node = new RegexNode(SyntaxKind.CONCAT);
        node.children.addAll(items);
        return node;
    }

    private RegexNode parseQuantifier(final RegexNode atom) {
        int start = pos;
        RegexNode result;
        switch (peek()) {
            case '*':
                pos++;
                result = RegexNode.of(SyntaxKind.STAR, atom);
                break;
            case '+':
                pos++;
                result = RegexNode.of(SyntaxKind.PLUS, atom);
                break;
            case '?':
                pos++;
                result = RegexNode.of(SyntaxKind.QUEST, atom);
                break;
            case '{':
                int[] interval = parseInterval();
                if (interval == null) {
                    return atom;
                }
                result = RegexNode.repeat(atom, interval[0], interval[1]);
                if (repeatWeight(result) > MAX_REPEAT) {
                    throw error(U_REGEX_NUMBER_TOO_BIG, "nested repeat count exceeds " + MAX_REPEAT, start);
                }
                break;
            default:
                return atom;
        }
        if (peek() == '?') {
            pos++;      // non-greedy, same strings
        }
        int next = peek();
        if (next == '*' || next == '+' || next == '?' || (next == '{' && isInterval())) {
            throw error(U_REGEX_RULE_SYNTAX, "invalid nested repetition operator", pos);
        }
        return result;
    }

    /**
     * Largest number of copies of any leaf the repetitions in the subtree can ask for.
     */
    private static long repeatWeight(final RegexNode node) {
        long weight = 1;
        for (RegexNode child : node.children) {
            weight = Math.max(weight, repeatWeight(child));
        }
        if (node.kind == SyntaxKind.REPEAT) {
            int count = node.max == SyntaxTree.UNBOUNDED ? node.min : node.max;
            weight *= Math.max(count, 1);
        }
        return weight;
    }

    private boolean isInterval() {
        int save = pos;
        try {
            return parseInterval() != null;
        } finally {
            pos = save;
        }
    }

    /**
     * Parses {n}, {n,} or {n,m} at the current position.
     *
     * @return {min, max} with max -1 for {n,}, or null with the position unchanged when the text
     *         is not an interval, in which case '{' is an ordinary literal
     */
    private int[] parseInterval() {
        int start = pos;
        pos++;                                          // '{'
        int min = parseDecimal(start);
        if (min < 0) {
            pos = start;
            return null;
        }
        int max = min;
        if (peek() == ',') {
            pos++;
            if (peek() == '}') {
                max = SyntaxTree.UNBOUNDED;
            } else {
                max = parseDecimal(start);
                if (max < 0) {
                    pos = start;
                    return null;
                }
            }
        }
        if (peek() != '}') {
            pos = start;
            return null;
        }
        pos++;
        if (max != SyntaxTree.UNBOUNDED && max < min) {
            throw error(U_REGEX_MAX_LT_MIN, "invalid repeat count", start);
        }
        return new int[]{min, max};
    }

    /**
     * @return the decimal number at the current position, or -1 if there is no digit here
     */
    private int parseDecimal(final int intervalStart) {
        int digitsStart = pos;
        long value = 0;
        while (peek() >= '0' && peek() <= '9') {
            value = Math.min(value * 10 + (next() - '0'), Integer.MAX_VALUE);
        }
        if (pos == digitsStart) {
            return -1;
        }
        if (value > MAX_REPEAT) {
            throw error(U_REGEX_NUMBER_TOO_BIG, "repeat count exceeds " + MAX_REPEAT, intervalStart);
        }
        return (int) value;
    }

    //------------------------------------------------------------------------------
    //
    //   Atoms
    //
    //------------------------------------------------------------------------------
    private RegexNode parseAtom() {
        int start = pos;
        int c = next();
        switch (c) {
            case '(':
                return parseGroup(start);
            case '[':
                return parseClass(start);
            case '.':
                return new RegexNode(flags.contains(UREGEX_DOTALL) ? SyntaxKind.ANY_CHAR : SyntaxKind.ANY_CHAR_NOT_NL);
            case '^':
                return new RegexNode(flags.contains(UREGEX_MULTILINE) ? SyntaxKind.BEGIN_LINE : SyntaxKind.BEGIN_TEXT);
            case '$':
                return new RegexNode(flags.contains(UREGEX_MULTILINE) ? SyntaxKind.END_LINE : SyntaxKind.END_TEXT);
            case '\\':
                return parseEscapeAtom(start);
            case '*':
            case '+':
            case '?':
                throw error(U_REGEX_RULE_SYNTAX, "missing argument to repetition operator", start);
            case '{':
                pos = start;
                if (isInterval()) {
                    throw error(U_REGEX_RULE_SYNTAX, "missing argument to repetition operator", start);
                }
                pos = start + 1;
                return literal(c);
            default:
                return literal(c);
        }
    }

    private RegexNode parseGroup(final int start) {
        if (peek() != '?') {
            int index = ++ncap;
            return RegexNode.capture(index, null, parseGroupBody(start));
        }
        pos++;
        int c = peek();
        if (c == '=' || c == '!' || (c == '<' && (peekAt(1) == '=' || peekAt(1) == '!'))) {
            throw error(U_REGEX_UNIMPLEMENTED, "lookaround is not supported", start);
        }
        if (c == 'P' && peekAt(1) == '<') {
            pos += 2;
            return parseNamedCapture(start);
        }
        if (c == '<') {
            pos++;
            return parseNamedCapture(start);
        }
        return parseFlagGroup(start);
    }

    private RegexNode parseNamedCapture(final int start) {
        int nameStart = pos;
        StringBuilder name = new StringBuilder();
        while (true) {
            int c = next();
            if (c == EOX) {
                throw error(U_REGEX_INVALID_CAPTURE_GROUP_NAME, "missing >", start);
            }
            if (c == '>') {
                break;
            }
            if (!RegexStaticSets.INSTANCE.fWordSet.contains(c)) {
                throw error(U_REGEX_INVALID_CAPTURE_GROUP_NAME, "invalid character in capture group name", pos - 1);
            }
            name.appendCodePoint(c);
        }
        if (name.length() == 0) {
            throw error(U_REGEX_INVALID_CAPTURE_GROUP_NAME, "empty capture group name", nameStart);
        }
        if (!capNames.add(name.toString())) {
            throw error(U_REGEX_INVALID_CAPTURE_GROUP_NAME, "duplicate capture group name " + name, nameStart);
        }
        int index = ++ncap;
        return RegexNode.capture(index, name.toString(), parseGroupBody(start));
    }

    /**
     * (?flags) changes the flags up to the end of the enclosing group and returns null,
     * (?flags:re) is a non-capturing group with its own flags.
     */
    private RegexNode parseFlagGroup(final int start) {
        EnumSet<URegexpFlag> updated = EnumSet.copyOf(flags);
        boolean negated = false;
        boolean sawFlag = false;
        while (true) {
            int c = next();
            URegexpFlag inline = URegexpFlag.forInlineChar(c);
            if (inline != null) {
                setFlag(updated, inline, !negated);
                sawFlag = true;
                continue;
            }
            switch (c) {
                case 'U':
                    sawFlag = true;     // ungreedy, same strings
                    break;
                case '-':
                    if (negated) {
                        throw error(U_REGEX_RULE_SYNTAX, "invalid or unsupported Perl syntax", pos - 1);
                    }
                    negated = true;
                    sawFlag = false;
                    break;
                case ':':
                case ')':
                    if (negated && !sawFlag) {
                        throw error(U_REGEX_RULE_SYNTAX, "invalid or unsupported Perl syntax", pos - 1);
                    }
                    if (c == ')') {
                        flags.clear();
                        flags.addAll(updated);
                        return null;
                    }
                    EnumSet<URegexpFlag> saved = EnumSet.copyOf(flags);
                    flags.clear();
                    flags.addAll(updated);
                    RegexNode body = parseGroupBody(start);
                    flags.clear();
                    flags.addAll(saved);
                    return body;
                case EOX:
                    throw error(U_REGEX_MISMATCHED_PAREN, "missing closing )", pos);
                default:
                    throw error(U_REGEX_RULE_SYNTAX, "invalid or unsupported Perl syntax", pos - 1);
            }
        }
    }

    private static void setFlag(final EnumSet<URegexpFlag> set, final URegexpFlag flag, final boolean on) {
        if (on) {
            set.add(flag);
        } else {
            set.remove(flag);
        }
    }

    /**
     * Parses up to and including the ')' closing the group opened at start.
     * Flags changed inside the group do not leak out of it.
     */
    private RegexNode parseGroupBody(final int start) {
        if (++nesting > MAX_NESTING_DEPTH) {
            throw error(U_REGEX_PATTERN_TOO_BIG, "expression nests too deeply", start);
        }
        EnumSet<URegexpFlag> saved = EnumSet.copyOf(flags);
        RegexNode body = parseAlternation();
        if (peek() != ')') {
            throw error(U_REGEX_MISMATCHED_PAREN, "missing closing )", pos);
        }
        pos++;
        flags.clear();
        flags.addAll(saved);
        nesting--;
        return body;
    }

    private RegexNode parseEscapeAtom(final int start) {
        int c = peek();
        switch (c) {
            case EOX:
                throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "trailing backslash at end of expression", start);
            case 'A':
                pos++;
                return new RegexNode(SyntaxKind.BEGIN_TEXT);
            case 'z':
                pos++;
                return new RegexNode(SyntaxKind.END_TEXT);
            case 'b':
                pos++;
                return new RegexNode(SyntaxKind.WORD_BOUNDARY);
            case 'B':
                pos++;
                return new RegexNode(SyntaxKind.NO_WORD_BOUNDARY);
            case 'Q':
                pos++;
                return parseQuoted();
            case 'p':
            case 'P': {
                boolean negated = isNegatedProperty(0);
                return classNode(parseUnicodeClass(start), negated);
            }
            default:
                break;
        }
        UnicodeSet perl = RegexStaticSets.INSTANCE.perlClass(c);
        if (perl != null) {
            pos++;
            return classNode(new UnicodeSet(perl), RegexStaticSets.INSTANCE.isComplementedPerlClass(c));
        }
        return literal(parseEscapedCodePoint(start));
    }

    private RegexNode parseQuoted() {
        List<RegexNode> items = new ArrayList<>();
        while (peek() != EOX) {
            if (peek() == '\\' && peekAt(1) == 'E') {
                pos += 2;
                break;
            }
            items.add(literal(next()));
        }
        return concat(items);
    }

    /**
     * Parses the escape after a backslash that stands for a single code point.
     * The position is just after the backslash.
     */
    private int parseEscapedCodePoint(final int start) {
        int c = next();
        switch (c) {
            case EOX:
                throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "trailing backslash at end of expression", start);
            case 'a':
                return 0x07;
            case 'f':
                return '\f';
            case 't':
                return '\t';
            case 'n':
                return '\n';
            case 'r':
                return '\r';
            case 'v':
                return 0x0b;
            case '1': case '2': case '3': case '4': case '5': case '6': case '7':
                // A single non-zero digit is a backreference.
                if (!isOctalDigit(peek())) {
                    throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "backreferences are not supported", start);
                }
                return parseOctal(c);
            case '0':
                return parseOctal(c);
            case '8':
            case '9':
                throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "backreferences are not supported", start);
            case 'x':
                return parseHex(start);
            default:
                if (RegexStaticSets.INSTANCE.fEscapablePunctuation.contains(c)) {
                    return c;
                }
                throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "invalid escape sequence", start);
        }
    }

    private static boolean isOctalDigit(final int c) {
        return c >= '0' && c <= '7';
    }

    private int parseOctal(final int first) {
        int value = first - '0';
        for (int i = 0; i < 2 && isOctalDigit(peek()); i++) {
            value = value * 8 + (next() - '0');
        }
        return value;
    }

    private int parseHex(final int start) {
        if (peek() == '{') {
            pos++;
            int digits = 0;
            long value = 0;
            while (peek() != '}') {
                int d = Character.digit(next(), 16);
                if (d < 0) {
                    throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "invalid hex escape", start);
                }
                value = value * 16 + d;
                if (value > UCharacter.MAX_VALUE) {
                    throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "hex escape out of range", start);
                }
                digits++;
            }
            pos++;
            if (digits == 0) {
                throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "invalid hex escape", start);
            }
            return (int) value;
        }
        int hi = Character.digit(next(), 16);
        int lo = Character.digit(next(), 16);
        if (hi < 0 || lo < 0) {
            throw error(U_REGEX_BAD_ESCAPE_SEQUENCE, "invalid hex escape", start);
        }
        return hi * 16 + lo;
    }

    /**
     * Whether the \p or \P escape whose letter is {@code delta} code points ahead names a
     * complement.  \P{^Name} negates twice.
     */
    private boolean isNegatedProperty(final int delta) {
        boolean negated = peekAt(delta) == 'P';
        if (peekAt(delta + 1) == '{' && peekAt(delta + 2) == '^') {
            negated = !negated;
        }
        return negated;
    }

    /**
     * Parses \pX, \p{Name}, \p{^Name} and the \P forms.  The position is at 'p' or 'P'.
     * Names are resolved by ICU as a general category, a script or a binary property.
     */
    private UnicodeSet parseUnicodeClass(final int start) {
        boolean negate = next() == 'P';
        String name;
        if (peek() == '{') {
            pos++;
            StringBuilder sb = new StringBuilder();
            while (peek() != '}') {
                if (peek() == EOX) {
                    throw error(U_REGEX_PROPERTY_SYNTAX, "missing } in character class name", start);
                }
                sb.appendCodePoint(next());
            }
            pos++;
            name = sb.toString();
        } else {
            if (peek() == EOX) {
                throw error(U_REGEX_PROPERTY_SYNTAX, "missing character class name", start);
            }
            name = new String(Character.toChars(next()));
        }
        if (name.startsWith("^")) {
            negate = !negate;
            name = name.substring(1);
        }
        UnicodeSet set;
        if ("Any".equals(name)) {
            set = new UnicodeSet(0, UCharacter.MAX_VALUE);
        } else {
            if (name.isEmpty() || name.indexOf('=') >= 0 || name.indexOf(':') >= 0) {
                throw error(U_REGEX_PROPERTY_SYNTAX, "invalid character class name", start);
            }
            try {
                set = new UnicodeSet().applyPropertyAlias(name, "");
            } catch (IllegalArgumentException e) {
                throw error(U_REGEX_PROPERTY_SYNTAX, "unknown character class name " + name, start);
            }
        }
        if (negate) {
            set.complement();
        }
        return set;
    }

    //------------------------------------------------------------------------------
    //
    //   Bracket expressions
    //
    //------------------------------------------------------------------------------
    private RegexNode parseClass(final int start) {
        UnicodeSet set = new UnicodeSet();
        boolean negate = false;
        if (peek() == '^') {
            negate = true;
            pos++;
        }
        boolean complementedPart = false;
        boolean first = true;
        while (true) {
            int c = peek();
            if (c == EOX) {
                throw error(U_REGEX_MISSING_CLOSE_BRACKET, "missing closing ]", start);
            }
            if (c == ']' && !first) {
                pos++;
                break;
            }
            first = false;
            if (c == '[' && peekAt(1) == ':') {
                boolean posixNegated = peekAt(2) == '^';
                UnicodeSet posix = parsePosixClass();
                if (posix != null) {
                    complementedPart |= posixNegated;
                    set.addAll(posix);
                    continue;
                }
            }
            if (c == '\\') {
                int e = peekAt(1);
                UnicodeSet perl = RegexStaticSets.INSTANCE.perlClass(e);
                if (perl != null) {
                    pos += 2;
                    complementedPart |= RegexStaticSets.INSTANCE.isComplementedPerlClass(e);
                    set.addAll(perl);
                    continue;
                }
                if (e == 'p' || e == 'P') {
                    int escapeStart = pos;
                    pos++;
                    complementedPart |= isNegatedProperty(0);
                    set.addAll(parseUnicodeClass(escapeStart));
                    continue;
                }
            }
            int rangeStart = pos;
            int lo = parseClassChar();
            if (peek() == '-' && peekAt(1) != ']' && peekAt(1) != EOX) {
                pos++;
                int hi = parseClassChar();
                if (hi < lo) {
                    throw error(U_REGEX_INVALID_RANGE, "invalid character class range", rangeStart);
                }
                set.add(lo, hi);
            } else {
                set.add(lo);
            }
        }
        if (flags.contains(UREGEX_CASE_INSENSITIVE)) {
            set.closeOver(UnicodeSet.CASE_INSENSITIVE).removeAllStrings();
        }
        if (negate) {
            set.complement();
        }
        return RegexNode.charClass(set, negate || complementedPart);
    }

    private int parseClassChar() {
        int start = pos;
        int c = next();
        if (c == '\\') {
            return parseEscapedCodePoint(start);
        }
        return c;
    }

    /**
     * Parses [:name:] or [:^name:] at the current position.
     *
     * @return the set, or null with the position unchanged if the text is not a POSIX class
     */
    private UnicodeSet parsePosixClass() {
        int start = pos;
        int end = -1;
        for (int i = pos + 2; i + 1 < pattern.length; i++) {
            if (pattern[i] == ':' && pattern[i + 1] == ']') {
                end = i;
                break;
            }
        }
        if (end < 0) {
            return null;
        }
        String name = new String(pattern, start + 2, end - start - 2);
        boolean negate = name.startsWith("^");
        if (negate) {
            name = name.substring(1);
        }
        UnicodeSet posix = RegexStaticSets.INSTANCE.fPosixSets.get(name);
        if (posix == null) {
            throw error(U_REGEX_PROPERTY_SYNTAX, "invalid character class range", start);
        }
        pos = end + 2;
        UnicodeSet result = new UnicodeSet(posix);
        return negate ? result.complement() : result;
    }

    //------------------------------------------------------------------------------
    //
    //   Node helpers
    //
    //------------------------------------------------------------------------------
    private RegexNode literal(final int cp) {
        if (flags.contains(UREGEX_CASE_INSENSITIVE)) {
            UnicodeSet variants = new UnicodeSet(cp, cp).closeOver(UnicodeSet.CASE_INSENSITIVE).removeAllStrings();
            if (variants.size() > 1) {
                return RegexNode.charClass(variants);
            }
        }
        return RegexNode.literal(cp);
    }

    private RegexNode classNode(final UnicodeSet set, final boolean negated) {
        if (flags.contains(UREGEX_CASE_INSENSITIVE)) {
            set.closeOver(UnicodeSet.CASE_INSENSITIVE).removeAllStrings();
        }
        return RegexNode.charClass(set, negated);
    }

    //------------------------------------------------------------------------------
    //
    //   Scanning and error reporting
    //
    //------------------------------------------------------------------------------
    private int peek() {
        return peekAt(0);
    }

    private int peekAt(final int delta) {
        int i = pos + delta;
        return i < pattern.length ? pattern[i] : EOX;
    }

    private int next() {
        int c = peek();
        if (c != EOX) {
            pos++;
        }
        return c;
    }

    /**
     * @param index code point index at which the error was detected; the end of the pattern is
     *              reported at its last code point
     */
    private RegexParseException error(final UErrorCode code, final String reason, final int index) {
        int at = Math.max(0, Math.min(index, pattern.length - 1));
        int line = 1;
        int lineStart = 0;
        for (int i = 0; i < at; i++) {
            if (pattern[i] == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        int preStart = Math.max(0, at - PARSE_CONTEXT_LEN);
        int postEnd = Math.min(pattern.length, at + PARSE_CONTEXT_LEN);
        String pre = new String(pattern, preStart, at - preStart);
        String post = new String(pattern, at, postEnd - at);
        return new RegexParseException(code, reason, line, at - lineStart + 1, pre, post);
    }

    @Override
    public String toString() {
        return "RegexParser{" + regex + " at " + pos + '}';
    }
}

package com.github.tarcv.u4jxeger;

/**
 * Pattern parsing modes.  Each mode can also be switched on inside the pattern
 * with the inline flag noted below, except {@link #UREGEX_LITERAL}.
 */
public enum URegexpFlag {
    /**
     * Enable case insensitive matching, inline {@code (?i)}.  Literal characters that have
     * case variants generate any of their variants.
     */
    UREGEX_CASE_INSENSITIVE('i'),

    /**
     * If set, '.' matches line terminators, otherwise '.' matching stops at line end.
     * Inline {@code (?s)}.
     */
    UREGEX_DOTALL('s'),

    /**
     * If set, treat the entire pattern as a literal string.
     * Metacharacters or escape sequences in the input sequence will be given
     * no special meaning.
     */
    UREGEX_LITERAL((char) 0),

    /**
     * Control behavior of "$" and "^".
     * If set, they are line anchors, otherwise they anchor the start and end of text.
     * Inline {@code (?m)}.
     */
    UREGEX_MULTILINE('m');

    final char inlineChar;

    URegexpFlag(final char inlineChar) {
        this.inlineChar = inlineChar;
    }

    /**
     * @return the mode switched by {@code c} inside {@code (?...)}, or null
     */
    static URegexpFlag forInlineChar(final int c) {
        for (URegexpFlag flag : values()) {
            if (flag.inlineChar != 0 && flag.inlineChar == c) {
                return flag;
            }
        }
        return null;
    }
}

package com.github.tarcv.u4jxeger;

public enum SyntaxKind {
    NO_MATCH("OpNoMatch"),                 // matches no strings
    EMPTY_MATCH("OpEmptyMatch"),           // matches empty string
    LITERAL("OpLiteral"),                  // matches a fixed code point sequence
    CHAR_CLASS("OpCharClass"),             // matches one code point from a set of ranges
    ANY_CHAR_NOT_NL("OpAnyCharNotNL"),     // matches any character except newline
    ANY_CHAR("OpAnyChar"),                 // matches any character
    BEGIN_LINE("OpBeginLine"),             // matches empty string at beginning of line
    END_LINE("OpEndLine"),                 // matches empty string at end of line
    BEGIN_TEXT("OpBeginText"),             // matches empty string at beginning of text
    END_TEXT("OpEndText"),                 // matches empty string at end of text
    WORD_BOUNDARY("OpWordBoundary"),       // matches word boundary `\b`
    NO_WORD_BOUNDARY("OpNoWordBoundary"),  // matches word non-boundary `\B`
    CAPTURE("OpCapture"),                  // capturing subexpression with index, optional name
    STAR("OpStar"),                        // matches child zero or more times
    PLUS("OpPlus"),                        // matches child one or more times
    QUEST("OpQuest"),                      // matches child zero or one times
    REPEAT("OpRepeat"),                    // matches child at least min, at most max times; max -1 means no limit
    CONCAT("OpConcat"),                    // matches concatenation of children
    ALTERNATE("OpAlternate");              // matches alternation of children

    static final String UNKNOWN_OP_NAME = "OpUnknown";

    private static final SyntaxKind[] VALUES = values();

    private final String opName;

    SyntaxKind(final String opName) {
        this.opName = opName;
    }

    /**
     * Name used for this kind in tree dumps and debug logging.
     */
    public String opName() {
        return opName;
    }

    /**
     * @return the kind stored under the given code, or null if the code is not a known kind
     */
    static SyntaxKind fromCode(final int code) {
        if (code < 0 || code >= VALUES.length) {
            return null;
        }
        return VALUES[code];
    }

    static String opName(final int code) {
        SyntaxKind kind = fromCode(code);
        return kind != null ? kind.opName : UNKNOWN_OP_NAME;
    }

    boolean isRepetition() {
        return this == STAR || this == PLUS || this == QUEST || this == REPEAT;
    }

    boolean isZeroWidth() {
        switch (this) {
            case NO_MATCH:
            case EMPTY_MATCH:
            case BEGIN_LINE:
            case END_LINE:
            case BEGIN_TEXT:
            case END_TEXT:
            case WORD_BOUNDARY:
            case NO_WORD_BOUNDARY:
                return true;
            default:
                return false;
        }
    }
}

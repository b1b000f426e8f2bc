package com.github.tarcv.u4jxeger;

/**
 * Thrown when a pattern is not a valid expression in the grammar accepted by {@link Xeger}.
 * Line and offset are 1-based; the offset counts code points from the start of the line.
 */
public class RegexParseException extends UErrorException {
    private final int line;
    private final int offset;
    private final String preContext;
    private final String postContext;

    public RegexParseException(UErrorCode errorCode, String reason, int line, int offset,
                               String preContext, String postContext) {
        super(errorCode, String.format("%s: %s at line %d, offset %d: \"%s\" <-- HERE \"%s\"",
                errorCode, reason, line, offset, preContext, postContext));
        this.line = line;
        this.offset = offset;
        this.preContext = preContext;
        this.postContext = postContext;
    }

    public int getLine() {
        return line;
    }

    public int getOffset() {
        return offset;
    }

    public String getPreContext() {
        return preContext;
    }

    public String getPostContext() {
        return postContext;
    }
}

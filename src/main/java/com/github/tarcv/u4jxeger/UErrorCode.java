package com.github.tarcv.u4jxeger;

public enum UErrorCode {
    U_ZERO_ERROR,
    U_ILLEGAL_ARGUMENT_ERROR,
    /*
     * Error codes in the range 0x10300-0x103ff are reserved for regular expression related errors.
     */
    U_REGEX_INTERNAL_ERROR(0x10300),       /**< An internal error (bug) was detected.              */
    U_REGEX_RULE_SYNTAX,                  /**< Syntax error in regexp pattern.                    */
    U_REGEX_BAD_ESCAPE_SEQUENCE,          /**< Unrecognized backslash escape sequence in pattern  */
    U_REGEX_PROPERTY_SYNTAX,              /**< Incorrect Unicode property                         */
    U_REGEX_UNIMPLEMENTED,                /**< Use of regexp feature that is not supported by the generator. */
    U_REGEX_MISMATCHED_PAREN,             /**< Incorrectly nested parentheses in regexp pattern.  */
    U_REGEX_NUMBER_TOO_BIG,               /**< Repeat count is larger than the generator allows.  */
    U_REGEX_MAX_LT_MIN,                   /**< In {min,max}, max is less than min.                */
    U_REGEX_MISSING_CLOSE_BRACKET,        /**< Missing closing bracket on a bracket expression.   */
    U_REGEX_INVALID_RANGE,                /**< In a character range [x-y], x is greater than y.   */
    U_REGEX_PATTERN_TOO_BIG,              /**< Pattern nests deeper than the parser allows.       */
    U_REGEX_INVALID_CAPTURE_GROUP_NAME,   /**< Missing, malformed or duplicate capture group name. */
    ;

    private final int index;

    UErrorCode(final int index) {
        this.index = index;
    }

    UErrorCode() {
        this.index = -1;
    }

    public int getIndex() {
        if (index >= 0) {
            return index;
        } else if (ordinal() == 0) {
            return 0;
        } else {
            return UErrorCode.values()[ordinal() - 1].getIndex() + 1;
        }
    }
}

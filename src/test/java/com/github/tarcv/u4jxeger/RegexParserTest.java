// New code and changes are © 2024 TarCV
// © 2016 and later: Unicode, Inc. and others.
// License & terms of use: http://www.unicode.org/copyright.html
package com.github.tarcv.u4jxeger;

import org.junit.Assert;
import org.junit.Test;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.github.tarcv.u4jxeger.UErrorCode.*;
import static com.github.tarcv.u4jxeger.URegexpFlag.*;

public class RegexParserTest {

    private static String simplified(final String pat) {
        return simplified(pat, Collections.<URegexpFlag>emptySet());
    }

    private static String simplified(final String pat, final Set<URegexpFlag> flags) {
        return SyntaxTree.of(RegexSimplifier.simplify(RegexParser.parse(pat, flags))).toString();
    }

    private static void REGEX_SIMPLE(final String pat, final String expected) {
        Assert.assertEquals("pattern " + pat, expected, simplified(pat));
    }

//---------------------------------------------------------------------------
//
//      regex_err   Check that a pattern fails to compile with the expected
//                  error, reported at the expected line and column.
//
//---------------------------------------------------------------------------
    static void regex_err(final String pat, final int errLine, final int errCol, final UErrorCode expectedStatus) {
        try {
            RegexParser.parse(pat, Collections.<URegexpFlag>emptySet());
        } catch (RegexParseException e) {
            Assert.assertEquals("Pattern \"" + pat + "\": " + e.getMessage(), expectedStatus, e.getErrorCode());
            if (errLine != -1) {
                Assert.assertEquals("Pattern \"" + pat + "\" line", errLine, e.getLine());
            }
            if (errCol != -1) {
                Assert.assertEquals("Pattern \"" + pat + "\" column", errCol, e.getOffset());
            }
            return;
        }
        Assert.fail("Pattern \"" + pat + "\" compiled, expected " + expectedStatus);
    }

//---------------------------------------------------------------------------
//
//      Simplification    The simplified tree prints as an equivalent pattern.
//
//---------------------------------------------------------------------------
    @Test
    public void Simplification() {
        // Repetition
        REGEX_SIMPLE("a{3}", "a{3}");
        REGEX_SIMPLE("a{2,4}", "a{2,4}");
        REGEX_SIMPLE("a{2,}", "a{2,}");
        REGEX_SIMPLE("a{1}", "a");
        REGEX_SIMPLE("a{0}", "(?:)");
        REGEX_SIMPLE("a{0,1}", "a?");
        REGEX_SIMPLE("a{0,}", "a*");
        REGEX_SIMPLE("a{1,}", "a+");
        REGEX_SIMPLE("(?:a*)*", "a*");
        REGEX_SIMPLE("(?:a+)+", "a+");
        REGEX_SIMPLE("(?:a+)?", "a*");
        REGEX_SIMPLE("(?:a?)*", "a*");
        REGEX_SIMPLE("(?:ab)*", "(?:ab)*");
        REGEX_SIMPLE("(?:a{2}){3}", "(?:a{2}){3}");
        REGEX_SIMPLE("a*?b+?", "a*b+");

        // Alternation and concatenation
        REGEX_SIMPLE("a|b|c", "[a-c]");
        REGEX_SIMPLE("(a|b|c)", "([a-c])");
        REGEX_SIMPLE("a|a", "a|a");
        REGEX_SIMPLE("ab|ac", "ab|ac");
        REGEX_SIMPLE("(a)|(b)", "(a)|(b)");
        REGEX_SIMPLE("x(?:ab|cd)", "x(?:ab|cd)");
        REGEX_SIMPLE("x|(?:y|z)", "[x-z]");
        REGEX_SIMPLE("x|(?:yy|zz)", "x|yy|zz");
        REGEX_SIMPLE("(?:x|(?:y|(?:z)))|w", "[w-z]");
        REGEX_SIMPLE("x|[yz]", "x|[yz]");
        REGEX_SIMPLE("a(?:)b", "ab");
        REGEX_SIMPLE("a.b", "a(?-s:.)b");

        // Classes
        REGEX_SIMPLE("[a]", "a");
        REGEX_SIMPLE("[a-cx]", "[a-cx]");
        REGEX_SIMPLE("[^\\n]", "(?-s:.)");
        REGEX_SIMPLE("[^a]", "[^a]");
        REGEX_SIMPLE("[\\x00-\\x{10FFFF}]", "(?s:.)");
        REGEX_SIMPLE("\\d", "[0-9]");
        REGEX_SIMPLE("[[:digit:]x]", "[0-9x]");
        REGEX_SIMPLE("[-a]", "[\\-a]");

        // Anchors and flags
        REGEX_SIMPLE("^a$", "\\Aa\\z");
        REGEX_SIMPLE("(?m)^a$", "(?m:^)a(?m:$)");
        REGEX_SIMPLE("(?s).", "(?s:.)");
        REGEX_SIMPLE("(?i)a", "[Aa]");
        REGEX_SIMPLE("(?i)[a-b]", "[A-Ba-b]");
        REGEX_SIMPLE("(?i)[^a]", "[^Aa]");
        REGEX_SIMPLE("(?i:a)b", "[Aa]b");
        REGEX_SIMPLE("a(?i)b", "a[Bb]");
        REGEX_SIMPLE("((?i)a)b", "([Aa])b");
        REGEX_SIMPLE("(?i-i:a)", "a");
        REGEX_SIMPLE("(?U)a", "a");

        // Escapes and literals
        REGEX_SIMPLE("(?<n>a)", "(?P<n>a)");
        REGEX_SIMPLE("(?P<n>a)", "(?P<n>a)");
        REGEX_SIMPLE("\\Q*+\\E", "\\*\\+");
        REGEX_SIMPLE("\\101\\x42\\x{43}", "ABC");
        REGEX_SIMPLE("\\0", "\\x00");
        REGEX_SIMPLE("abc{a,2}", "abc\\{a,2\\}");
        REGEX_SIMPLE("a{,3}", "a\\{,3\\}");
        REGEX_SIMPLE("{", "\\{");
    }

    @Test
    public void LiteralFlag() {
        Assert.assertEquals("a\\.b\\*\\(c", simplified("a.b*(c", EnumSet.of(UREGEX_LITERAL)));
        Assert.assertEquals("(?:)", simplified("", EnumSet.of(UREGEX_LITERAL)));
        Assert.assertEquals("\\\\Q", simplified("\\Q", EnumSet.of(UREGEX_LITERAL)));
    }

    @Test
    public void ParseTreeShape() {
        RegexNode alt = RegexParser.parse("a|bc", Collections.<URegexpFlag>emptySet());
        Assert.assertEquals(SyntaxKind.ALTERNATE, alt.kind);
        Assert.assertEquals(2, alt.children.size());
        Assert.assertEquals(SyntaxKind.CONCAT, alt.children.get(1).kind);

        RegexNode groups = RegexParser.parse("(a)(?:b)(?P<x>c)", Collections.<URegexpFlag>emptySet());
        Assert.assertEquals(SyntaxKind.CONCAT, groups.kind);
        Assert.assertEquals(1, groups.children.get(0).captureIndex);
        Assert.assertEquals(SyntaxKind.LITERAL, groups.children.get(1).kind);
        Assert.assertEquals(2, groups.children.get(2).captureIndex);
        Assert.assertEquals("x", groups.children.get(2).captureName);
    }

    @Test
    public void Dump() {
        SyntaxTree tree = SyntaxTree.of(RegexSimplifier.simplify(
                RegexParser.parse("a(b|cd)*x{2,}", Collections.<URegexpFlag>emptySet())));
        Assert.assertEquals(
                "OpConcat\n" +
                "  OpLiteral a\n" +
                "  OpStar\n" +
                "    OpCapture #1\n" +
                "      OpAlternate\n" +
                "        OpLiteral b\n" +
                "        OpLiteral cd\n" +
                "  OpRepeat {2,}\n" +
                "    OpLiteral x\n",
                tree.dump());
    }

//---------------------------------------------------------------------------
//
//      Errors     Check for error status and position from syntax errors.
//
//---------------------------------------------------------------------------
    @Test
    public void Errors() {
        // Repetition operators without an argument, nested repetition
        regex_err("+", 1, 1, U_REGEX_RULE_SYNTAX);
        regex_err("*c", 1, 1, U_REGEX_RULE_SYNTAX);
        regex_err("abc**", 1, 5, U_REGEX_RULE_SYNTAX);
        regex_err("a{2}{3}", 1, 5, U_REGEX_RULE_SYNTAX);
        regex_err("{2}", 1, 1, U_REGEX_RULE_SYNTAX);
        regex_err("abc\ndef(*2)", 2, 5, U_REGEX_RULE_SYNTAX);

        // Repeat counts
        regex_err("abc{4,2}", 1, 4, U_REGEX_MAX_LT_MIN);
        regex_err("abc{1001}", 1, 4, U_REGEX_NUMBER_TOO_BIG);
        regex_err("abc{1,99999999999}", 1, 4, U_REGEX_NUMBER_TOO_BIG);
        regex_err("(?:a{100}){100}", 1, 11, U_REGEX_NUMBER_TOO_BIG);

        // Parentheses
        regex_err("ab(cd", 1, 5, U_REGEX_MISMATCHED_PAREN);
        regex_err("(((((((", 1, 7, U_REGEX_MISMATCHED_PAREN);
        regex_err(")))))))", 1, 1, U_REGEX_MISMATCHED_PAREN);
        regex_err("Grouping only parens (?: blah)) blah", 1, 31, U_REGEX_MISMATCHED_PAREN);

        // Bracket expressions
        regex_err("[abc", 1, 1, U_REGEX_MISSING_CLOSE_BRACKET);
        regex_err("x[]", 1, 2, U_REGEX_MISSING_CLOSE_BRACKET);
        regex_err("[z-a]", 1, 2, U_REGEX_INVALID_RANGE);
        regex_err("[[:foo:]]", 1, 2, U_REGEX_PROPERTY_SYNTAX);

        // Escapes
        regex_err("\\", 1, 1, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\q", 1, 1, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("(ab)\\1", 1, 5, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\x{110000}", 1, 1, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\xZZ", 1, 1, U_REGEX_BAD_ESCAPE_SEQUENCE);
        regex_err("\\p{NotAProperty}", 1, 1, U_REGEX_PROPERTY_SYNTAX);
        regex_err("\\p{Greek", 1, 1, U_REGEX_PROPERTY_SYNTAX);

        // Unsupported or malformed Perl groups
        regex_err("a(?=b)", 1, 2, U_REGEX_UNIMPLEMENTED);
        regex_err("a(?!b)", 1, 2, U_REGEX_UNIMPLEMENTED);
        regex_err("(?<=a)b", 1, 1, U_REGEX_UNIMPLEMENTED);
        regex_err("(?<!a)b", 1, 1, U_REGEX_UNIMPLEMENTED);
        regex_err("a(?z)", 1, 4, U_REGEX_RULE_SYNTAX);
        regex_err("(?-)", 1, 4, U_REGEX_RULE_SYNTAX);
        regex_err("(?P<a>x)(?P<a>y)", 1, 13, U_REGEX_INVALID_CAPTURE_GROUP_NAME);
        regex_err("(?P<>x)", 1, 5, U_REGEX_INVALID_CAPTURE_GROUP_NAME);
        regex_err("(?P<a-b>x)", 1, 6, U_REGEX_INVALID_CAPTURE_GROUP_NAME);

        // Nesting limit
        StringBuilder deep = new StringBuilder();
        for (int i = 0; i < RegexParser.MAX_NESTING_DEPTH + 1; i++) {
            deep.append('(');
        }
        deep.append('a');
        for (int i = 0; i < RegexParser.MAX_NESTING_DEPTH + 1; i++) {
            deep.append(')');
        }
        regex_err(deep.toString(), 1, -1, U_REGEX_PATTERN_TOO_BIG);

        try {
            RegexParser.parse(null, Collections.<URegexpFlag>emptySet());
            Assert.fail("null pattern accepted");
        } catch (UErrorException e) {
            Assert.assertEquals(U_ILLEGAL_ARGUMENT_ERROR, e.getErrorCode());
        }
    }

    @Test
    public void ErrorContext() {
        try {
            RegexParser.parse("0123456789abcdefghij[klm", Collections.<URegexpFlag>emptySet());
            Assert.fail("expected an error");
        } catch (RegexParseException e) {
            Assert.assertEquals(U_REGEX_MISSING_CLOSE_BRACKET, e.getErrorCode());
            Assert.assertEquals(21, e.getOffset());
            Assert.assertEquals("456789abcdefghij", e.getPreContext());
            Assert.assertEquals("[klm", e.getPostContext());
            Assert.assertTrue(e.getMessage(), e.getMessage().contains("<-- HERE"));
        }
    }

    @Test
    public void ErrorCodeValues() {
        Assert.assertEquals(0, U_ZERO_ERROR.getIndex());
        Assert.assertEquals(1, U_ILLEGAL_ARGUMENT_ERROR.getIndex());
        Assert.assertEquals(0x10300, U_REGEX_INTERNAL_ERROR.getIndex());
        Assert.assertEquals(0x10301, U_REGEX_RULE_SYNTAX.getIndex());
        Assert.assertEquals(0x1030b, U_REGEX_INVALID_CAPTURE_GROUP_NAME.getIndex());
    }

    @Test
    public void InlineFlagChars() {
        Assert.assertEquals(UREGEX_CASE_INSENSITIVE, URegexpFlag.forInlineChar('i'));
        Assert.assertEquals(UREGEX_MULTILINE, URegexpFlag.forInlineChar('m'));
        Assert.assertEquals(UREGEX_DOTALL, URegexpFlag.forInlineChar('s'));
        Assert.assertNull(URegexpFlag.forInlineChar(0));
        Assert.assertNull(URegexpFlag.forInlineChar('x'));
    }

    @Test
    public void NestingWithinLimit() {
        StringBuilder deep = new StringBuilder();
        for (int i = 0; i < RegexParser.MAX_NESTING_DEPTH; i++) {
            deep.append("(?:");
        }
        deep.append('a');
        for (int i = 0; i < RegexParser.MAX_NESTING_DEPTH; i++) {
            deep.append(')');
        }
        Assert.assertEquals("a", simplified(deep.toString()));
    }
}

package com.github.tarcv.u4jxeger;

import com.ibm.icu.text.UnicodeSet;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

enum RegexStaticSets { // 'enum' here implements the singleton pattern
    INSTANCE;

    // "Rule Char" Characters are those with special meaning, and therefore
    //    need to be escaped to appear as literals in a regexp.
    final static String gRuleSet_rule_chars = "*?+[(){}^$|\\.";

    //
    //  Perl classes are ASCII-only, as in RE2.
    //
    final static String gIsDigitPattern = "[0-9]";
    final static String gIsWordPattern  = "[0-9A-Za-z_]";

    final UnicodeSet fDigitSet;
    final UnicodeSet fSpaceSet;
    final UnicodeSet fWordSet;

    /** Rule chars are all valid after a backslash, as are the rest of the ASCII punctuation. */
    final UnicodeSet fEscapablePunctuation;

    /** ASCII POSIX classes, usable as [:name:] inside a bracket expression. */
    final Map<String, UnicodeSet> fPosixSets;

    RegexStaticSets() {
        fDigitSet = new UnicodeSet(gIsDigitPattern).freeze();
        fSpaceSet = new UnicodeSet().add('\t').add('\n').add('\f').add('\r').add(' ').freeze();
        fWordSet = new UnicodeSet(gIsWordPattern).freeze();
        fEscapablePunctuation = new UnicodeSet(0x21, 0x7e)
                .removeAll(new UnicodeSet("[0-9A-Za-z_]"))
                .addAll(gRuleSet_rule_chars)
                .freeze();

        Map<String, UnicodeSet> posix = new HashMap<>();
        posix.put("alnum", new UnicodeSet("[0-9A-Za-z]").freeze());
        posix.put("alpha", new UnicodeSet("[A-Za-z]").freeze());
        posix.put("ascii", new UnicodeSet(0x00, 0x7f).freeze());
        posix.put("blank", new UnicodeSet().add('\t').add(' ').freeze());
        posix.put("cntrl", new UnicodeSet(0x00, 0x1f).add(0x7f).freeze());
        posix.put("digit", fDigitSet);
        posix.put("graph", new UnicodeSet(0x21, 0x7e).freeze());
        posix.put("lower", new UnicodeSet("[a-z]").freeze());
        posix.put("print", new UnicodeSet(0x20, 0x7e).freeze());
        posix.put("punct", new UnicodeSet(0x21, 0x7e).removeAll(new UnicodeSet("[0-9A-Za-z]")).freeze());
        posix.put("space", new UnicodeSet(fSpaceSet).add(0x0b).freeze());
        posix.put("upper", new UnicodeSet("[A-Z]").freeze());
        posix.put("word", fWordSet);
        posix.put("xdigit", new UnicodeSet("[0-9A-Fa-f]").freeze());
        fPosixSets = Collections.unmodifiableMap(posix);
    }

    /**
     * @param escape the letter after a backslash
     * @return the class for \d \D \s \S \w \W, or null for any other letter
     */
    UnicodeSet perlClass(final int escape) {
        switch (escape) {
            case 'd':
                return fDigitSet;
            case 's':
                return fSpaceSet;
            case 'w':
                return fWordSet;
            case 'D':
                return new UnicodeSet(fDigitSet).complement();
            case 'S':
                return new UnicodeSet(fSpaceSet).complement();
            case 'W':
                return new UnicodeSet(fWordSet).complement();
            default:
                return null;
        }
    }

    boolean isComplementedPerlClass(final int escape) {
        return escape == 'D' || escape == 'S' || escape == 'W';
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnChar;
import com.amazon.edn.EdnErrorCode;
import com.amazon.edn.EdnFloat;
import com.amazon.edn.EdnInt;
import com.amazon.edn.EdnKeyword;
import com.amazon.edn.EdnNil;
import com.amazon.edn.EdnSymbol;
import com.amazon.edn.EdnValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CandidateMatcherTest
{
    /**
     * Offers every character of {@code text} and finishes the token.
     */
    private static EdnValue run(CandidateMatcher matcher, String text)
    {
        matcher.reset();
        for (int ii = 0; ii < text.length(); ii++) {
            matcher.offer(text.charAt(ii), 1, ii + 1);
        }
        return matcher.finish(text);
    }

    @Test
    public void livenessNeverComesBack()
    {
        LiteralMatcher matcher = new LiteralMatcher("nil", EdnNil.NIL);
        assertEquals(CandidateMatcher.Liveness.UNKNOWN, matcher.getLiveness());
        matcher.offer('n', 1, 1);
        assertEquals(CandidateMatcher.Liveness.ALIVE, matcher.getLiveness());
        matcher.offer('x', 1, 2);
        assertEquals(CandidateMatcher.Liveness.DEAD, matcher.getLiveness());
        matcher.offer('l', 1, 3);
        assertEquals(CandidateMatcher.Liveness.DEAD, matcher.getLiveness());
        assertEquals(2, matcher.getLength());
        assertEquals(2, matcher.getFailColumn());

        matcher.reset();
        assertEquals(CandidateMatcher.Liveness.UNKNOWN, matcher.getLiveness());
        assertEquals(0, matcher.getLength());
    }

    @Test
    public void literalNeedsTheWholeToken()
    {
        LiteralMatcher matcher = new LiteralMatcher("true", EdnNil.NIL);
        assertEquals(EdnNil.NIL, run(matcher, "true"));
        assertNull(run(matcher, "tru"));
        assertNull(run(matcher, "truex"));
        assertNull(run(matcher, "True"));
        assertNull(run(matcher, ""));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "a", "abc", "a1", "-", "+", ".", "-a", "+-", ".*", "a/b", "ns.x/y-z",
        "a:b", "a#", "a<=>", "a/-", "foo!?", "été"
    })
    public void validSymbols(String text)
    {
        SymbolMatcher matcher = new SymbolMatcher(false);
        assertEquals(EdnSymbol.valueOf(text), run(matcher, text));
        // the same text classifies the same way every time
        assertEquals(EdnSymbol.valueOf(text), run(matcher, text));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "", "1a", "/", "a/", "f123/123", "+#:123/#", "-1", ".5", "*a", "a//b", "a/1", "a/:b", ":a"
    })
    public void invalidSymbols(String text)
    {
        SymbolMatcher matcher = new SymbolMatcher(false);
        assertNull(run(matcher, text));
        assertNull(run(matcher, text));
    }

    @Test
    public void keywords()
    {
        SymbolMatcher matcher = new SymbolMatcher(true);
        assertEquals(EdnKeyword.valueOf("a"), run(matcher, ":a"));
        assertEquals(EdnKeyword.valueOf("ns/name"), run(matcher, ":ns/name"));
        assertNull(run(matcher, ":"));
        assertNull(run(matcher, "a"));
        assertNull(run(matcher, "::a"));
        assertNull(run(matcher, ":a/"));
    }

    @Test
    public void symbolFailsAtTheOffendingCharacter()
    {
        SymbolMatcher matcher = new SymbolMatcher(false);
        assertNull(run(matcher, "f123/123"));
        assertEquals(6, matcher.getFailColumn());
    }

    @Test
    public void numbers()
    {
        NumberMatcher matcher = new NumberMatcher();
        assertEquals(EdnInt.valueOf(0), run(matcher, "0"));
        assertEquals(EdnInt.valueOf(42), run(matcher, "+42"));
        assertEquals(EdnInt.valueOf(-42), run(matcher, "-42"));
        assertEquals(EdnFloat.valueOf(0.5), run(matcher, "0.5"));
        assertEquals(EdnFloat.valueOf(5e-1), run(matcher, "5e-1"));
        assertEquals(EdnFloat.valueOf(-1.25e2), run(matcher, "-1.25E+2"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "+", "-", "01", "1.", ".1", "1e", "1e-", "1.5.5", "1a", "0x10", "12N"})
    public void notNumbers(String text)
    {
        assertNull(run(new NumberMatcher(), text));
    }

    @Test
    public void numberLooksNumericOnceADigitIsSeen()
    {
        NumberMatcher matcher = new NumberMatcher();
        run(matcher, "-");
        assertFalse(matcher.looksNumeric());
        run(matcher, "-x");
        assertFalse(matcher.looksNumeric());
        run(matcher, "-1x");
        assertTrue(matcher.looksNumeric());
    }

    @Test
    public void numberOutOfRange()
    {
        NumberMatcher matcher = new NumberMatcher();
        EdnSyntaxException e =
            assertThrows(EdnSyntaxException.class, () -> run(matcher, "99999999999999999999"));
        assertEquals(EdnErrorCode.INVALID_NUMBER, e.getCode());
        e = assertThrows(EdnSyntaxException.class, () -> run(matcher, "-1e999"));
        assertEquals(EdnErrorCode.INVALID_NUMBER, e.getCode());
    }

    @Test
    public void unicodeCharacterBody()
    {
        UnicodeEscapeMatcher matcher = new UnicodeEscapeMatcher();
        assertEquals(EdnChar.valueOf('A'), run(matcher, "u0041"));
        assertEquals(EdnChar.valueOf(0xFFFF), run(matcher, "uffff"));
        assertNull(run(matcher, "u"));
        assertNull(run(matcher, "u004"));
        assertNull(run(matcher, "u00410"));
        assertNull(run(matcher, "x0041"));
        EdnSyntaxException e = assertThrows(EdnSyntaxException.class, () -> run(matcher, "uDC00"));
        assertEquals(EdnErrorCode.INVALID_UNICODE_CODE_POINT, e.getCode());
    }

    @Test
    public void singleCharacterBody()
    {
        SingleCharacterMatcher matcher = new SingleCharacterMatcher();
        assertEquals(EdnChar.valueOf('x'), run(matcher, "x"));
        assertNull(run(matcher, "xy"));
        assertNull(run(matcher, ""));
    }
}

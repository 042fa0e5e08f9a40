// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnBool;
import com.amazon.edn.EdnChar;
import com.amazon.edn.EdnErrorCode;
import com.amazon.edn.EdnFloat;
import com.amazon.edn.EdnInt;
import com.amazon.edn.EdnKeyword;
import com.amazon.edn.EdnNil;
import com.amazon.edn.EdnString;
import com.amazon.edn.EdnSymbol;
import com.amazon.edn.EdnValue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.io.StringReader;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EdnAtomRecognizerTest
{
    private EdnCursor         _cursor;
    private EdnAtomRecognizer _atoms;

    private EdnAtomRecognizer atoms(String text) throws IOException
    {
        _cursor = new EdnCursor(new StringReader(text));
        _cursor.advance();
        _atoms = new EdnAtomRecognizer(_cursor);
        return _atoms;
    }

    static Stream<Arguments> tokens()
    {
        return Stream.of(
            Arguments.of("nil", EdnNil.NIL),
            Arguments.of("true", EdnBool.TRUE),
            Arguments.of("false", EdnBool.FALSE),
            Arguments.of("+123", EdnInt.valueOf(123)),
            Arguments.of("0", EdnInt.valueOf(0)),
            Arguments.of("3.0", EdnFloat.valueOf(3.0)),
            Arguments.of("nilly", EdnSymbol.valueOf("nilly")),
            Arguments.of("ns/sym", EdnSymbol.valueOf("ns/sym")),
            Arguments.of(":nil", EdnKeyword.valueOf("nil")),
            Arguments.of("-", EdnSymbol.valueOf("-")),
            Arguments.of("-main", EdnSymbol.valueOf("-main"))
        );
    }

    @ParameterizedTest
    @MethodSource("tokens")
    public void classifyToken(String text, EdnValue expected) throws IOException
    {
        assertEquals(expected, atoms(text).readToken());
        assertEquals(EdnCursor.EOF, _cursor.current());
    }

    @Test
    public void tokenEndsAtDelimiter() throws IOException
    {
        EdnAtomRecognizer atoms = atoms("abc)def");
        assertEquals(EdnSymbol.valueOf("abc"), atoms.readToken());
        assertEquals(')', _cursor.current());
        assertEquals(4, _cursor.getColumn());
    }

    @Test
    public void tokenEndsAtQuoteAndBackslash() throws IOException
    {
        EdnAtomRecognizer atoms = atoms("12\"x\"");
        assertEquals(EdnInt.valueOf(12), atoms.readToken());
        assertEquals('"', _cursor.current());

        atoms = atoms("x\\y");
        assertEquals(EdnSymbol.valueOf("x"), atoms.readToken());
        assertEquals('\\', _cursor.current());
    }

    @Test
    public void tokenErrorReportsTheFurthestCandidate() throws IOException
    {
        EdnSyntaxException e = assertThrows(EdnSyntaxException.class, () -> atoms("ab/1").readToken());
        assertEquals(EdnErrorCode.INVALID_SYNTAX, e.getCode());
        assertEquals(4, e.toError().getColumn());

        e = assertThrows(EdnSyntaxException.class, () -> atoms("123x").readToken());
        assertEquals(EdnErrorCode.INVALID_NUMBER, e.getCode());
        assertEquals(4, e.toError().getColumn());
    }

    @Test
    public void namedCharacters() throws IOException
    {
        String[] names = { "newline", "return", "space", "tab", "backspace", "formfeed" };
        int[] chars = { '\n', '\r', ' ', '\t', '\b', '\f' };
        for (int ii = 0; ii < names.length; ii++) {
            assertEquals(EdnChar.valueOf(chars[ii]), atoms("\\" + names[ii]).readCharacter());
        }
    }

    @Test
    public void characterLiteralStopsAtDelimiter() throws IOException
    {
        EdnAtomRecognizer atoms = atoms("\\x]");
        assertEquals(EdnChar.valueOf('x'), atoms.readCharacter());
        assertEquals(']', _cursor.current());

        atoms = atoms("\\]]");
        assertEquals(EdnChar.valueOf(']'), atoms.readCharacter());
        assertEquals(']', _cursor.current());
        assertEquals(3, _cursor.getColumn());
    }

    @Test
    public void tagName() throws IOException
    {
        EdnAtomRecognizer atoms = atoms("inst \"x\"");
        assertEquals("inst", atoms.readTagName());
        assertEquals(' ', _cursor.current());

        assertThrows(EdnSyntaxException.class, () -> atoms("a/ 1").readTagName());
    }

    @Test
    public void symbolicValues() throws IOException
    {
        assertEquals(EdnFloat.valueOf(Double.NaN), atoms("NaN").readSymbolicValue());
        assertEquals(EdnFloat.valueOf(Double.NEGATIVE_INFINITY), atoms("-Inf").readSymbolicValue());
        assertThrows(EdnSyntaxException.class, () -> atoms("Infinity").readSymbolicValue());
        assertThrows(EdnSyntaxException.class, () -> atoms("").readSymbolicValue());
    }

    @Test
    public void stringConsumesClosingQuote() throws IOException
    {
        EdnAtomRecognizer atoms = atoms("\"a b\"c");
        assertEquals(EdnString.valueOf("a b"), atoms.readString());
        assertEquals('c', _cursor.current());
    }

    @Test
    public void stringEscapes() throws IOException
    {
        assertEquals(EdnString.valueOf("\t\r\n\b\f\\\""),
                     atoms("\"\\t\\r\\n\\b\\f\\\\\\\"\"").readString());
        assertEquals(EdnString.valueOf(""), atoms("\"\"").readString());
    }

    @Test
    public void stringErrorPositions() throws IOException
    {
        EdnSyntaxException e = assertThrows(EdnSyntaxException.class, () -> atoms("\"ab\\x\"").readString());
        assertEquals(EdnErrorCode.INVALID_ESCAPE, e.getCode());
        assertEquals(5, e.toError().getColumn());

        e = assertThrows(EdnSyntaxException.class, () -> atoms("\"a\nbc").readString());
        assertEquals(EdnErrorCode.EOF_WHILE_PARSING_STRING, e.getCode());
        assertEquals(2, e.toError().getLine());
        assertEquals(2, e.toError().getColumn());
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EdnCursorTest
{
    private static EdnCursor cursor(String text)
    {
        return new EdnCursor(new StringReader(text));
    }

    @Test
    public void emptySourceIsEndOfStream() throws IOException
    {
        EdnCursor cursor = cursor("");
        assertEquals(EdnCursor.EOF, cursor.current());
        assertFalse(cursor.advance());
        assertTrue(cursor.isEof());
        assertFalse(cursor.advance());
        assertEquals(EdnCursor.EOF, cursor.current());
        assertEquals(1, cursor.getLineNumber());
        assertEquals(0, cursor.getColumn());
        assertEquals(0, cursor.getConsumedCount());
    }

    @Test
    public void columnsCountFromOne() throws IOException
    {
        EdnCursor cursor = cursor("ab");
        assertTrue(cursor.advance());
        assertEquals('a', cursor.current());
        assertEquals(1, cursor.getColumn());
        assertTrue(cursor.advance());
        assertEquals('b', cursor.current());
        assertEquals(2, cursor.getColumn());
        assertFalse(cursor.advance());
        assertEquals(2, cursor.getColumn());
        assertEquals(2, cursor.getConsumedCount());
    }

    @Test
    public void newlineStartsTheNextLine() throws IOException
    {
        EdnCursor cursor = cursor("a\nb\r\nc");
        cursor.advance();
        cursor.advance();
        assertEquals('\n', cursor.current());
        assertEquals(2, cursor.getLineNumber());
        assertEquals(0, cursor.getColumn());
        cursor.advance();
        assertEquals('b', cursor.current());
        assertEquals(1, cursor.getColumn());
        cursor.advance();
        assertEquals('\r', cursor.current());
        assertEquals(2, cursor.getLineNumber());
        assertEquals(2, cursor.getColumn());
        cursor.advance();
        cursor.advance();
        assertEquals('c', cursor.current());
        assertEquals(3, cursor.getLineNumber());
        assertEquals(1, cursor.getColumn());
    }

    @Test
    public void surrogatePairIsOneCodePoint() throws IOException
    {
        String smile = new String(Character.toChars(0x1F600));
        EdnCursor cursor = cursor(smile + "x");
        cursor.advance();
        assertEquals(0x1F600, cursor.current());
        assertEquals(1, cursor.getColumn());
        cursor.advance();
        assertEquals('x', cursor.current());
        assertEquals(2, cursor.getColumn());
    }

    @Test
    public void unpairedHighSurrogateFails() throws IOException
    {
        EdnCursor cursor = cursor("a" + '\uD800' + "b");
        cursor.advance();
        assertThrows(IOException.class, cursor::advance);
    }

    @Test
    public void loneLowSurrogateFails() throws IOException
    {
        EdnCursor cursor = cursor("\\" + '\uDC00');
        cursor.advance();
        assertEquals('\\', cursor.current());
        assertThrows(IOException.class, cursor::advance);
    }

    @Test
    public void nullSourceIsRejected()
    {
        assertThrows(NullPointerException.class, () -> new EdnCursor(null));
    }
}

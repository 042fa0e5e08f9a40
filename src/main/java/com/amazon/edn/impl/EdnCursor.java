// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * Wraps a {@link Reader} and holds exactly one code point of lookahead,
 * tracking the line and column of that lookahead.
 * <p>
 * Unlike {@code java.io.PushbackReader} there is no unread: once
 * {@link #advance()} is called the previous character is gone. UTF-16
 * surrogate pairs are combined into a single code point.
 * <p>
 * A newline moves the position to the next line at column 0, so the first
 * character after it is at column 1. Carriage returns are ordinary
 * characters. Reaching the end of the stream does not move the position.
 */
final class EdnCursor
    implements Closeable
{
    /** The value of {@link #current()} once the source is exhausted. */
    static final int EOF = -1;

    private final Reader in;

    private int  current;
    private long line;
    private long column;
    private long consumed;

    /**
     * Creates a cursor positioned before the first character; call
     * {@link #advance()} to load it.
     */
    EdnCursor(Reader in)
    {
        if (in == null) throw new NullPointerException("in");
        this.in = in;
        this.current = EOF;
        this.line = 1;
        this.column = 0;
    }

    /**
     * Reads the next code point and makes it current.
     *
     * @return false if the source is exhausted.
     */
    boolean advance() throws IOException
    {
        int c = in.read();
        if (c == EOF) {
            current = EOF;
            return false;
        }
        if (Character.isHighSurrogate((char) c)) {
            int low = in.read();
            if (low == EOF || !Character.isLowSurrogate((char) low)) {
                throw new IOException("Unpaired high surrogate in character source");
            }
            c = Character.toCodePoint((char) c, (char) low);
        }
        else if (Character.isLowSurrogate((char) c)) {
            throw new IOException("Unpaired low surrogate in character source");
        }

        if (c == '\n') {
            line++;
            column = 0;
        }
        else {
            column++;
        }
        consumed++;
        current = c;
        return true;
    }

    /**
     * @return the lookahead code point, or {@link #EOF}.
     */
    int current()
    {
        return current;
    }

    boolean isEof()
    {
        return current == EOF;
    }

    /**
     * @return the 1-based line of the current character.
     */
    long getLineNumber()
    {
        return line;
    }

    /**
     * @return the column of the current character within its line. Columns
     * start at 1, but a newline itself sits at column 0 of the line it
     * begins.
     */
    long getColumn()
    {
        return column;
    }

    /**
     * @return the number of code points read so far, including the current
     *  one.
     */
    long getConsumedCount()
    {
        return consumed;
    }

    public void close() throws IOException
    {
        in.close();
    }
}

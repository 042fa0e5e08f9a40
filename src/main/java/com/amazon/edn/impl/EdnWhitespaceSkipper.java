// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.util.EdnTextUtils;
import java.io.IOException;

/**
 * Consumes runs of whitespace, commas and {@code ;} line comments from an
 * {@link EdnCursor}.
 */
final class EdnWhitespaceSkipper
{
    private final EdnCursor     _cursor;
    private final boolean       _comments_enabled;
    private final StringBuilder _span = new StringBuilder();
    private boolean             _saw_comma;

    EdnWhitespaceSkipper(EdnCursor cursor, boolean commentsEnabled)
    {
        _cursor = cursor;
        _comments_enabled = commentsEnabled;
    }

    /**
     * Consumes the maximal run of separators starting at the current
     * character. Stops at the first other character or at end of stream.
     *
     * @return the consumed text, or null if nothing was consumed.
     */
    CharSequence skip() throws IOException
    {
        _span.setLength(0);
        _saw_comma = false;

        for (;;) {
            int c = _cursor.current();
            if (EdnTextUtils.isWhitespace(c)) {
                if (c == ',') _saw_comma = true;
                _span.appendCodePoint(c);
                _cursor.advance();
            }
            else if (c == ';' && _comments_enabled) {
                skip_comment();
            }
            else {
                break;
            }
        }
        return (_span.length() == 0) ? null : _span.toString();
    }

    // the terminating newline is left for the outer loop
    private void skip_comment() throws IOException
    {
        int c = _cursor.current();
        while (c != '\n' && c != EdnCursor.EOF) {
            _span.appendCodePoint(c);
            _cursor.advance();
            c = _cursor.current();
        }
    }

    /**
     * @return true if the run consumed by the last {@link #skip()} contained
     *  a comma outside of any comment.
     */
    boolean sawComma()
    {
        return _saw_comma;
    }
}

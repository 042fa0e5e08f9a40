// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import static com.amazon.edn.util.EdnTextUtils.isTokenConstituent;
import static com.amazon.edn.util.EdnTextUtils.printCodePointAsString;

import com.amazon.edn.EdnBool;
import com.amazon.edn.EdnChar;
import com.amazon.edn.EdnErrorCode;
import com.amazon.edn.EdnFloat;
import com.amazon.edn.EdnNil;
import com.amazon.edn.EdnString;
import com.amazon.edn.EdnValue;
import com.amazon.edn.util.EdnTextUtils;
import java.io.IOException;

/**
 * Reads one scalar literal starting at the current character of an
 * {@link EdnCursor}.
 * <p>
 * Bare tokens (nil, booleans, numbers, symbols, keywords) and the bodies of
 * character literals are classified by running several
 * {@link CandidateMatcher}s over the same characters in a single pass.
 * The scan stops at the first character that cannot continue a token, or as
 * soon as every candidate has rejected the input; that character is left
 * as the cursor's current one. Strings are read directly.
 * <p>
 * Errors are thrown as {@link EdnSyntaxException}s carrying the position of
 * the character that exposed them.
 */
final class EdnAtomRecognizer
{
    private final EdnCursor     _cursor;
    private final StringBuilder _text = new StringBuilder();

    // earlier entries win when more than one candidate accepts the token
    private final NumberMatcher      _number_matcher = new NumberMatcher();
    private final CandidateMatcher[] _token_candidates;
    private final CandidateMatcher[] _character_candidates;
    private final CandidateMatcher[] _symbolic_candidates;
    private final CandidateMatcher[] _tag_candidates;

    EdnAtomRecognizer(EdnCursor cursor)
    {
        _cursor = cursor;

        _token_candidates = new CandidateMatcher[] {
            new LiteralMatcher("nil",   EdnNil.NIL),
            new LiteralMatcher("true",  EdnBool.TRUE),
            new LiteralMatcher("false", EdnBool.FALSE),
            _number_matcher,
            new SymbolMatcher(false),
            new SymbolMatcher(true),
        };

        String[] names = EdnTextUtils.characterNames();
        _character_candidates = new CandidateMatcher[names.length + 2];
        for (int ii = 0; ii < names.length; ii++) {
            _character_candidates[ii] =
                new LiteralMatcher(names[ii], EdnChar.valueOf(EdnTextUtils.namedCharacter(ii)));
        }
        _character_candidates[names.length] = new UnicodeEscapeMatcher();
        _character_candidates[names.length + 1] = new SingleCharacterMatcher();

        _symbolic_candidates = new CandidateMatcher[] {
            new LiteralMatcher("Inf",  EdnFloat.valueOf(Double.POSITIVE_INFINITY)),
            new LiteralMatcher("-Inf", EdnFloat.valueOf(Double.NEGATIVE_INFINITY)),
            new LiteralMatcher("NaN",  EdnFloat.valueOf(Double.NaN)),
        };

        _tag_candidates = new CandidateMatcher[] {
            new SymbolMatcher(false),
        };
    }


    /**
     * Reads a bare token: {@code nil}, {@code true}, {@code false}, a number,
     * a symbol or a keyword. The current character must be a token
     * constituent.
     */
    EdnValue readToken() throws IOException
    {
        EdnValue value = scan(_token_candidates);
        if (value == null) {
            EdnErrorCode code = _number_matcher.looksNumeric()
                ? EdnErrorCode.INVALID_NUMBER
                : EdnErrorCode.INVALID_SYNTAX;
            throw token_error(code, _token_candidates, "Invalid token");
        }
        return value;
    }

    /**
     * Reads a character literal. The current character must be the
     * backslash.
     */
    EdnChar readCharacter() throws IOException
    {
        assert _cursor.current() == '\\';
        _cursor.advance();

        int c = _cursor.current();
        if (c == EdnCursor.EOF) {
            throw error(EdnErrorCode.EOF_WHILE_PARSING_VALUE,
                        "Unexpected end of input in character literal");
        }
        if (!isTokenConstituent(c)) {
            // punctuation and whitespace stand for themselves
            _cursor.advance();
            return EdnChar.valueOf(c);
        }

        EdnValue value = scan(_character_candidates);
        if (value == null) {
            throw token_error(EdnErrorCode.INVALID_SYNTAX, _character_candidates,
                              "Invalid character literal");
        }
        return (EdnChar) value;
    }

    /**
     * Reads the name of a tag. The current character must be the first
     * character of the name, after the {@code #}.
     */
    String readTagName() throws IOException
    {
        EdnValue value = scan(_tag_candidates);
        if (value == null) {
            throw token_error(EdnErrorCode.INVALID_SYNTAX, _tag_candidates, "Invalid tag");
        }
        return _text.toString();
    }

    /**
     * Reads {@code Inf}, {@code -Inf} or {@code NaN} after a {@code ##}.
     */
    EdnFloat readSymbolicValue() throws IOException
    {
        if (!isTokenConstituent(_cursor.current())) {
            throw error(EdnErrorCode.INVALID_SYNTAX, "Expected a symbolic value after ##");
        }
        EdnValue value = scan(_symbolic_candidates);
        if (value == null) {
            throw token_error(EdnErrorCode.INVALID_SYNTAX, _symbolic_candidates,
                              "Unknown symbolic value");
        }
        return (EdnFloat) value;
    }

    /**
     * Runs the candidates over the token at the cursor.
     *
     * @return the value of the first candidate, in array order, that
     *  accepts the whole token; null if none does.
     */
    private EdnValue scan(CandidateMatcher[] candidates) throws IOException
    {
        _text.setLength(0);
        for (CandidateMatcher candidate : candidates) {
            candidate.reset();
        }

        for (;;) {
            int c = _cursor.current();
            if (!isTokenConstituent(c)) break;

            long line = _cursor.getLineNumber();
            long column = _cursor.getColumn();
            boolean alive = false;
            for (CandidateMatcher candidate : candidates) {
                candidate.offer(c, line, column);
                alive |= !candidate.isDead();
            }
            if (!alive) break;

            _text.appendCodePoint(c);
            _cursor.advance();
        }

        for (CandidateMatcher candidate : candidates) {
            EdnValue value = candidate.finish(_text);
            if (value != null) return value;
        }
        return null;
    }

    /**
     * Builds the error for a token no candidate accepted, positioned at the
     * character that defeated the candidate which got furthest.
     */
    private EdnSyntaxException token_error(EdnErrorCode code,
                                           CandidateMatcher[] candidates,
                                           String message)
    {
        CandidateMatcher furthest = null;
        for (CandidateMatcher candidate : candidates) {
            if (candidate.getLength() == 0) continue;
            if (furthest == null || candidate.getLength() > furthest.getLength()) {
                furthest = candidate;
            }
        }
        if (furthest == null) {
            return error(code, message + " starting with " + printCodePointAsString(_cursor.current()));
        }
        return new EdnSyntaxException(code, furthest.getFailLine(), furthest.getFailColumn(),
                                      message + ": " + _text);
    }


    //=========================================================================
    // strings

    /**
     * Reads a double-quoted string. The current character must be the
     * opening quote; the closing quote is consumed.
     */
    EdnString readString() throws IOException
    {
        assert _cursor.current() == '"';
        _cursor.advance();
        _text.setLength(0);

        for (;;) {
            int c = _cursor.current();
            switch (c) {
            case EdnCursor.EOF:
                throw error(EdnErrorCode.EOF_WHILE_PARSING_STRING,
                            "Unexpected end of input in string");
            case '"':
                _cursor.advance();
                return EdnString.valueOf(_text.toString());
            case '\\':
                _cursor.advance();
                read_escape();
                break;
            default:
                _text.appendCodePoint(c);
                _cursor.advance();
                break;
            }
        }
    }

    // the cursor is on the character after the backslash
    private void read_escape() throws IOException
    {
        int c = _cursor.current();
        switch (c) {
        case EdnCursor.EOF:
            throw error(EdnErrorCode.UNTERMINATED_STRING,
                        "Unexpected end of input in escape sequence");
        case 't':  _text.append('\t'); break;
        case 'r':  _text.append('\r'); break;
        case 'n':  _text.append('\n'); break;
        case 'b':  _text.append('\b'); break;
        case 'f':  _text.append('\f'); break;
        case '\\': _text.append('\\'); break;
        case '"':  _text.append('"');  break;
        case 'u':
            read_unicode_escape();
            return;
        default:
            throw error(EdnErrorCode.INVALID_ESCAPE,
                        "Invalid escape sequence \\" + new String(Character.toChars(c)));
        }
        _cursor.advance();
    }

    // the cursor is on the 'u'; consumes the four hex digits and, for a high
    // surrogate, the escape of its low surrogate
    private void read_unicode_escape() throws IOException
    {
        long line = _cursor.getLineNumber();
        long column = _cursor.getColumn();
        int unit = read_hex_escape_sequence_value();

        if (Character.isLowSurrogate((char) unit)) {
            throw new EdnSyntaxException(EdnErrorCode.INVALID_UNICODE_CODE_POINT, line, column,
                                         "Lone trailing surrogate in escape sequence");
        }
        if (Character.isHighSurrogate((char) unit)) {
            if (_cursor.current() != '\\') {
                throw error(EdnErrorCode.INVALID_UNICODE_CODE_POINT,
                            "Lone leading surrogate in escape sequence");
            }
            _cursor.advance();
            if (_cursor.current() != 'u') {
                throw error(EdnErrorCode.INVALID_UNICODE_CODE_POINT,
                            "Lone leading surrogate in escape sequence");
            }
            int low = read_hex_escape_sequence_value();
            if (!Character.isLowSurrogate((char) low)) {
                throw new EdnSyntaxException(EdnErrorCode.INVALID_UNICODE_CODE_POINT, line, column,
                                             "Lone leading surrogate in escape sequence");
            }
            _text.append((char) unit).append((char) low);
            return;
        }
        _text.append((char) unit);
    }

    // the cursor is on the 'u'
    private int read_hex_escape_sequence_value() throws IOException
    {
        int hexchar = 0;
        for (int len = 0; len < 4; len++) {
            _cursor.advance();
            int c = _cursor.current();
            if (c == EdnCursor.EOF) {
                throw error(EdnErrorCode.EOF_WHILE_PARSING_STRING,
                            "Unexpected end of input in unicode escape");
            }
            int d = EdnTextUtils.hexDigitValue(c);
            if (d < 0) {
                throw error(EdnErrorCode.INVALID_ESCAPE,
                            "Invalid hex digit " + printCodePointAsString(c) + " in unicode escape");
            }
            hexchar = (hexchar << 4) + d;
        }
        _cursor.advance();
        return hexchar;
    }

    private EdnSyntaxException error(EdnErrorCode code, String message)
    {
        return new EdnSyntaxException(code, _cursor.getLineNumber(), _cursor.getColumn(), message);
    }
}

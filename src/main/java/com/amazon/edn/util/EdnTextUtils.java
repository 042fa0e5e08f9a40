// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.util;

/**
 * Utility methods for working with edn text: character classification used
 * by the reader, and escaping used when values are rendered for display.
 */
public final class EdnTextUtils
{
    private EdnTextUtils() { }


    private static final boolean[] GENERAL_SPECIAL_CHAR_FLAGS;
    private static final boolean[] EXTENDED_SPECIAL_CHAR_FLAGS;
    private static final boolean[] LEADING_SPECIAL_CHAR_FLAGS;
    static
    {
        final char[] generalChars = {
            '.', '*', '+', '!', '-', '_', '?', '$', '%', '&', '=', '<', '>', '/'
        };

        GENERAL_SPECIAL_CHAR_FLAGS  = new boolean[128];
        EXTENDED_SPECIAL_CHAR_FLAGS = new boolean[128];
        LEADING_SPECIAL_CHAR_FLAGS  = new boolean[128];

        for (int ii=0; ii<generalChars.length; ii++) {
            GENERAL_SPECIAL_CHAR_FLAGS[generalChars[ii]] = true;
        }
        EXTENDED_SPECIAL_CHAR_FLAGS['#'] = true;
        EXTENDED_SPECIAL_CHAR_FLAGS[':'] = true;

        LEADING_SPECIAL_CHAR_FLAGS['+'] = true;
        LEADING_SPECIAL_CHAR_FLAGS['-'] = true;
        LEADING_SPECIAL_CHAR_FLAGS['.'] = true;
    }

    private static boolean is7bitValue(int codePoint)
    {
        return (codePoint & ~0x7f) == 0;
    }


    /**
     * Determines whether a code point separates edn elements. The comma is
     * whitespace in edn.
     *
     * @param codePoint a Unicode code point, or -1 for end of stream.
     */
    public static boolean isWhitespace(int codePoint)
    {
        switch (codePoint)
        {
            case ' ':  case '\t':  case '\n':  case '\r':  case '\f':  case ',':
            {
                return true;
            }
            default:
            {
                return false;
            }
        }
    }

    public static boolean isClosingDelimiter(int codePoint)
    {
        return codePoint == ')' || codePoint == ']' || codePoint == '}';
    }

    /**
     * The characters {@code . * + ! - _ ? $ % & = < > /}.
     */
    public static boolean isGeneralSpecial(int codePoint)
    {
        return is7bitValue(codePoint) && GENERAL_SPECIAL_CHAR_FLAGS[codePoint];
    }

    /**
     * The characters {@code #} and {@code :}.
     */
    public static boolean isExtendedSpecial(int codePoint)
    {
        return is7bitValue(codePoint) && EXTENDED_SPECIAL_CHAR_FLAGS[codePoint];
    }

    /**
     * The characters {@code + - .}, which may begin a symbol.
     */
    public static boolean isLeadingSpecial(int codePoint)
    {
        return is7bitValue(codePoint) && LEADING_SPECIAL_CHAR_FLAGS[codePoint];
    }

    public static boolean isAlphabetic(int codePoint)
    {
        return codePoint >= 0 && Character.isLetter(codePoint);
    }

    public static boolean isAlphanumeric(int codePoint)
    {
        return codePoint >= 0 && Character.isLetterOrDigit(codePoint);
    }

    public static boolean isDigit(int codePoint)
    {
        return codePoint >= '0' && codePoint <= '9';
    }

    /**
     * Determines whether a code point can appear inside a bare token (symbol,
     * keyword, number or literal). Any other character ends the token.
     */
    public static boolean isTokenConstituent(int codePoint)
    {
        return isAlphanumeric(codePoint)
            || isGeneralSpecial(codePoint)
            || isExtendedSpecial(codePoint);
    }

    /**
     * @return the value of a hexadecimal digit, or -1 if {@code codePoint}
     *  is not one.
     */
    public static int hexDigitValue(int codePoint)
    {
        if (codePoint >= '0' && codePoint <= '9') return codePoint - '0';
        if (codePoint >= 'a' && codePoint <= 'f') return codePoint - 'a' + 10;
        if (codePoint >= 'A' && codePoint <= 'F') return codePoint - 'A' + 10;
        return -1;
    }


    //=========================================================================

    private static final String[] CHARACTER_NAMES = {
        "newline", "return", "space", "tab", "backspace", "formfeed"
    };
    private static final int[] NAMED_CHARACTERS = {
        '\n', '\r', ' ', '\t', '\b', '\f'
    };

    /**
     * Gets the names that may follow a backslash in a character literal.
     *
     * @return a new array, in the same order as {@link #namedCharacter(int)}.
     */
    public static String[] characterNames()
    {
        return CHARACTER_NAMES.clone();
    }

    /**
     * @param index an index into {@link #characterNames()}.
     * @return the code point the name at {@code index} stands for.
     */
    public static int namedCharacter(int index)
    {
        return NAMED_CHARACTERS[index];
    }

    /**
     * @return the character literal name of {@code codePoint}, such as
     *  {@code newline}; null if it has none.
     */
    public static String characterName(int codePoint)
    {
        for (int ii = 0; ii < NAMED_CHARACTERS.length; ii++) {
            if (NAMED_CHARACTERS[ii] == codePoint) return CHARACTER_NAMES[ii];
        }
        return null;
    }


    //=========================================================================

    /**
     * Prints the text as a double-quoted edn string, escaping quotes,
     * backslashes and control characters.
     */
    public static void printString(StringBuilder out, CharSequence text)
    {
        out.append('"');
        for (int ii = 0; ii < text.length(); ii++) {
            printStringCodePoint(out, text.charAt(ii));
        }
        out.append('"');
    }

    /**
     * Prints a single code point for use inside an edn string.
     */
    public static void printStringCodePoint(StringBuilder out, int c)
    {
        switch (c) {
            case '\t':
                out.append("\\t");
                return;
            case '\n':
                out.append("\\n");
                return;
            case '\r':
                out.append("\\r");
                return;
            case '\f':
                out.append("\\f");
                return;
            case '\b':
                out.append("\\b");
                return;
            case '"':
                out.append("\\\"");
                return;
            case '\\':
                out.append("\\\\");
                return;
            default:
                break;
        }

        if (c < 0x20) {
            out.append("\\u");
            String hex = Integer.toHexString(c);
            for (int pad = hex.length(); pad < 4; pad++) {
                out.append('0');
            }
            out.append(hex);
        }
        else {
            out.appendCodePoint(c);
        }
    }

    /**
     * Renders a code point for an error message, quoted and escaped. End of
     * stream (-1) renders as {@code <EOF>}.
     */
    public static String printCodePointAsString(int codePoint)
    {
        if (codePoint < 0) {
            return "<EOF>";
        }
        StringBuilder builder = new StringBuilder(12);
        builder.append('"');
        printStringCodePoint(builder, codePoint);
        builder.append('"');
        return builder.toString();
    }
}

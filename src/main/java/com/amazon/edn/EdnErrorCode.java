// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * The reasons an edn event stream can end in error.
 */
public enum EdnErrorCode
{
    INVALID_SYNTAX,
    INVALID_NUMBER,
    INVALID_ESCAPE,
    INVALID_UNICODE_CODE_POINT,
    /** The input ended immediately after a backslash inside a string. */
    UNTERMINATED_STRING,
    /** The input ended inside a map. */
    EOF_WHILE_PARSING_OBJECT,
    /** The input ended inside a vector. */
    EOF_WHILE_PARSING_ARRAY,
    EOF_WHILE_PARSING_LIST,
    EOF_WHILE_PARSING_SET,
    EOF_WHILE_PARSING_VALUE,
    EOF_WHILE_PARSING_STRING,
    KEY_MUST_BE_A_VALUE,
    EXPECTED_SEPARATOR,
    /** A map closed after a key with no value. */
    MISSING_MAP_VALUE,
    TRAILING_CHARACTERS,
    TRAILING_COMMA,
    IO_ERROR;


    /**
     * Gets the code reported when the input ends inside a collection of the
     * given type.
     *
     * @param containerType must be a container type.
     */
    public static EdnErrorCode eofInside(EdnType containerType)
    {
        switch (containerType)
        {
            case LIST:   return EOF_WHILE_PARSING_LIST;
            case VECTOR: return EOF_WHILE_PARSING_ARRAY;
            case SET:    return EOF_WHILE_PARSING_SET;
            case MAP:    return EOF_WHILE_PARSING_OBJECT;
            default:
                throw new IllegalArgumentException("not a container: " + containerType);
        }
    }
}

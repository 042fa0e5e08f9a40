// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * Enumeration of the edn data types.
 * <p>
 * Every {@link EdnValue} reports exactly one of these from
 * {@link EdnValue#getType()}, so consumers can switch over the full set of
 * variants.
 */
public enum EdnType
{
    NIL,
    BOOL,
    STRING,
    CHAR,
    SYMBOL,
    KEYWORD,
    INT,
    FLOAT,
    TAG,
    LIST,
    VECTOR,
    SET,
    MAP;


    /**
     * Determines whether a type represents an edn collection.
     *
     * @param t may be null.
     *
     * @return true when {@code t} is {@link #LIST}, {@link #VECTOR},
     * {@link #SET}, or {@link #MAP}.
     */
    public static boolean isContainer(EdnType t)
    {
        return (t != null && (t.ordinal() >= LIST.ordinal()));
    }

    /**
     * Determines whether a type represents an edn text scalar, namely
     * {@link #STRING}, {@link #SYMBOL} or {@link #KEYWORD}.
     *
     * @param t may be null.
     */
    public static boolean isText(EdnType t)
    {
        return (t == STRING) || (t == SYMBOL) || (t == KEYWORD);
    }

    /**
     * Determines whether a type represents a numeric scalar, namely
     * {@link #INT} or {@link #FLOAT}.
     *
     * @param t may be null.
     */
    public static boolean isNumeric(EdnType t)
    {
        return (t == INT) || (t == FLOAT);
    }
}

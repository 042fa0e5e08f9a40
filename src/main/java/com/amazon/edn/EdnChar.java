// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import com.amazon.edn.util.EdnTextUtils;

/**
 * An edn character literal, holding a single Unicode code point.
 */
public final class EdnChar
    extends EdnValue
{
    private final int codePoint;

    private EdnChar(int codePoint)
    {
        this.codePoint = codePoint;
    }

    /**
     * @param codePoint a valid Unicode code point that is not a surrogate.
     *
     * @throws IllegalArgumentException if {@code codePoint} is not a valid
     *  scalar value.
     */
    public static EdnChar valueOf(int codePoint)
    {
        if (!Character.isValidCodePoint(codePoint)
            || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE))
        {
            throw new IllegalArgumentException("Invalid code point: " + codePoint);
        }
        return new EdnChar(codePoint);
    }

    public int codePointValue()
    {
        return codePoint;
    }

    @Override
    public EdnType getType()
    {
        return EdnType.CHAR;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append('\\');
        String name = EdnTextUtils.characterName(codePoint);
        if (name != null) {
            out.append(name);
        }
        else {
            out.appendCodePoint(codePoint);
        }
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnChar && ((EdnChar) other).codePoint == codePoint;
    }

    @Override
    public int hashCode()
    {
        return codePoint;
    }
}

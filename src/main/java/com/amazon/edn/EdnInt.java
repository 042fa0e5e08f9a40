// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * An edn integer, limited to the range of a signed 64-bit {@code long}.
 */
public final class EdnInt
    extends EdnValue
{
    private final long value;

    private EdnInt(long value)
    {
        this.value = value;
    }

    public static EdnInt valueOf(long value)
    {
        return new EdnInt(value);
    }

    public long longValue()
    {
        return value;
    }

    @Override
    public EdnType getType()
    {
        return EdnType.INT;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append(value);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnInt && ((EdnInt) other).value == value;
    }

    @Override
    public int hashCode()
    {
        return Long.hashCode(value);
    }
}

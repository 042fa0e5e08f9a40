// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * An edn {@code true} or {@code false}.
 */
public final class EdnBool
    extends EdnValue
{
    public static final EdnBool TRUE  = new EdnBool(true);
    public static final EdnBool FALSE = new EdnBool(false);

    private final boolean value;

    private EdnBool(boolean value)
    {
        this.value = value;
    }

    public static EdnBool valueOf(boolean value)
    {
        return value ? TRUE : FALSE;
    }

    public boolean booleanValue()
    {
        return value;
    }

    @Override
    public EdnType getType()
    {
        return EdnType.BOOL;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append(value);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnBool && ((EdnBool) other).value == value;
    }

    @Override
    public int hashCode()
    {
        return Boolean.hashCode(value);
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import com.amazon.edn.util.EdnTextUtils;

/**
 * An edn string.
 */
public final class EdnString
    extends EdnValue
{
    private final String value;

    private EdnString(String value)
    {
        this.value = value;
    }

    /**
     * @param value must not be null.
     */
    public static EdnString valueOf(String value)
    {
        if (value == null) throw new NullPointerException("value");
        return new EdnString(value);
    }

    public String stringValue()
    {
        return value;
    }

    @Override
    public EdnType getType()
    {
        return EdnType.STRING;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        EdnTextUtils.printString(out, value);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnString && ((EdnString) other).value.equals(value);
    }

    @Override
    public int hashCode()
    {
        return value.hashCode();
    }
}

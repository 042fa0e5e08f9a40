// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * The edn {@code nil} value.
 */
public final class EdnNil
    extends EdnValue
{
    public static final EdnNil NIL = new EdnNil();

    private EdnNil()
    {
    }

    @Override
    public EdnType getType()
    {
        return EdnType.NIL;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append("nil");
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnNil;
    }

    @Override
    public int hashCode()
    {
        return 0x6e696c;
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * An edn floating point number, held as a 64-bit {@code double}.
 * <p>
 * Equality compares bit patterns, so {@code ##NaN} equals itself and
 * {@code 0.0} differs from {@code -0.0}.
 */
public final class EdnFloat
    extends EdnValue
{
    private final double value;

    private EdnFloat(double value)
    {
        this.value = value;
    }

    public static EdnFloat valueOf(double value)
    {
        return new EdnFloat(value);
    }

    public double doubleValue()
    {
        return value;
    }

    @Override
    public EdnType getType()
    {
        return EdnType.FLOAT;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        if (Double.isNaN(value)) {
            out.append("##NaN");
        }
        else if (value == Double.POSITIVE_INFINITY) {
            out.append("##Inf");
        }
        else if (value == Double.NEGATIVE_INFINITY) {
            out.append("##-Inf");
        }
        else {
            out.append(value);
        }
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnFloat
            && Double.doubleToLongBits(((EdnFloat) other).value) == Double.doubleToLongBits(value);
    }

    @Override
    public int hashCode()
    {
        return Double.hashCode(value);
    }
}

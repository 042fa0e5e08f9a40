// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * Base type for all edn data nodes.
 * <p>
 * The set of subclasses is closed: the only constructor is package-private
 * and every variant is a final class in this package. Use {@link #getType()}
 * to switch over the variant rather than {@code instanceof} chains.
 * <p>
 * Instances are immutable once created. Collections own their elements and
 * no value holds a reference to the collection containing it.
 *
 * @see EdnType
 */
public abstract class EdnValue
{
    EdnValue()
    {
    }

    /**
     * Gets an enumerated type identifier indicating the variant of this
     * value.
     *
     * @return the variant of this value; not null.
     */
    public abstract EdnType getType();

    /**
     * Appends the edn text of this value to {@code out}.
     */
    abstract void appendTo(StringBuilder out);

    /**
     * Renders this value as edn text. The output is intended for diagnostics
     * and test messages.
     */
    @Override
    public String toString()
    {
        StringBuilder out = new StringBuilder();
        appendTo(out);
        return out.toString();
    }
}

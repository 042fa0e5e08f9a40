// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * An edn symbol such as {@code foo} or {@code my.ns/bar}.
 */
public final class EdnSymbol
    extends EdnValue
{
    private final String text;

    private EdnSymbol(String text)
    {
        this.text = text;
    }

    /**
     * @param text must not be null or empty.
     */
    public static EdnSymbol valueOf(String text)
    {
        if (text == null) throw new NullPointerException("text");
        if (text.isEmpty()) throw new IllegalArgumentException("empty symbol");
        return new EdnSymbol(text);
    }

    public String getText()
    {
        return text;
    }

    /**
     * Gets the namespace prefix, the text before the first {@code /}.
     *
     * @return null if this symbol has no namespace.
     */
    public String getNamespace()
    {
        int slash = text.indexOf('/');
        return (slash > 0) ? text.substring(0, slash) : null;
    }

    /**
     * Gets the text after the namespace separator, or the whole text when
     * there is no namespace.
     */
    public String getName()
    {
        int slash = text.indexOf('/');
        return (slash > 0) ? text.substring(slash + 1) : text;
    }

    @Override
    public EdnType getType()
    {
        return EdnType.SYMBOL;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append(text);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnSymbol && ((EdnSymbol) other).text.equals(text);
    }

    @Override
    public int hashCode()
    {
        return 31 * text.hashCode() + EdnType.SYMBOL.ordinal();
    }
}

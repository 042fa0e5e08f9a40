// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * An edn keyword such as {@code :foo} or {@code :my.ns/bar}.
 * <p>
 * The text of a keyword does not include the leading {@code :} sigil.
 */
public final class EdnKeyword
    extends EdnValue
{
    private final String text;

    private EdnKeyword(String text)
    {
        this.text = text;
    }

    /**
     * @param text must not be null or empty.
     */
    public static EdnKeyword valueOf(String text)
    {
        if (text == null) throw new NullPointerException("text");
        if (text.isEmpty()) throw new IllegalArgumentException("empty keyword");
        return new EdnKeyword(text);
    }

    public String getText()
    {
        return text;
    }

    /**
     * Gets the namespace prefix, the text before the first {@code /}.
     *
     * @return null if this keyword has no namespace.
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
        return EdnType.KEYWORD;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append(':');
        out.append(text);
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnKeyword && ((EdnKeyword) other).text.equals(text);
    }

    @Override
    public int hashCode()
    {
        return 31 * text.hashCode() + EdnType.KEYWORD.ordinal();
    }
}

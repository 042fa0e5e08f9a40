// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * An edn tagged literal: a tag name wrapping exactly one value, as in
 * {@code #inst "1985-04-12T23:20:50.52Z"}.
 * <p>
 * Tags are not interpreted; the wrapped value is kept as read.
 */
public final class EdnTag
    extends EdnValue
{
    private final String tagName;
    private final EdnValue value;

    private EdnTag(String tagName, EdnValue value)
    {
        this.tagName = tagName;
        this.value = value;
    }

    /**
     * @param tagName the tag text without the leading {@code #}.
     * @param value the wrapped value.
     */
    public static EdnTag valueOf(String tagName, EdnValue value)
    {
        if (tagName == null) throw new NullPointerException("tagName");
        if (value == null) throw new NullPointerException("value");
        return new EdnTag(tagName, value);
    }

    public String getTagName()
    {
        return tagName;
    }

    public EdnValue getValue()
    {
        return value;
    }

    @Override
    public EdnType getType()
    {
        return EdnType.TAG;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append('#').append(tagName).append(' ');
        value.appendTo(out);
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof EdnTag)) return false;
        EdnTag that = (EdnTag) other;
        return tagName.equals(that.tagName) && value.equals(that.value);
    }

    @Override
    public int hashCode()
    {
        return 31 * tagName.hashCode() + value.hashCode();
    }
}

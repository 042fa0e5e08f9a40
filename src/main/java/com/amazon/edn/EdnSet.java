// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An edn set, written {@code #{a b c}}. Duplicate elements collapse
 * according to the equality of the backing {@link Set}.
 */
public final class EdnSet
    extends EdnValue
    implements Iterable<EdnValue>
{
    private final Set<EdnValue> elements;

    private EdnSet(Set<EdnValue> elements)
    {
        if (elements == null) throw new NullPointerException("elements");
        this.elements = Collections.unmodifiableSet(elements);
    }

    /**
     * Creates a set that takes ownership of {@code elements}; the caller must
     * not modify the set afterwards.
     */
    public static EdnSet valueOf(Set<EdnValue> elements)
    {
        return new EdnSet(elements);
    }

    public static EdnSet of(EdnValue... elements)
    {
        return new EdnSet(new LinkedHashSet<EdnValue>(Arrays.asList(elements)));
    }

    /**
     * @return an unmodifiable view of the elements.
     */
    public Set<EdnValue> getElements()
    {
        return elements;
    }

    public int size()
    {
        return elements.size();
    }

    public boolean contains(EdnValue value)
    {
        return elements.contains(value);
    }

    @Override
    public Iterator<EdnValue> iterator()
    {
        return elements.iterator();
    }

    @Override
    public EdnType getType()
    {
        return EdnType.SET;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append("#{");
        boolean first = true;
        for (EdnValue element : elements) {
            if (!first) out.append(' ');
            element.appendTo(out);
            first = false;
        }
        out.append('}');
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnSet && ((EdnSet) other).elements.equals(elements);
    }

    @Override
    public int hashCode()
    {
        return elements.hashCode();
    }
}

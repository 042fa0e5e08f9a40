// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Common base of the ordered edn collections, {@link EdnList} and
 * {@link EdnVector}.
 * <p>
 * A list never equals a vector, even with the same elements, because the
 * two report different {@link EdnType}s.
 */
public abstract class EdnSequence
    extends EdnValue
    implements Iterable<EdnValue>
{
    private final List<EdnValue> elements;

    EdnSequence(List<EdnValue> elements)
    {
        if (elements == null) throw new NullPointerException("elements");
        this.elements = Collections.unmodifiableList(elements);
    }

    /**
     * @return an unmodifiable view of the elements, in source order.
     */
    public List<EdnValue> getElements()
    {
        return elements;
    }

    public int size()
    {
        return elements.size();
    }

    public boolean isEmpty()
    {
        return elements.isEmpty();
    }

    public EdnValue get(int index)
    {
        return elements.get(index);
    }

    @Override
    public Iterator<EdnValue> iterator()
    {
        return elements.iterator();
    }

    abstract char openingDelimiter();

    abstract char closingDelimiter();

    @Override
    void appendTo(StringBuilder out)
    {
        out.append(openingDelimiter());
        boolean first = true;
        for (EdnValue element : elements) {
            if (!first) out.append(' ');
            element.appendTo(out);
            first = false;
        }
        out.append(closingDelimiter());
    }

    @Override
    public boolean equals(Object other)
    {
        if (other == this) return true;
        if (!(other instanceof EdnSequence)) return false;
        EdnSequence that = (EdnSequence) other;
        return getType() == that.getType() && elements.equals(that.elements);
    }

    @Override
    public int hashCode()
    {
        return 31 * elements.hashCode() + getType().ordinal();
    }
}

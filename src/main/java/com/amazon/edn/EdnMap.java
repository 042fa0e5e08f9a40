// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import java.util.Collections;
import java.util.Map;

/**
 * An edn map, written {@code {k1 v1, k2 v2}}. Keys are unique according to
 * the equality of the backing {@link Map}; a repeated key keeps the last
 * value read.
 */
public final class EdnMap
    extends EdnValue
{
    private final Map<EdnValue, EdnValue> entries;

    private EdnMap(Map<EdnValue, EdnValue> entries)
    {
        if (entries == null) throw new NullPointerException("entries");
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Creates a map that takes ownership of {@code entries}; the caller must
     * not modify the map afterwards.
     */
    public static EdnMap valueOf(Map<EdnValue, EdnValue> entries)
    {
        return new EdnMap(entries);
    }

    /**
     * @return an unmodifiable view of the entries.
     */
    public Map<EdnValue, EdnValue> getEntries()
    {
        return entries;
    }

    public int size()
    {
        return entries.size();
    }

    /**
     * @return null if {@code key} is not present.
     */
    public EdnValue get(EdnValue key)
    {
        return entries.get(key);
    }

    @Override
    public EdnType getType()
    {
        return EdnType.MAP;
    }

    @Override
    void appendTo(StringBuilder out)
    {
        out.append('{');
        boolean first = true;
        for (Map.Entry<EdnValue, EdnValue> entry : entries.entrySet()) {
            if (!first) out.append(", ");
            entry.getKey().appendTo(out);
            out.append(' ');
            entry.getValue().appendTo(out);
            first = false;
        }
        out.append('}');
    }

    @Override
    public boolean equals(Object other)
    {
        return other instanceof EdnMap && ((EdnMap) other).entries.equals(entries);
    }

    @Override
    public int hashCode()
    {
        return entries.hashCode();
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.system;

import com.amazon.edn.EdnCollectionFactory;
import com.amazon.edn.EdnValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A basic implementation of {@link EdnCollectionFactory} whose collections
 * use {@link EdnValue#equals(Object)} and keep their elements in the order
 * they were read. A repeated set element is dropped; a repeated map key
 * keeps the last value read for it.
 */
public final class SimpleCollectionFactory
    implements EdnCollectionFactory
{
    public static final SimpleCollectionFactory INSTANCE = new SimpleCollectionFactory();

    private SimpleCollectionFactory()
    {
    }

    public List<EdnValue> newList()
    {
        return new LinkedList<EdnValue>();
    }

    public List<EdnValue> newVector()
    {
        return new ArrayList<EdnValue>();
    }

    public Set<EdnValue> newSet()
    {
        return new LinkedHashSet<EdnValue>();
    }

    public Map<EdnValue, EdnValue> newMap()
    {
        return new LinkedHashMap<EdnValue, EdnValue>();
    }
}

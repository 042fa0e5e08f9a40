// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Supplies the mutable collections an {@link EdnLoader} fills while it
 * materializes collection values. The equality and hashing rules of the
 * returned collections decide which set elements collapse and which map
 * keys are the same.
 * <p>
 * An insertion that throws a {@link RuntimeException} ends the load with an
 * {@link EdnError} of kind {@link EdnErrorKind#FOREIGN}.
 *
 * @see com.amazon.edn.system.SimpleCollectionFactory
 */
public interface EdnCollectionFactory
{
    public List<EdnValue> newList();

    public List<EdnValue> newVector();

    public Set<EdnValue> newSet();

    public Map<EdnValue, EdnValue> newMap();
}

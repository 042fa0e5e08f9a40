// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import java.util.Arrays;
import java.util.LinkedList;
import java.util.List;

/**
 * An edn list, written {@code (a b c)}.
 */
public final class EdnList
    extends EdnSequence
{
    private EdnList(List<EdnValue> elements)
    {
        super(elements);
    }

    /**
     * Creates a list that takes ownership of {@code elements}; the caller must
     * not modify the list afterwards.
     */
    public static EdnList valueOf(List<EdnValue> elements)
    {
        return new EdnList(elements);
    }

    public static EdnList of(EdnValue... elements)
    {
        return new EdnList(new LinkedList<EdnValue>(Arrays.asList(elements)));
    }

    @Override
    public EdnType getType()
    {
        return EdnType.LIST;
    }

    @Override
    char openingDelimiter()
    {
        return '(';
    }

    @Override
    char closingDelimiter()
    {
        return ')';
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An edn vector, written {@code [a b c]}.
 */
public final class EdnVector
    extends EdnSequence
{
    private EdnVector(List<EdnValue> elements)
    {
        super(elements);
    }

    /**
     * Creates a vector that takes ownership of {@code elements}; the caller must
     * not modify the list afterwards.
     */
    public static EdnVector valueOf(List<EdnValue> elements)
    {
        return new EdnVector(elements);
    }

    public static EdnVector of(EdnValue... elements)
    {
        return new EdnVector(new ArrayList<EdnValue>(Arrays.asList(elements)));
    }

    @Override
    public EdnType getType()
    {
        return EdnType.VECTOR;
    }

    @Override
    char openingDelimiter()
    {
        return '[';
    }

    @Override
    char closingDelimiter()
    {
        return ']';
    }
}

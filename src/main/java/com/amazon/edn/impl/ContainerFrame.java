// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnType;

/**
 * One entry of the reader's nesting stack.
 * <p>
 * Collection frames record which collection is open and where the reader
 * is among its elements. Prefix frames ({@link Kind#TAG},
 * {@link Kind#DISCARD}) wait for the single value they apply to and are
 * popped as soon as that value is complete.
 * <p>
 * Frames are mutable and reused by the stack.
 */
final class ContainerFrame
{
    enum Kind
    {
        LIST    (EdnType.LIST,   ')'),
        VECTOR  (EdnType.VECTOR, ']'),
        SET     (EdnType.SET,    '}'),
        MAP     (EdnType.MAP,    '}'),
        TAG     (null,           -1),
        DISCARD (null,           -1);

        private final EdnType containerType;
        private final int     closingDelimiter;

        Kind(EdnType containerType, int closingDelimiter)
        {
            this.containerType = containerType;
            this.closingDelimiter = closingDelimiter;
        }

        /**
         * @return null for prefix frames.
         */
        EdnType containerType()
        {
            return containerType;
        }

        int closingDelimiter()
        {
            return closingDelimiter;
        }

        boolean isCollection()
        {
            return containerType != null;
        }
    }

    Kind    kind;
    /** No element has completed yet. */
    boolean first;
    /** Whitespace followed the last element. */
    boolean separated;
    /** Completed elements; odd means a map is waiting for a value. */
    int     count;

    void reset(Kind kind)
    {
        this.kind = kind;
        this.first = true;
        this.separated = false;
        this.count = 0;
    }

    @Override
    public String toString()
    {
        return kind + (first ? "(first)" : "(" + count + ")");
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import java.io.Reader;

/**
 * Loads edn text into a complete {@link EdnValue} tree.
 * <p>
 * A loader consumes the events of an {@link EdnReader} until the end of the
 * input, so the whole top-level value is held in memory.
 * Implementations are safe for use by multiple threads.
 */
public interface EdnLoader
{
    /**
     * Loads the single top-level value of the given edn text.
     *
     * @throws EdnParseException if the text is not well-formed edn, or a
     *  collection rejects an element.
     */
    public EdnValue load(CharSequence text)
        throws EdnParseException;

    /**
     * Loads the single top-level value read from {@code reader}. The reader
     * is consumed to its end but not closed.
     *
     * @throws EdnParseException if the text is not well-formed edn, a
     *  collection rejects an element, or the source fails.
     */
    public EdnValue load(Reader reader)
        throws EdnParseException;
}

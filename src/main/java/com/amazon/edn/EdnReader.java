// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import java.io.Closeable;

/**
 * Provides pull access to edn text as a sequence of {@link EdnEvent}s.
 * <p>
 * Each call to {@link #next()} advances the parse by one logical step. A
 * reader holds no locks and starts no threads; the caller may stop pulling
 * at any point, and may resume later with the same result as an
 * uninterrupted run. Events arrive in source order, and the start and end
 * events of a collection always bracket the events of its elements.
 * <p>
 * Errors are reported as a final {@link EdnEventType#ERROR} event rather
 * than thrown. After the error, or after the clean end of the input, every
 * call to {@link #next()} returns null. A reader cannot recover from an
 * error; build a new one over corrected input instead.
 * <p>
 * Implementations are not thread-safe.
 *
 * <h2>Example</h2>
 * <pre>
 *   try (EdnReader reader = EdnReaderBuilder.standard().build("[1 :two]")) {
 *       for (EdnEvent event = reader.next(); event != null; event = reader.next()) {
 *           System.out.println(event);
 *       }
 *   }
 * </pre>
 */
public interface EdnReader
    extends Closeable, Iterable<EdnEvent>
{
    /**
     * Produces the next event.
     *
     * @return the next event, or null when no more events remain.
     */
    public EdnEvent next();

    /**
     * Gets the number of collections that are currently open.
     *
     * @return zero at the top level.
     */
    public int getDepth();

    /**
     * Gets the 1-based line of the next unconsumed character.
     */
    public long getLineNumber();

    /**
     * Gets the column of the next unconsumed character within its line.
     * A newline character itself is at column 0 of the line it starts.
     */
    public long getColumn();
}

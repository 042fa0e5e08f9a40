// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * The kinds of {@link EdnEvent} an {@link EdnReader} produces.
 */
public enum EdnEventType
{
    /** A complete scalar value. */
    VALUE,
    /** A tag; the next complete value is the one it wraps. */
    TAG,
    CONTAINER_START,
    CONTAINER_END,
    /** The stream ended in error; always the last event. */
    ERROR
}

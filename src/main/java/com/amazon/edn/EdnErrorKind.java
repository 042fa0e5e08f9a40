// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * Distinguishes where an {@link EdnError} originated.
 */
public enum EdnErrorKind
{
    /** The text does not follow the edn grammar. */
    SYNTAX,
    /** The underlying character source failed. */
    IO,
    /** A collaborator, such as an {@link EdnCollectionFactory}, rejected a value. */
    FOREIGN
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * Base class for exceptions thrown throughout this library. In most cases,
 * external exceptions are wrapped by {@link EdnException}s.
 */
public class EdnException
    extends RuntimeException
{
    private static final long serialVersionUID = 1L;

    public EdnException(String message)
    {
        super(message);
    }

    public EdnException(String message, Throwable cause)
    {
        super(message, cause);
    }


    /**
     * Finds the first exception in the {@link #getCause()} chain that is
     * an instance of the given type.
     *
     * @return null if there's no cause of the given type.
     */
    @SuppressWarnings("unchecked")
    public <T extends Throwable> T causeOfType(Class<T> type)
    {
        Throwable cause = getCause();
        while (cause != null && ! type.isInstance(cause))
        {
            cause = cause.getCause();
        }
        return (T) cause;
    }
}

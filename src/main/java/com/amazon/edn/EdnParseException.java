// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * Thrown by {@link EdnLoader} when the event stream it consumes ends in
 * error.
 */
public class EdnParseException
    extends EdnException
{
    private static final long serialVersionUID = 1L;

    private final EdnError error;

    public EdnParseException(EdnError error)
    {
        super(error.toString());
        this.error = error;
    }

    public EdnParseException(EdnError error, Throwable cause)
    {
        super(error.toString(), cause);
        this.error = error;
    }

    public EdnError getError()
    {
        return error;
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnError;
import com.amazon.edn.EdnErrorCode;
import com.amazon.edn.EdnException;

/**
 * Raised inside the reader when the input breaks the grammar. The state
 * machine catches it and reports it as the final error event; it never
 * escapes to callers.
 */
final class EdnSyntaxException
    extends EdnException
{
    private static final long serialVersionUID = 1L;

    private final EdnErrorCode _code;
    private final long         _line;
    private final long         _column;

    EdnSyntaxException(EdnErrorCode code, long line, long column, String message)
    {
        super(message);
        _code = code;
        _line = line;
        _column = column;
    }

    EdnErrorCode getCode()
    {
        return _code;
    }

    EdnError toError()
    {
        return EdnError.syntax(_code, _line, _column, getMessage());
    }
}

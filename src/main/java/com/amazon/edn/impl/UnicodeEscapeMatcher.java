// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnChar;
import com.amazon.edn.EdnErrorCode;
import com.amazon.edn.EdnValue;
import com.amazon.edn.util.EdnTextUtils;

/**
 * Matches the body of a unicode character literal: a {@code u} followed by
 * exactly four hexadecimal digits.
 */
final class UnicodeEscapeMatcher
    extends CandidateMatcher
{
    private static final int HEX_DIGITS = 4;

    private int _code_point;

    @Override
    void reset()
    {
        super.reset();
        _code_point = 0;
    }

    @Override
    boolean accept(int c, int index)
    {
        if (index == 0) return c == 'u';
        if (index > HEX_DIGITS) return false;

        int d = EdnTextUtils.hexDigitValue(c);
        if (d < 0) return false;
        _code_point = (_code_point << 4) + d;
        return true;
    }

    @Override
    EdnValue complete(CharSequence text, int length)
    {
        if (length != HEX_DIGITS + 1) return null;
        if (Character.isSurrogate((char) _code_point)) {
            throw new EdnSyntaxException(EdnErrorCode.INVALID_UNICODE_CODE_POINT,
                                         getFailLine(), getFailColumn(),
                                         "Surrogate code point in character literal: \\" + text);
        }
        return EdnChar.valueOf(_code_point);
    }
}

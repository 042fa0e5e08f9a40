// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnChar;
import com.amazon.edn.EdnValue;

/**
 * Matches a character literal made of exactly one character after the
 * backslash, such as {@code \a}.
 */
final class SingleCharacterMatcher
    extends CandidateMatcher
{
    private int _code_point;

    @Override
    boolean accept(int c, int index)
    {
        if (index != 0) return false;
        _code_point = c;
        return true;
    }

    @Override
    EdnValue complete(CharSequence text, int length)
    {
        return EdnChar.valueOf(_code_point);
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnValue;

/**
 * Matches one fixed, case-sensitive spelling such as {@code nil} or
 * {@code newline}. Succeeds only when the token is exactly that text.
 */
final class LiteralMatcher
    extends CandidateMatcher
{
    private final String   _literal;
    private final EdnValue _value;

    LiteralMatcher(String literal, EdnValue value)
    {
        _literal = literal;
        _value = value;
    }

    @Override
    boolean accept(int c, int index)
    {
        return index < _literal.length() && _literal.charAt(index) == c;
    }

    @Override
    EdnValue complete(CharSequence text, int length)
    {
        return (length == _literal.length()) ? _value : null;
    }

    @Override
    public String toString()
    {
        return "LiteralMatcher(" + _literal + ")";
    }
}

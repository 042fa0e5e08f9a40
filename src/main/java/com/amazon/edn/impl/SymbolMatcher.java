// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import static com.amazon.edn.util.EdnTextUtils.isAlphabetic;
import static com.amazon.edn.util.EdnTextUtils.isAlphanumeric;
import static com.amazon.edn.util.EdnTextUtils.isExtendedSpecial;
import static com.amazon.edn.util.EdnTextUtils.isGeneralSpecial;
import static com.amazon.edn.util.EdnTextUtils.isLeadingSpecial;

import com.amazon.edn.EdnKeyword;
import com.amazon.edn.EdnSymbol;
import com.amazon.edn.EdnValue;

/**
 * Matches bare symbols and, when built with the keyword sigil, keywords.
 * <ul>
 *   <li>the first character is alphabetic or one of {@code + - .}</li>
 *   <li>after a leading {@code + - .} the second character is alphabetic,
 *       a general special or an extended special</li>
 *   <li>after a {@code /} the next character is alphabetic or a general
 *       special other than {@code /}</li>
 *   <li>anything else is alphanumeric, a general special or an extended
 *       special</li>
 *   <li>the whole token may not end in {@code /}</li>
 * </ul>
 * A keyword is a {@code :} followed by text of the same shape.
 */
final class SymbolMatcher
    extends CandidateMatcher
{
    private final boolean _is_keyword;
    private int           _first;
    private int           _prev;

    SymbolMatcher(boolean isKeyword)
    {
        _is_keyword = isKeyword;
    }

    @Override
    void reset()
    {
        super.reset();
        _first = -1;
        _prev = -1;
    }

    @Override
    boolean accept(int c, int index)
    {
        if (_is_keyword) {
            if (index == 0) return c == ':';
            index--;
        }

        boolean ok;
        if (index == 0) {
            ok = isAlphabetic(c) || isLeadingSpecial(c);
            _first = c;
        }
        else if (index == 1 && isLeadingSpecial(_first)) {
            ok = isAlphabetic(c) || isGeneralSpecial(c) || isExtendedSpecial(c);
        }
        else if (_prev == '/') {
            ok = isAlphabetic(c) || (isGeneralSpecial(c) && c != '/');
        }
        else {
            ok = isAlphanumeric(c) || isGeneralSpecial(c) || isExtendedSpecial(c);
        }
        _prev = c;
        return ok;
    }

    @Override
    EdnValue complete(CharSequence text, int length)
    {
        String name = text.toString();
        if (_is_keyword) {
            name = name.substring(1);
        }
        if (name.isEmpty() || name.endsWith("/")) {
            return null;
        }
        return _is_keyword ? EdnKeyword.valueOf(name) : EdnSymbol.valueOf(name);
    }

    @Override
    public String toString()
    {
        return _is_keyword ? "SymbolMatcher(keyword)" : "SymbolMatcher(symbol)";
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import static com.amazon.edn.util.EdnTextUtils.isDigit;

import com.amazon.edn.EdnErrorCode;
import com.amazon.edn.EdnFloat;
import com.amazon.edn.EdnInt;
import com.amazon.edn.EdnValue;

/**
 * Matches integer and floating point literals:
 * {@code [+-]? digits ('.' digits)? ([eE] [+-]? digits)?}. A multi-digit
 * integer part may not start with {@code 0}.
 */
final class NumberMatcher
    extends CandidateMatcher
{
    private enum NumericState
    {
        START,
        SIGN,
        ZERO,
        INT,
        DOT,
        FRACTION,
        EXP_MARK,
        EXP_SIGN,
        EXP,
    }

    private NumericState _state;

    NumberMatcher()
    {
        _state = NumericState.START;
    }

    @Override
    void reset()
    {
        super.reset();
        _state = NumericState.START;
    }

    @Override
    boolean accept(int c, int index)
    {
        NumericState next = transition(_state, c);
        if (next == null) {
            return false;
        }
        _state = next;
        return true;
    }

    private static NumericState transition(NumericState state, int c)
    {
        switch (state)
        {
            case START:
                if (c == '+' || c == '-') return NumericState.SIGN;
                // fall through
            case SIGN:
                if (c == '0') return NumericState.ZERO;
                if (isDigit(c)) return NumericState.INT;
                return null;
            case ZERO:
                // no leading zeros
                if (c == '.') return NumericState.DOT;
                if (c == 'e' || c == 'E') return NumericState.EXP_MARK;
                return null;
            case INT:
                if (isDigit(c)) return NumericState.INT;
                if (c == '.') return NumericState.DOT;
                if (c == 'e' || c == 'E') return NumericState.EXP_MARK;
                return null;
            case DOT:
                return isDigit(c) ? NumericState.FRACTION : null;
            case FRACTION:
                if (isDigit(c)) return NumericState.FRACTION;
                if (c == 'e' || c == 'E') return NumericState.EXP_MARK;
                return null;
            case EXP_MARK:
                if (c == '+' || c == '-') return NumericState.EXP_SIGN;
                // fall through
            case EXP_SIGN:
            case EXP:
                return isDigit(c) ? NumericState.EXP : null;
            default:
                throw new AssertionError("Unknown numeric state: " + state);
        }
    }

    @Override
    EdnValue complete(CharSequence text, int length)
    {
        String image = text.toString();
        switch (_state)
        {
            case ZERO:
            case INT:
                try {
                    return EdnInt.valueOf(Long.parseLong(image));
                }
                catch (NumberFormatException e) {
                    throw new EdnSyntaxException(EdnErrorCode.INVALID_NUMBER,
                                                 getFailLine(), getFailColumn(),
                                                 "Integer out of range: " + image);
                }
            case FRACTION:
            case EXP:
                double value = Double.parseDouble(image);
                if (Double.isInfinite(value)) {
                    throw new EdnSyntaxException(EdnErrorCode.INVALID_NUMBER,
                                                 getFailLine(), getFailColumn(),
                                                 "Float out of range: " + image);
                }
                return EdnFloat.valueOf(value);
            default:
                return null;
        }
    }

    /**
     * @return true if the token so far begins like a number: a digit, or a
     *  sign followed by a digit.
     */
    boolean looksNumeric()
    {
        return _state != NumericState.START && _state != NumericState.SIGN;
    }

    @Override
    public String toString()
    {
        return "NumberMatcher(" + _state + ")";
    }
}

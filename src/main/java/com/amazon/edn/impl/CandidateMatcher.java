// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnValue;

/**
 * Recognizes one literal grammar while it runs side by side with other
 * candidates over the same characters.
 * <p>
 * Each character of a token is offered to every candidate that is not yet
 * {@link Liveness#DEAD}. A candidate that rejects a character is dead for the
 * rest of the token; nothing brings it back. Once the token ends, each
 * survivor is asked to {@link #finish(CharSequence)} it.
 */
abstract class CandidateMatcher
{
    enum Liveness { UNKNOWN, ALIVE, DEAD }

    private Liveness _liveness = Liveness.UNKNOWN;
    private int      _length;
    private long     _fail_line;
    private long     _fail_column;
    private long     _last_line;
    private long     _last_column;

    /**
     * Prepares the matcher for a new token.
     */
    void reset()
    {
        _liveness = Liveness.UNKNOWN;
        _length = 0;
        _fail_line = 0;
        _fail_column = 0;
        _last_line = 0;
        _last_column = 0;
    }

    /**
     * Offers the next character of the token, located at the given position.
     */
    final void offer(int c, long line, long column)
    {
        if (_liveness == Liveness.DEAD) return;

        _last_line = line;
        _last_column = column;
        if (accept(c, _length)) {
            _liveness = Liveness.ALIVE;
        }
        else {
            _liveness = Liveness.DEAD;
            _fail_line = line;
            _fail_column = column;
        }
        _length++;
    }

    /**
     * Asks for the value of the completed token.
     *
     * @param text all characters of the token, including any this matcher
     *  rejected.
     *
     * @return null if this candidate did not match the whole token.
     *
     * @throws EdnSyntaxException if the token has the right shape but no
     *  legal value, such as an integer that overflows.
     */
    final EdnValue finish(CharSequence text)
    {
        if (_liveness != Liveness.ALIVE) return null;
        return complete(text, _length);
    }

    /**
     * Decides whether the character at {@code index} of the token continues
     * this grammar. Called only while the matcher is alive.
     */
    abstract boolean accept(int c, int index);

    /**
     * Builds the value of a token that every character was accepted for.
     *
     * @return null if the token is incomplete under this grammar.
     */
    abstract EdnValue complete(CharSequence text, int length);

    final Liveness getLiveness()
    {
        return _liveness;
    }

    /**
     * @return the number of characters offered before the token ended or
     *  this candidate died, counting the character that killed it.
     */
    final int getLength()
    {
        return _length;
    }

    final boolean isDead()
    {
        return _liveness == Liveness.DEAD;
    }

    /**
     * @return the line of the character that killed this candidate or, if
     *  it is still alive, of the last character offered.
     */
    final long getFailLine()
    {
        return isDead() ? _fail_line : _last_line;
    }

    final long getFailColumn()
    {
        return isDead() ? _fail_column : _last_column;
    }
}

// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import static com.amazon.edn.util.EdnTextUtils.isAlphabetic;
import static com.amazon.edn.util.EdnTextUtils.isClosingDelimiter;
import static com.amazon.edn.util.EdnTextUtils.isTokenConstituent;
import static com.amazon.edn.util.EdnTextUtils.printCodePointAsString;

import com.amazon.edn.EdnError;
import com.amazon.edn.EdnErrorCode;
import com.amazon.edn.EdnErrorKind;
import com.amazon.edn.EdnEvent;
import com.amazon.edn.EdnReader;
import com.amazon.edn.EdnType;
import com.amazon.edn.EdnValue;
import java.io.IOException;
import java.io.Reader;
import java.util.Iterator;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reader implementation that drives the edn grammar as an explicit state
 * machine over an {@link EdnCursor}.
 * <p>
 * Nesting is tracked on a stack of {@link ContainerFrame}s rather than on
 * the call stack, so every call to {@link #next()} starts from the fields
 * of this object: the current {@link State}, the top frame and the cursor's
 * lookahead. A call may consume any number of characters but returns after
 * at most one event.
 * <p>
 * Scalars are read by the {@link EdnAtomRecognizer}; whitespace, commas and
 * comments by the {@link EdnWhitespaceSkipper}. Both signal bad input by
 * throwing {@link EdnSyntaxException}, which this class turns into the final
 * error event. I/O failures of the source become an
 * {@link EdnErrorKind#IO} error event in the same way.
 */
final class EdnReaderTextX
    implements EdnReader
{
    private static final Logger log = LoggerFactory.getLogger(EdnReaderTextX.class);

    private static final int DEFAULT_STACK_DEPTH = 10;

    enum State
    {
        /** Before the top-level value. */
        START,
        /** Before an element of a list, vector or set; see the top frame for first. */
        IN_ARRAY,
        /** After an element of a list, vector or set. */
        AWAITING_ARRAY_COMMA,
        /** Before a key or value of a map. */
        IN_OBJECT,
        /** After a key or value of a map. */
        AWAITING_OBJECT_COMMA,
        /** After a tag or a discard marker, before the value it applies to. */
        AWAITING_WRAPPED_VALUE,
        /** After the top-level value; only whitespace may follow. */
        BEFORE_FINISH,
        FINISHED
    }

    private final EdnCursor            _cursor;
    private final EdnWhitespaceSkipper _skipper;
    private final EdnAtomRecognizer    _atoms;
    private final boolean              _trailing_commas_allowed;
    private final boolean              _discard_enabled;

    private State            _state;
    private boolean          _primed;
    private ContainerFrame[] _stack = new ContainerFrame[DEFAULT_STACK_DEPTH];
    private int              _top = -1;
    private int              _container_depth;
    private int              _discard_depth;

    EdnReaderTextX(Reader in,
                   boolean trailingCommasAllowed,
                   boolean discardEnabled,
                   boolean commentsEnabled)
    {
        _cursor = new EdnCursor(in);
        _skipper = new EdnWhitespaceSkipper(_cursor, commentsEnabled);
        _atoms = new EdnAtomRecognizer(_cursor);
        _trailing_commas_allowed = trailingCommasAllowed;
        _discard_enabled = discardEnabled;
        _state = State.START;
    }

    State getState()
    {
        return _state;
    }

    private void set_state(State state)
    {
        if (log.isTraceEnabled()) {
            log.trace("{} -> {} at line {} column {}",
                      _state, state, _cursor.getLineNumber(), _cursor.getColumn());
        }
        _state = state;
    }

    public int getDepth()
    {
        return _container_depth;
    }

    public long getLineNumber()
    {
        return _cursor.getLineNumber();
    }

    public long getColumn()
    {
        return _cursor.getColumn();
    }


    public EdnEvent next()
    {
        try {
            if (!_primed) {
                _primed = true;
                _cursor.advance();
            }
            while (_state != State.FINISHED) {
                EdnEvent event = step();
                if (event != null) {
                    return event;
                }
            }
            return null;
        }
        catch (EdnSyntaxException e) {
            return fail(e.toError());
        }
        catch (IOException e) {
            return fail(new EdnError(EdnErrorKind.IO, EdnErrorCode.IO_ERROR,
                                     _cursor.getLineNumber(), _cursor.getColumn(),
                                     e.getMessage()));
        }
    }

    private EdnEvent fail(EdnError error)
    {
        log.debug("edn reader stopped: {}", error);
        set_state(State.FINISHED);
        return EdnEvent.error(error);
    }

    /**
     * Advances by one transition.
     *
     * @return the event the transition produced, or null if it produced
     *  none (either because it was internal or because the event belongs
     *  to a discarded value).
     */
    private EdnEvent step() throws IOException
    {
        switch (_state)
        {
            case START:
                _skipper.skip();
                if (_cursor.isEof()) {
                    throw error(EdnErrorCode.EOF_WHILE_PARSING_VALUE, "Expected a value");
                }
                return parse_value();
            case IN_ARRAY:
            case IN_OBJECT:
                return step_before_element();
            case AWAITING_ARRAY_COMMA:
            case AWAITING_OBJECT_COMMA:
                return step_after_element();
            case AWAITING_WRAPPED_VALUE:
                _skipper.skip();
                if (_cursor.isEof()) {
                    throw error(EdnErrorCode.EOF_WHILE_PARSING_VALUE,
                                "Expected a value after " + describe(top().kind));
                }
                if (isClosingDelimiter(_cursor.current())) {
                    throw error(EdnErrorCode.INVALID_SYNTAX,
                                "Expected a value after " + describe(top().kind)
                                + " but found " + printCodePointAsString(_cursor.current()));
                }
                return parse_value();
            case BEFORE_FINISH:
                _skipper.skip();
                if (_cursor.isEof()) {
                    set_state(State.FINISHED);
                    return null;
                }
                throw error(EdnErrorCode.TRAILING_CHARACTERS,
                            "Unexpected " + printCodePointAsString(_cursor.current())
                            + " after the top-level value");
            default:
                throw new AssertionError("unexpected state " + _state);
        }
    }

    private EdnEvent step_before_element() throws IOException
    {
        ContainerFrame frame = top();
        CharSequence whitespace = _skipper.skip();
        int c = _cursor.current();

        if (c == EdnCursor.EOF) {
            throw eof_inside(frame);
        }
        if (isClosingDelimiter(c)) {
            return close_container(frame, c);
        }
        if (!frame.first && !frame.separated && whitespace == null) {
            throw error(EdnErrorCode.EXPECTED_SEPARATOR,
                        "Expected whitespace before " + printCodePointAsString(c));
        }
        return parse_value();
    }

    private EdnEvent step_after_element() throws IOException
    {
        ContainerFrame frame = top();
        CharSequence whitespace = _skipper.skip();
        int c = _cursor.current();

        if (c == EdnCursor.EOF) {
            throw eof_inside(frame);
        }
        if (isClosingDelimiter(c)) {
            return close_container(frame, c);
        }
        frame.separated = whitespace != null;
        set_state(in_state(frame));
        return null;
    }

    private EdnEvent close_container(ContainerFrame frame, int c) throws IOException
    {
        if (c != frame.kind.closingDelimiter()) {
            throw error(EdnErrorCode.INVALID_SYNTAX,
                        "Mismatched closing delimiter " + printCodePointAsString(c)
                        + " in " + frame.kind.containerType());
        }
        if (_skipper.sawComma() && !_trailing_commas_allowed) {
            throw error(EdnErrorCode.TRAILING_COMMA,
                        "Trailing comma before " + printCodePointAsString(c));
        }
        if (frame.kind == ContainerFrame.Kind.MAP && (frame.count & 1) != 0) {
            throw error(EdnErrorCode.MISSING_MAP_VALUE,
                        "Map closed after a key with no value");
        }
        _cursor.advance();

        EdnType type = frame.kind.containerType();
        boolean suppressed = _discard_depth > 0;
        pop();
        _container_depth--;
        value_completed();
        return suppressed ? null : EdnEvent.containerEnd(type);
    }

    /**
     * Starts one value at the current character, which is neither end of
     * stream nor whitespace.
     */
    private EdnEvent parse_value() throws IOException
    {
        int c = _cursor.current();
        switch (c)
        {
            case '(':
                return open_container(ContainerFrame.Kind.LIST);
            case '[':
                return open_container(ContainerFrame.Kind.VECTOR);
            case '{':
                return open_container(ContainerFrame.Kind.MAP);
            case '"':
                return scalar(_atoms.readString());
            case '\\':
                return scalar(_atoms.readCharacter());
            case '#':
                return parse_dispatch();
            default:
                if (isClosingDelimiter(c)) {
                    throw error(EdnErrorCode.INVALID_SYNTAX,
                                "Unbalanced closing delimiter " + printCodePointAsString(c));
                }
                if (isTokenConstituent(c)) {
                    return scalar(_atoms.readToken());
                }
                throw error(EdnErrorCode.INVALID_SYNTAX,
                            "Unexpected character " + printCodePointAsString(c));
        }
    }

    // the current character is the '#'
    private EdnEvent parse_dispatch() throws IOException
    {
        _cursor.advance();
        int c = _cursor.current();
        if (c == '{') {
            return open_container(ContainerFrame.Kind.SET);
        }
        if (c == '_' && _discard_enabled) {
            _cursor.advance();
            push(ContainerFrame.Kind.DISCARD);
            _discard_depth++;
            set_state(State.AWAITING_WRAPPED_VALUE);
            return null;
        }
        if (c == '#') {
            _cursor.advance();
            return scalar(_atoms.readSymbolicValue());
        }
        if (isAlphabetic(c)) {
            String tagName = _atoms.readTagName();
            boolean suppressed = _discard_depth > 0;
            push(ContainerFrame.Kind.TAG);
            set_state(State.AWAITING_WRAPPED_VALUE);
            return suppressed ? null : EdnEvent.tag(tagName);
        }
        if (c == EdnCursor.EOF) {
            throw error(EdnErrorCode.EOF_WHILE_PARSING_VALUE, "Unexpected end of input after #");
        }
        throw error(EdnErrorCode.INVALID_SYNTAX,
                    "Unknown dispatch character " + printCodePointAsString(c) + " after #");
    }

    // the current character is the opening delimiter
    private EdnEvent open_container(ContainerFrame.Kind kind) throws IOException
    {
        _cursor.advance();
        boolean suppressed = _discard_depth > 0;
        ContainerFrame frame = push(kind);
        _container_depth++;
        set_state(in_state(frame));
        return suppressed ? null : EdnEvent.containerStart(kind.containerType());
    }

    private EdnEvent scalar(EdnValue value)
    {
        boolean suppressed = _discard_depth > 0;
        value_completed();
        return suppressed ? null : EdnEvent.value(value);
    }

    /**
     * Records that a whole value (scalar or collection) has just been read,
     * unwinding the tag and discard frames waiting for it.
     */
    private void value_completed()
    {
        for (;;) {
            if (_top < 0) {
                set_state(State.BEFORE_FINISH);
                return;
            }
            ContainerFrame frame = top();
            switch (frame.kind)
            {
                case TAG:
                    pop();
                    continue;
                case DISCARD:
                    pop();
                    _discard_depth--;
                    after_discard();
                    return;
                default:
                    frame.count++;
                    frame.first = false;
                    frame.separated = false;
                    set_state(awaiting_state(frame));
                    return;
            }
        }
    }

    // a discarded value is not an element; the whitespace around it still separates
    private void after_discard()
    {
        if (_top < 0) {
            set_state(State.START);
            return;
        }
        ContainerFrame frame = top();
        if (frame.kind.isCollection()) {
            frame.first = false;
            set_state(awaiting_state(frame));
        }
        else {
            set_state(State.AWAITING_WRAPPED_VALUE);
        }
    }

    private static State in_state(ContainerFrame frame)
    {
        return (frame.kind == ContainerFrame.Kind.MAP) ? State.IN_OBJECT : State.IN_ARRAY;
    }

    private static State awaiting_state(ContainerFrame frame)
    {
        return (frame.kind == ContainerFrame.Kind.MAP)
            ? State.AWAITING_OBJECT_COMMA
            : State.AWAITING_ARRAY_COMMA;
    }

    private static String describe(ContainerFrame.Kind kind)
    {
        return (kind == ContainerFrame.Kind.TAG) ? "tag" : "#_";
    }


    //=========================================================================
    // stack

    private ContainerFrame top()
    {
        return _stack[_top];
    }

    private ContainerFrame push(ContainerFrame.Kind kind)
    {
        if (_top + 1 >= _stack.length) {
            ContainerFrame[] temp = new ContainerFrame[_stack.length * 2];
            System.arraycopy(_stack, 0, temp, 0, _stack.length);
            _stack = temp;
        }
        _top++;
        ContainerFrame frame = _stack[_top];
        if (frame == null) {
            frame = new ContainerFrame();
            _stack[_top] = frame;
        }
        frame.reset(kind);
        return frame;
    }

    private void pop()
    {
        if (_top < 0) {
            throw new IllegalStateException("container stack underflow");
        }
        _top--;
    }


    //=========================================================================
    // errors

    private EdnSyntaxException error(EdnErrorCode code, String message)
    {
        return new EdnSyntaxException(code, _cursor.getLineNumber(), _cursor.getColumn(), message);
    }

    private EdnSyntaxException eof_inside(ContainerFrame frame)
    {
        EdnType type = frame.kind.containerType();
        return error(EdnErrorCode.eofInside(type), "Unexpected end of input in " + type);
    }


    //=========================================================================

    public Iterator<EdnEvent> iterator()
    {
        return new Iterator<EdnEvent>()
        {
            private EdnEvent _next;

            public boolean hasNext()
            {
                if (_next == null) {
                    _next = EdnReaderTextX.this.next();
                }
                return _next != null;
            }

            public EdnEvent next()
            {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                EdnEvent event = _next;
                _next = null;
                return event;
            }

            public void remove()
            {
                throw new UnsupportedOperationException();
            }
        };
    }

    public void close() throws IOException
    {
        set_state(State.FINISHED);
        _cursor.close();
    }
}

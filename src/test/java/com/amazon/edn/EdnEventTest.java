// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EdnEventTest
{
    @Test
    public void valueEvent()
    {
        EdnEvent event = EdnEvent.value(EdnInt.valueOf(1));
        assertEquals(EdnEventType.VALUE, event.getEventType());
        assertEquals(EdnInt.valueOf(1), event.getValue());
        assertNull(event.getContainerType());
        assertNull(event.getError());
        assertEquals("VALUE(1)", event.toString());
    }

    @Test
    public void collectionsAreNotValueEvents()
    {
        assertThrows(IllegalArgumentException.class, () -> EdnEvent.value(EdnVector.of()));
    }

    @Test
    public void containerEvents()
    {
        assertEquals("START(SET)", EdnEvent.containerStart(EdnType.SET).toString());
        assertEquals("END(MAP)", EdnEvent.containerEnd(EdnType.MAP).toString());
        assertNotEquals(EdnEvent.containerStart(EdnType.LIST), EdnEvent.containerEnd(EdnType.LIST));
        assertEquals("TAG(#inst)", EdnEvent.tag("inst").toString());
    }

    @Test
    public void errorEquality()
    {
        EdnError a = EdnError.syntax(EdnErrorCode.INVALID_SYNTAX, 2, 3, "one message");
        EdnError b = EdnError.syntax(EdnErrorCode.INVALID_SYNTAX, 2, 3, "another");
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, EdnError.syntax(EdnErrorCode.INVALID_SYNTAX, 2, 4, null));
        assertNotEquals(a, new EdnError(EdnErrorKind.IO, EdnErrorCode.INVALID_SYNTAX, 2, 3, null));
        assertEquals("INVALID_SYNTAX at line 2 column 3: one message", a.toString());

        EdnEvent event = EdnEvent.error(a);
        assertTrue(event.isError());
        assertEquals(EdnEvent.error(b), event);
    }

    @Test
    public void parseExceptionCarriesTheError()
    {
        EdnError error = new EdnError(EdnErrorKind.IO, EdnErrorCode.IO_ERROR, 1, 1, "gone");
        IOException io = new IOException("gone");
        EdnParseException e = new EdnParseException(error, new RuntimeException(io));
        assertSame(error, e.getError());
        assertSame(io, e.causeOfType(IOException.class));
        assertNull(e.causeOfType(IllegalStateException.class));
    }
}

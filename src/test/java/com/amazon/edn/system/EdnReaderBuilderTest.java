// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.system;

import com.amazon.edn.EdnCollectionFactory;
import com.amazon.edn.EdnEvent;
import com.amazon.edn.EdnInt;
import com.amazon.edn.EdnReader;
import com.amazon.edn.EdnType;
import com.amazon.edn.EdnValue;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EdnReaderBuilderTest
{
    private static final EdnCollectionFactory HASHED = new EdnCollectionFactory()
    {
        public List<EdnValue> newList()             { return new ArrayList<EdnValue>(); }
        public List<EdnValue> newVector()           { return new ArrayList<EdnValue>(); }
        public Set<EdnValue> newSet()               { return new HashSet<EdnValue>(); }
        public Map<EdnValue, EdnValue> newMap()     { return new HashMap<EdnValue, EdnValue>(); }
    };

    @Test
    public void testDefaults()
    {
        EdnReaderBuilder b = EdnReaderBuilder.standard();
        assertSame(SimpleCollectionFactory.INSTANCE, b.getCollectionFactory());
        assertTrue(b.isTrailingCommasAllowed());
        assertTrue(b.isDiscardEnabled());
        assertTrue(b.isCommentsEnabled());
    }

    @Test
    public void testStandardIsNewEachTime()
    {
        assertNotSame(EdnReaderBuilder.standard(), EdnReaderBuilder.standard());
    }

    @Test
    public void testMutableBuilderIsChangedInPlace()
    {
        EdnReaderBuilder b = EdnReaderBuilder.standard();
        assertSame(b, b.mutable());
        assertSame(b, b.withCommentsEnabled(false));
        assertFalse(b.isCommentsEnabled());

        b.setCollectionFactory(HASHED);
        assertSame(HASHED, b.getCollectionFactory());
        b.setCollectionFactory(null);
        assertSame(SimpleCollectionFactory.INSTANCE, b.getCollectionFactory());
    }

    @Test
    public void testImmutableBuilder()
    {
        EdnReaderBuilder mutable = EdnReaderBuilder.standard().withTrailingCommasAllowed(false);
        EdnReaderBuilder immutable = mutable.immutable();
        assertNotSame(mutable, immutable);
        assertSame(immutable, immutable.immutable());
        assertFalse(immutable.isTrailingCommasAllowed());

        assertThrows(UnsupportedOperationException.class, () -> immutable.setDiscardEnabled(false));
        assertThrows(UnsupportedOperationException.class, () -> immutable.setCommentsEnabled(false));
        assertThrows(UnsupportedOperationException.class, () -> immutable.setTrailingCommasAllowed(true));
        assertThrows(UnsupportedOperationException.class, () -> immutable.setCollectionFactory(HASHED));

        EdnReaderBuilder changed = immutable.withDiscardEnabled(false);
        assertNotSame(immutable, changed);
        assertFalse(changed.isDiscardEnabled());
        assertFalse(changed.isTrailingCommasAllowed());
        assertTrue(immutable.isDiscardEnabled());
    }

    @Test
    public void testCopyIsIndependent()
    {
        EdnReaderBuilder original = EdnReaderBuilder.standard().withCollectionFactory(HASHED);
        EdnReaderBuilder copy = original.copy();
        assertNotSame(original, copy);
        assertSame(HASHED, copy.getCollectionFactory());

        copy.setCommentsEnabled(false);
        assertTrue(original.isCommentsEnabled());
    }

    @Test
    public void testBuildOverReader() throws IOException
    {
        try (EdnReader reader = EdnReaderBuilder.standard().build(new StringReader("42"))) {
            assertEquals(EdnEvent.value(EdnInt.valueOf(42)), reader.next());
            assertNull(reader.next());
        }
    }

    @Test
    public void testBuildRejectsNull()
    {
        assertThrows(NullPointerException.class,
                     () -> EdnReaderBuilder.standard().build((CharSequence) null));
        assertThrows(NullPointerException.class,
                     () -> EdnReaderBuilder.standard().build((java.io.Reader) null));
    }

    @Test
    public void testLoaderUsesCollectionFactory()
    {
        EdnValue value = EdnReaderBuilder.standard()
            .withCollectionFactory(HASHED)
            .buildLoader()
            .load("#{1 2 3}");
        assertEquals(EdnType.SET, value.getType());
    }
}

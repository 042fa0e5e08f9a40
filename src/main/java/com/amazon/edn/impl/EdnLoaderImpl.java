// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn.impl;

import com.amazon.edn.EdnCollectionFactory;
import com.amazon.edn.EdnError;
import com.amazon.edn.EdnErrorCode;
import com.amazon.edn.EdnErrorKind;
import com.amazon.edn.EdnEvent;
import com.amazon.edn.EdnList;
import com.amazon.edn.EdnLoader;
import com.amazon.edn.EdnMap;
import com.amazon.edn.EdnParseException;
import com.amazon.edn.EdnReader;
import com.amazon.edn.EdnSet;
import com.amazon.edn.EdnTag;
import com.amazon.edn.EdnType;
import com.amazon.edn.EdnValue;
import com.amazon.edn.EdnVector;
import com.amazon.edn.system.EdnReaderBuilder;

import java.io.Reader;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Materializes the events of an {@link EdnReader} into an {@link EdnValue}
 * tree, filling collections obtained from the builder's
 * {@link EdnCollectionFactory}.
 */
final class EdnLoaderImpl
    implements EdnLoader
{
    private static final Logger log = LoggerFactory.getLogger(EdnLoaderImpl.class);

    private final EdnReaderBuilder     _readerBuilder;
    private final EdnCollectionFactory _factory;

    /**
     * @param readerBuilder must be immutable.
     */
    EdnLoaderImpl(EdnReaderBuilder readerBuilder)
    {
        assert readerBuilder != null;
        _readerBuilder = readerBuilder;
        _factory = readerBuilder.getCollectionFactory();
    }

    public EdnValue load(CharSequence text) throws EdnParseException
    {
        return load_helper(_readerBuilder.build(text));
    }

    public EdnValue load(Reader reader) throws EdnParseException
    {
        return load_helper(_readerBuilder.build(reader));
    }

    private EdnValue load_helper(EdnReader reader)
    {
        Deque<Level> stack = new ArrayDeque<Level>();
        Level root = new Level(null);
        stack.push(root);

        EdnEvent event;
        while ((event = reader.next()) != null) {
            switch (event.getEventType()) {
            case VALUE:
                add(stack.peek(), event.getValue(), reader);
                break;
            case TAG:
                stack.peek().tags.push(event.getTagName());
                break;
            case CONTAINER_START:
                stack.push(new Level(event.getContainerType()));
                break;
            case CONTAINER_END: {
                Level done = stack.pop();
                add(stack.peek(), done.toValue(), reader);
                break;
            }
            case ERROR:
                throw new EdnParseException(event.getError());
            default:
                throw new IllegalStateException("unexpected event " + event);
            }
        }

        assert stack.peek() == root && root.value != null;
        return root.value;
    }

    private void add(Level level, EdnValue value, EdnReader reader)
    {
        // the innermost tag was read last
        while (!level.tags.isEmpty()) {
            value = EdnTag.valueOf(level.tags.pop(), value);
        }
        try {
            level.add(value);
        }
        catch (RuntimeException e) {
            EdnError error = new EdnError(EdnErrorKind.FOREIGN,
                                          EdnErrorCode.KEY_MUST_BE_A_VALUE,
                                          reader.getLineNumber(),
                                          reader.getColumn(),
                                          "Collection rejected " + value + ": " + e);
            log.debug("collection factory {} rejected an element", _factory, e);
            throw new EdnParseException(error, e);
        }
    }


    /**
     * One collection being filled, or the root that receives the top-level
     * value.
     */
    private final class Level
    {
        final EdnType       type;
        final Deque<String> tags = new ArrayDeque<String>();

        private List<EdnValue>          _list;
        private Set<EdnValue>           _set;
        private Map<EdnValue, EdnValue> _map;
        private EdnValue                _key;
        EdnValue                        value;

        Level(EdnType type)
        {
            this.type = type;
            if (type == null) return;
            switch (type) {
            case LIST:   _list = _factory.newList();   break;
            case VECTOR: _list = _factory.newVector(); break;
            case SET:    _set = _factory.newSet();     break;
            case MAP:    _map = _factory.newMap();     break;
            default:
                throw new IllegalArgumentException("not a collection: " + type);
            }
        }

        void add(EdnValue element)
        {
            if (type == null) {
                value = element;
                return;
            }
            switch (type) {
            case LIST:
            case VECTOR:
                _list.add(element);
                break;
            case SET:
                _set.add(element);
                break;
            default:
                if (_key == null) {
                    _key = element;
                }
                else {
                    EdnValue key = _key;
                    _key = null;
                    _map.put(key, element);
                }
                break;
            }
        }

        EdnValue toValue()
        {
            switch (type) {
            case LIST:   return EdnList.valueOf(_list);
            case VECTOR: return EdnVector.valueOf(_list);
            case SET:    return EdnSet.valueOf(_set);
            default:     return EdnMap.valueOf(_map);
            }
        }
    }
}

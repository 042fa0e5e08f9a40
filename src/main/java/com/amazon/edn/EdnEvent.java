// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * One unit of output from an {@link EdnReader}: a scalar value, a tag, a
 * collection boundary, or an error.
 * <p>
 * Instances are immutable.
 */
public final class EdnEvent
{
    private final EdnEventType eventType;
    private final EdnValue     value;
    private final String       tagName;
    private final EdnType      containerType;
    private final EdnError     error;

    private EdnEvent(EdnEventType eventType, EdnValue value, String tagName,
                     EdnType containerType, EdnError error)
    {
        this.eventType = eventType;
        this.value = value;
        this.tagName = tagName;
        this.containerType = containerType;
        this.error = error;
    }

    /**
     * @param value must be a scalar.
     */
    public static EdnEvent value(EdnValue value)
    {
        if (EdnType.isContainer(value.getType())) {
            throw new IllegalArgumentException("not a scalar: " + value.getType());
        }
        return new EdnEvent(EdnEventType.VALUE, value, null, null, null);
    }

    public static EdnEvent tag(String tagName)
    {
        if (tagName == null) throw new NullPointerException("tagName");
        return new EdnEvent(EdnEventType.TAG, null, tagName, null, null);
    }

    public static EdnEvent containerStart(EdnType containerType)
    {
        checkContainer(containerType);
        return new EdnEvent(EdnEventType.CONTAINER_START, null, null, containerType, null);
    }

    public static EdnEvent containerEnd(EdnType containerType)
    {
        checkContainer(containerType);
        return new EdnEvent(EdnEventType.CONTAINER_END, null, null, containerType, null);
    }

    public static EdnEvent error(EdnError error)
    {
        if (error == null) throw new NullPointerException("error");
        return new EdnEvent(EdnEventType.ERROR, null, null, null, error);
    }

    private static void checkContainer(EdnType containerType)
    {
        if (!EdnType.isContainer(containerType)) {
            throw new IllegalArgumentException("not a container: " + containerType);
        }
    }

    public EdnEventType getEventType()
    {
        return eventType;
    }

    /**
     * @return the scalar of a {@link EdnEventType#VALUE} event; null otherwise.
     */
    public EdnValue getValue()
    {
        return value;
    }

    /**
     * @return the tag name of a {@link EdnEventType#TAG} event; null otherwise.
     */
    public String getTagName()
    {
        return tagName;
    }

    /**
     * @return the collection type of a container start or end event;
     *  null otherwise.
     */
    public EdnType getContainerType()
    {
        return containerType;
    }

    /**
     * @return the error of an {@link EdnEventType#ERROR} event; null otherwise.
     */
    public EdnError getError()
    {
        return error;
    }

    public boolean isError()
    {
        return eventType == EdnEventType.ERROR;
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof EdnEvent)) return false;
        EdnEvent that = (EdnEvent) other;
        return eventType == that.eventType
            && equal(value, that.value)
            && equal(tagName, that.tagName)
            && containerType == that.containerType
            && equal(error, that.error);
    }

    private static boolean equal(Object a, Object b)
    {
        return (a == null) ? (b == null) : a.equals(b);
    }

    @Override
    public int hashCode()
    {
        int result = eventType.ordinal();
        result = 31 * result + (value == null ? 0 : value.hashCode());
        result = 31 * result + (tagName == null ? 0 : tagName.hashCode());
        result = 31 * result + (containerType == null ? 0 : containerType.ordinal() + 1);
        result = 31 * result + (error == null ? 0 : error.hashCode());
        return result;
    }

    @Override
    public String toString()
    {
        switch (eventType)
        {
            case VALUE:           return "VALUE(" + value + ")";
            case TAG:             return "TAG(#" + tagName + ")";
            case CONTAINER_START: return "START(" + containerType + ")";
            case CONTAINER_END:   return "END(" + containerType + ")";
            default:              return "ERROR(" + error + ")";
        }
    }
}

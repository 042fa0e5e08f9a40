// Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
// SPDX-License-Identifier: Apache-2.0
package com.amazon.edn;

/**
 * Describes why an edn event stream ended: the {@link EdnErrorKind}, the
 * {@link EdnErrorCode}, and the 1-based line and column of the character at
 * which the problem was detected.
 * <p>
 * Instances are immutable. Equality ignores the message.
 */
public final class EdnError
{
    private final EdnErrorKind kind;
    private final EdnErrorCode code;
    private final long         line;
    private final long         column;
    private final String       message;

    public EdnError(EdnErrorKind kind, EdnErrorCode code, long line, long column, String message)
    {
        if (kind == null) throw new NullPointerException("kind");
        if (code == null) throw new NullPointerException("code");
        this.kind = kind;
        this.code = code;
        this.line = line;
        this.column = column;
        this.message = message;
    }

    public static EdnError syntax(EdnErrorCode code, long line, long column, String message)
    {
        return new EdnError(EdnErrorKind.SYNTAX, code, line, column, message);
    }

    public EdnErrorKind getKind()   { return kind; }
    public EdnErrorCode getCode()   { return code; }
    public long         getLine()   { return line; }
    public long         getColumn() { return column; }

    /**
     * @return a human-readable description; may be null.
     */
    public String getMessage()
    {
        return message;
    }

    @Override
    public boolean equals(Object other)
    {
        if (!(other instanceof EdnError)) return false;
        EdnError that = (EdnError) other;
        return kind == that.kind
            && code == that.code
            && line == that.line
            && column == that.column;
    }

    @Override
    public int hashCode()
    {
        int result = kind.ordinal();
        result = 31 * result + code.ordinal();
        result = 31 * result + Long.hashCode(line);
        result = 31 * result + Long.hashCode(column);
        return result;
    }

    @Override
    public String toString()
    {
        StringBuilder out = new StringBuilder();
        out.append(code).append(" at line ").append(line).append(" column ").append(column);
        if (message != null) {
            out.append(": ").append(message);
        }
        return out.toString();
    }
}

package com.taintgrep.engine.dataflow;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A syntactically known value: string, integer, boolean, null or unknown.
 */
public final class ConstantValue {

    public enum Kind {
        STRING,
        INTEGER,
        BOOLEAN,
        NULL,
        UNKNOWN
    }

    private static final Pattern INTEGER_LITERAL = Pattern.compile("[-+]?\\d{1,18}");

    public static final ConstantValue NULL = new ConstantValue(Kind.NULL, null);
    public static final ConstantValue UNKNOWN = new ConstantValue(Kind.UNKNOWN, null);
    public static final ConstantValue TRUE = new ConstantValue(Kind.BOOLEAN, Boolean.TRUE);
    public static final ConstantValue FALSE = new ConstantValue(Kind.BOOLEAN, Boolean.FALSE);

    private final Kind kind;
    private final Object value;

    private ConstantValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static ConstantValue ofString(String value) {
        return new ConstantValue(Kind.STRING, value);
    }

    public static ConstantValue ofInteger(long value) {
        return new ConstantValue(Kind.INTEGER, value);
    }

    public static ConstantValue ofBoolean(boolean value) {
        return value ? TRUE : FALSE;
    }

    /**
     * Fold a literal expression: integers, double-quoted strings, true, false, null.
     *
     * @param expression source text
     * @return folded value, or null when the text is not a literal
     */
    public static ConstantValue fold(String expression) {
        if (expression == null) {
            return null;
        }
        String text = expression.trim();
        if (text.isEmpty()) {
            return null;
        }
        if (INTEGER_LITERAL.matcher(text).matches()) {
            return ofInteger(Long.parseLong(text));
        }
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return ofString(text.substring(1, text.length() - 1));
        }
        if ("true".equals(text)) {
            return TRUE;
        }
        if ("false".equals(text)) {
            return FALSE;
        }
        if ("null".equals(text)) {
            return NULL;
        }
        return null;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isKnown() {
        return kind != Kind.UNKNOWN;
    }

    /**
     * @return true if the printed value contains the text; null and unknown never match
     */
    public boolean matchesPattern(String pattern) {
        if (kind == Kind.NULL || kind == Kind.UNKNOWN) {
            return false;
        }
        return String.valueOf(value).contains(pattern);
    }

    /**
     * @return printed value, "null" for null, or null when unknown
     */
    public String toStringValue() {
        switch (kind) {
            case NULL:
                return "null";
            case UNKNOWN:
                return null;
            default:
                return String.valueOf(value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConstantValue)) {
            return false;
        }
        ConstantValue that = (ConstantValue) o;
        return kind == that.kind && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind == Kind.STRING ? "\"" + value + "\"" : kind + "(" + toStringValue() + ")";
    }
}

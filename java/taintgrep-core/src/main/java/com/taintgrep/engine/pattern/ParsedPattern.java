package com.taintgrep.engine.pattern;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Internal AST of a pattern string.
 *
 * Leaf kinds carry a value (literal text, metavariable name, node kind);
 * SEQUENCE and ALTERNATIVE carry sub-patterns; WILDCARD carries nothing.
 */
public final class ParsedPattern {

    public enum Kind {
        LITERAL,
        METAVARIABLE,
        ELLIPSIS_METAVARIABLE,
        KIND_SELECTOR,
        SEQUENCE,
        ALTERNATIVE,
        WILDCARD
    }

    private static final ParsedPattern WILDCARD_PATTERN =
        new ParsedPattern(Kind.WILDCARD, null, Collections.<ParsedPattern>emptyList());

    private final Kind kind;
    private final String value;
    private final List<ParsedPattern> elements;

    private ParsedPattern(Kind kind, String value, List<ParsedPattern> elements) {
        this.kind = kind;
        this.value = value;
        this.elements = elements;
    }

    public static ParsedPattern literal(String text) {
        return new ParsedPattern(Kind.LITERAL, text, Collections.<ParsedPattern>emptyList());
    }

    public static ParsedPattern metavariable(String name) {
        return new ParsedPattern(Kind.METAVARIABLE, name, Collections.<ParsedPattern>emptyList());
    }

    public static ParsedPattern ellipsisMetavariable(String name) {
        return new ParsedPattern(Kind.ELLIPSIS_METAVARIABLE, name, Collections.<ParsedPattern>emptyList());
    }

    public static ParsedPattern kindSelector(String nodeKind) {
        return new ParsedPattern(Kind.KIND_SELECTOR, nodeKind, Collections.<ParsedPattern>emptyList());
    }

    public static ParsedPattern sequence(List<ParsedPattern> elements) {
        return new ParsedPattern(Kind.SEQUENCE, null,
            Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static ParsedPattern sequence(ParsedPattern... elements) {
        return sequence(Arrays.asList(elements));
    }

    public static ParsedPattern alternative(List<ParsedPattern> elements) {
        return new ParsedPattern(Kind.ALTERNATIVE, null,
            Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static ParsedPattern alternative(ParsedPattern... elements) {
        return alternative(Arrays.asList(elements));
    }

    public static ParsedPattern wildcard() {
        return WILDCARD_PATTERN;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return literal text, metavariable name or node kind; null for composite kinds
     */
    public String getValue() {
        return value;
    }

    public List<ParsedPattern> getElements() {
        return elements;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ParsedPattern)) {
            return false;
        }
        ParsedPattern that = (ParsedPattern) o;
        return kind == that.kind
            && Objects.equals(value, that.value)
            && elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, elements);
    }

    @Override
    public String toString() {
        switch (kind) {
            case LITERAL:
                return "\"" + value + "\"";
            case METAVARIABLE:
                return "$" + value;
            case ELLIPSIS_METAVARIABLE:
                return "$..." + value;
            case KIND_SELECTOR:
                return "@" + value;
            case SEQUENCE:
                return join(" ");
            case ALTERNATIVE:
                return join(" | ");
            default:
                return "...";
        }
    }

    private String join(String separator) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < elements.size(); i++) {
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(elements.get(i));
        }
        return sb.append(")").toString();
    }
}

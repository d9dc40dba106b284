package com.taintgrep.engine.tree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The one concrete node type per-language adapters populate.
 *
 * A string kind tag, a children list and an attribute map replace a per-language
 * class hierarchy. Instances are built bottom-up and are not modified once handed
 * to the engine.
 */
public class UniversalNode implements TreeNode {
    private final String kind;
    private final String text;
    private final SourceSpan span;
    private final List<UniversalNode> children;
    private final Map<String, String> attributes;

    public UniversalNode(String kind, String text, SourceSpan span,
                         List<UniversalNode> children, Map<String, String> attributes) {
        if (kind == null || kind.isEmpty()) {
            throw new IllegalArgumentException("Node kind is required");
        }
        this.kind = kind;
        this.text = text;
        this.span = span;
        this.children = children != null
            ? Collections.unmodifiableList(new ArrayList<>(children))
            : Collections.emptyList();
        this.attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
    }

    public static UniversalNode leaf(String kind, String text) {
        return new UniversalNode(kind, text, null, null, null);
    }

    public static UniversalNode leaf(String kind, String text, SourceSpan span) {
        return new UniversalNode(kind, text, span, null, null);
    }

    public static UniversalNode branch(String kind, String text, UniversalNode... children) {
        return new UniversalNode(kind, text, null, Arrays.asList(children), null);
    }

    public static UniversalNode branch(String kind, String text, SourceSpan span, UniversalNode... children) {
        return new UniversalNode(kind, text, span, Arrays.asList(children), null);
    }

    public static Builder builder(String kind) {
        return new Builder(kind);
    }

    @Override
    public String getKind() {
        return kind;
    }

    @Override
    public List<UniversalNode> getChildren() {
        return children;
    }

    @Override
    public SourceSpan getSpan() {
        return span;
    }

    @Override
    public String getText() {
        return text;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public String getAttribute(String key) {
        return attributes.get(key);
    }

    @Override
    public String toString() {
        return kind + (text != null ? "[" + text + "]" : "");
    }

    public static final class Builder {
        private final String kind;
        private String text;
        private SourceSpan span;
        private final List<UniversalNode> children = new ArrayList<>();
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(String kind) {
            this.kind = kind;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder span(SourceSpan span) {
            this.span = span;
            return this;
        }

        public Builder child(UniversalNode child) {
            if (child != null) {
                children.add(child);
            }
            return this;
        }

        public Builder attribute(String key, String value) {
            if (key != null && value != null) {
                attributes.put(key, value);
            }
            return this;
        }

        public int childCount() {
            return children.size();
        }

        public UniversalNode build() {
            return new UniversalNode(kind, text, span, children, attributes);
        }
    }
}

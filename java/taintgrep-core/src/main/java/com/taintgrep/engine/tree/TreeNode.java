package com.taintgrep.engine.tree;

import java.util.List;

/**
 * Read-only node shape every language front end must expose.
 *
 * Implementations are immutable from the engine's point of view: matching,
 * graph building and rule execution only read these properties.
 */
public interface TreeNode {

    /**
     * @return kind tag, e.g. {@code call_expression} or {@code identifier}
     */
    String getKind();

    /**
     * @return ordered children, never null
     */
    List<? extends TreeNode> getChildren();

    /**
     * @return 1-based source span, or null when the front end has none
     */
    SourceSpan getSpan();

    /**
     * @return raw source text, or null for synthetic nodes
     */
    String getText();

    default int getChildCount() {
        return getChildren().size();
    }

    default TreeNode getChild(int index) {
        List<? extends TreeNode> children = getChildren();
        if (index < 0 || index >= children.size()) {
            return null;
        }
        return children.get(index);
    }
}

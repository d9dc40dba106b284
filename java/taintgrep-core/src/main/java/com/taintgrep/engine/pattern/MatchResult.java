package com.taintgrep.engine.pattern;

import com.taintgrep.engine.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ============================================
// MatchResult: matched node, its bindings and ancestor chain
// ============================================
public class MatchResult {
    private final TreeNode node;
    private final Map<String, String> bindings;
    private final List<TreeNode> ancestors;

    public MatchResult(TreeNode node, Map<String, String> bindings, List<? extends TreeNode> ancestors) {
        this.node = node;
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
        this.ancestors = Collections.unmodifiableList(new ArrayList<TreeNode>(ancestors));
    }

    public TreeNode getNode() {
        return node;
    }

    public Map<String, String> getBindings() {
        return bindings;
    }

    /**
     * @return ancestors of the matched node, root first
     */
    public List<TreeNode> getAncestors() {
        return ancestors;
    }

    @Override
    public String toString() {
        return node + " " + bindings;
    }
}

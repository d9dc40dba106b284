package com.taintgrep.engine.pattern;

import com.taintgrep.engine.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Narrows a match to the nodes holding its focused bindings.
 */
public class FocusResolver {

    /**
     * @param match structural match
     * @param focus metavariable names to focus on
     * @return one node per focus name, in order; the matched node stands in for a
     *         name that is unbound or whose text no subtree node carries
     */
    public List<TreeNode> resolve(MatchResult match, List<String> focus) {
        List<TreeNode> nodes = new ArrayList<>();
        if (focus == null || focus.isEmpty()) {
            nodes.add(match.getNode());
            return nodes;
        }
        for (String name : focus) {
            String text = match.getBindings().get(name);
            TreeNode found = text != null ? findByText(match.getNode(), text) : null;
            TreeNode target = found != null ? found : match.getNode();
            if (!containsSame(nodes, target)) {
                nodes.add(target);
            }
        }
        return nodes;
    }

    private TreeNode findByText(TreeNode node, String text) {
        if (text.equals(node.getText())) {
            return node;
        }
        for (TreeNode child : node.getChildren()) {
            TreeNode found = findByText(child, text);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private static boolean containsSame(List<TreeNode> nodes, TreeNode node) {
        for (TreeNode existing : nodes) {
            if (existing == node) {
                return true;
            }
        }
        return false;
    }
}

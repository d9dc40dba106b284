package com.taintgrep.engine.dataflow;

import com.taintgrep.engine.tree.TreeNode;

// ============================================
// DataFlowNode: graph vertex wrapping one tree node
// ============================================
public class DataFlowNode {
    private final int id;
    private final TreeNode treeNode;

    public DataFlowNode(int id, TreeNode treeNode) {
        this.id = id;
        this.treeNode = treeNode;
    }

    public int getId() {
        return id;
    }

    public TreeNode getTreeNode() {
        return treeNode;
    }

    public String getKind() {
        return treeNode.getKind();
    }

    /**
     * @return text of the wrapped node, or null
     */
    public String getText() {
        return treeNode.getText();
    }

    @Override
    public String toString() {
        return "#" + id + " " + treeNode.getKind() + (treeNode.getText() != null ? "[" + treeNode.getText() + "]" : "");
    }
}

package com.taintgrep.engine.dataflow;

import com.taintgrep.engine.tree.TreeNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// ============================================
// DataFlowGraph: control and data-flow edges over tree nodes
// ============================================
public class DataFlowGraph {
    private final Map<Integer, DataFlowNode> nodes;
    private final Map<Integer, List<DataFlowEdge>> edges;
    private final Map<Integer, List<DataFlowEdge>> reverseEdges;
    private int nextId;
    private int edgeCount;

    public DataFlowGraph() {
        this.nodes = new LinkedHashMap<>();
        this.edges = new HashMap<>();
        this.reverseEdges = new HashMap<>();
    }

    /**
     * @param treeNode node to wrap
     * @return id of the new graph node
     */
    public int addNode(TreeNode treeNode) {
        if (treeNode == null) {
            throw new IllegalArgumentException("Tree node is required");
        }
        int id = nextId++;
        nodes.put(id, new DataFlowNode(id, treeNode));
        return id;
    }

    /**
     * Add an edge. Parallel edges between the same pair are kept.
     *
     * @throws IllegalArgumentException if either id is unknown
     */
    public void addEdge(int from, int to, EdgeKind kind) {
        requireNode(from);
        requireNode(to);
        DataFlowEdge edge = new DataFlowEdge(from, to, kind);
        edges.computeIfAbsent(from, ignored -> new ArrayList<>()).add(edge);
        reverseEdges.computeIfAbsent(to, ignored -> new ArrayList<>()).add(edge);
        edgeCount++;
    }

    /**
     * @throws IllegalArgumentException if no node has the id
     */
    public DataFlowNode getNode(int id) {
        return requireNode(id);
    }

    public boolean containsNode(int id) {
        return nodes.containsKey(id);
    }

    public Collection<DataFlowNode> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public List<Integer> getNodeIds() {
        return new ArrayList<>(nodes.keySet());
    }

    public List<DataFlowEdge> outgoingEdges(int id) {
        return Collections.unmodifiableList(edges.getOrDefault(id, Collections.<DataFlowEdge>emptyList()));
    }

    public List<DataFlowEdge> incomingEdges(int id) {
        return Collections.unmodifiableList(reverseEdges.getOrDefault(id, Collections.<DataFlowEdge>emptyList()));
    }

    public List<Integer> successors(int id) {
        return endpoints(edges.get(id), false, false);
    }

    public List<Integer> predecessors(int id) {
        return endpoints(reverseEdges.get(id), true, false);
    }

    public List<Integer> dataFlowSuccessors(int id) {
        return endpoints(edges.get(id), false, true);
    }

    public List<Integer> dataFlowPredecessors(int id) {
        return endpoints(reverseEdges.get(id), true, true);
    }

    private static List<Integer> endpoints(List<DataFlowEdge> list, boolean source, boolean dataOnly) {
        if (list == null) {
            return Collections.emptyList();
        }
        Set<Integer> ids = new LinkedHashSet<>();
        for (DataFlowEdge edge : list) {
            if (!dataOnly || edge.isDataFlow()) {
                ids.add(source ? edge.getFrom() : edge.getTo());
            }
        }
        return new ArrayList<>(ids);
    }

    public boolean hasDataFlowEdge(int from, int to) {
        for (DataFlowEdge edge : edges.getOrDefault(from, Collections.<DataFlowEdge>emptyList())) {
            if (edge.getTo() == to && edge.isDataFlow()) {
                return true;
            }
        }
        return false;
    }

    /**
     * All simple paths over data-flow edges.
     *
     * @return each path as node ids from {@code from} to {@code to}; empty if none
     */
    public List<List<Integer>> findPaths(int from, int to) {
        requireNode(from);
        requireNode(to);
        List<List<Integer>> paths = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        current.add(from);
        Set<Integer> onPath = new LinkedHashSet<>();
        onPath.add(from);
        walk(from, to, current, onPath, paths);
        return paths;
    }

    private void walk(int node, int target, List<Integer> current, Set<Integer> onPath, List<List<Integer>> paths) {
        if (node == target && current.size() > 1) {
            paths.add(new ArrayList<>(current));
            return;
        }
        for (int next : dataFlowSuccessors(node)) {
            if (onPath.contains(next)) {
                continue;
            }
            current.add(next);
            onPath.add(next);
            walk(next, target, current, onPath, paths);
            onPath.remove(next);
            current.remove(current.size() - 1);
        }
    }

    public List<Integer> nodesByKind(String kind) {
        List<Integer> ids = new ArrayList<>();
        for (DataFlowNode node : nodes.values()) {
            if (node.getKind().equals(kind)) {
                ids.add(node.getId());
            }
        }
        return ids;
    }

    /**
     * @return graph node id wrapping exactly this tree node instance, or -1
     */
    public int findByTreeNode(TreeNode treeNode) {
        for (DataFlowNode node : nodes.values()) {
            if (node.getTreeNode() == treeNode) {
                return node.getId();
            }
        }
        return -1;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edgeCount;
    }

    public void clear() {
        nodes.clear();
        edges.clear();
        reverseEdges.clear();
        nextId = 0;
        edgeCount = 0;
    }

    private DataFlowNode requireNode(int id) {
        DataFlowNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("No data-flow node with id " + id);
        }
        return node;
    }
}

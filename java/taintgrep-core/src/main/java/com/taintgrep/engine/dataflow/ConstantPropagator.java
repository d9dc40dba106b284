package com.taintgrep.engine.dataflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Syntactic constant propagation over a {@link DataFlowGraph}.
 *
 * Literal nodes and assignments of a literal seed the node map; a fixed-point
 * pass then copies a predecessor's constant to every data-flow successor that
 * has none. The pass is capped so cyclic graphs terminate.
 */
public class ConstantPropagator {
    private static final Logger logger = LoggerFactory.getLogger(ConstantPropagator.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;

    private final int maxIterations;
    private final Map<String, ConstantValue> constants = new LinkedHashMap<>();
    private final Map<Integer, ConstantValue> nodeConstants = new LinkedHashMap<>();
    private final Set<String> reassigned = new HashSet<>();
    private int iterations;

    public ConstantPropagator() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public ConstantPropagator(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    /**
     * Recompute constants for the graph, discarding earlier results.
     */
    public void analyze(DataFlowGraph graph) {
        constants.clear();
        nodeConstants.clear();
        reassigned.clear();
        collect(graph);
        propagate(graph);
        logger.debug("Constant propagation: {} named, {} node constants after {} iteration(s)",
            constants.size(), nodeConstants.size(), iterations);
    }

    // ============================================
    // 1. SEEDING
    // ============================================

    private void collect(DataFlowGraph graph) {
        Map<String, Integer> assignmentCounts = new HashMap<>();

        for (DataFlowNode node : graph.getNodes()) {
            if (isLiteral(node.getKind())) {
                ConstantValue value = ConstantValue.fold(node.getText());
                if (value != null) {
                    nodeConstants.put(node.getId(), value);
                }
                continue;
            }
            if (!isAssignment(node.getKind())) {
                continue;
            }

            List<Integer> children = controlChildren(graph, node.getId());
            if (children.isEmpty()) {
                continue;
            }
            DataFlowNode target = graph.getNode(children.get(0));
            if (!DataFlowGraphBuilder.IDENTIFIER.equals(target.getKind()) || target.getText() == null) {
                continue;
            }
            String name = target.getText();
            int count = assignmentCounts.merge(name, 1, Integer::sum);
            if (count > 1) {
                markReassigned(name);
            }

            if (children.size() < 2) {
                continue;
            }
            DataFlowNode valueNode = graph.getNode(children.get(children.size() - 1));
            ConstantValue value = isLiteral(valueNode.getKind()) ? ConstantValue.fold(valueNode.getText()) : null;
            if (value != null) {
                nodeConstants.put(node.getId(), value);
                if (!reassigned.contains(name)) {
                    constants.put(name, value);
                }
            }
        }
    }

    private static List<Integer> controlChildren(DataFlowGraph graph, int id) {
        List<Integer> children = new ArrayList<>();
        for (DataFlowEdge edge : graph.outgoingEdges(id)) {
            if (edge.getKind() == EdgeKind.CONTROL_FLOW) {
                children.add(edge.getTo());
            }
        }
        return children;
    }

    static boolean isLiteral(String kind) {
        return kind.endsWith("literal") || "true".equals(kind) || "false".equals(kind)
            || "null".equals(kind) || "number".equals(kind) || "string".equals(kind);
    }

    private static boolean isAssignment(String kind) {
        return DataFlowGraphBuilder.ASSIGNMENT.equals(kind) || DataFlowGraphBuilder.DECLARATOR.equals(kind);
    }

    // ============================================
    // 2. RELAXATION
    // ============================================

    private void propagate(DataFlowGraph graph) {
        boolean changed = true;
        iterations = 0;
        List<Integer> ids = graph.getNodeIds();

        while (changed && iterations < maxIterations) {
            changed = false;
            iterations++;
            for (int id : ids) {
                if (nodeConstants.containsKey(id)) {
                    continue;
                }
                for (int predecessor : graph.dataFlowPredecessors(id)) {
                    ConstantValue value = nodeConstants.get(predecessor);
                    if (value != null) {
                        nodeConstants.put(id, value);
                        changed = true;
                        break;
                    }
                }
            }
        }
    }

    // ============================================
    // 3. RESULTS
    // ============================================

    public ConstantValue getConstant(String name) {
        return constants.get(name);
    }

    public ConstantValue getNodeConstant(int nodeId) {
        return nodeConstants.get(nodeId);
    }

    public boolean isConstant(String name) {
        return constants.containsKey(name) && !reassigned.contains(name);
    }

    public void markReassigned(String name) {
        reassigned.add(name);
        constants.remove(name);
    }

    public boolean isReassigned(String name) {
        return reassigned.contains(name);
    }

    public Map<String, ConstantValue> getConstants() {
        return Collections.unmodifiableMap(constants);
    }

    public Map<Integer, ConstantValue> getNodeConstants() {
        return Collections.unmodifiableMap(nodeConstants);
    }

    /**
     * @return relaxation rounds used by the last {@link #analyze(DataFlowGraph)}
     */
    public int getIterations() {
        return iterations;
    }
}

package com.taintgrep.engine.dataflow;

import com.taintgrep.engine.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link DataFlowGraph} from a tree in one pre-order traversal.
 *
 * Every parent gets a control-flow edge to each child. Data-flow edges follow
 * the value: arguments into calls, right-hand sides into assignments, the
 * assignment into its target identifier, and each definition of a name into
 * the later identifier reads of that name. Definitions made inside a function
 * body stay inside it; the body sees the enclosing definitions but not those
 * of sibling functions.
 */
public class DataFlowGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(DataFlowGraphBuilder.class);

    public static final String ASSIGNMENT = "assignment_expression";
    public static final String DECLARATOR = "variable_declarator";
    public static final String CALL = "call_expression";
    public static final String RETURN = "return_statement";
    public static final String IDENTIFIER = "identifier";

    private static final Set<String> FUNCTION_KINDS = new HashSet<>(Arrays.asList(
        "method_declaration", "constructor_declaration", "function_declaration", "function_definition",
        "method_definition", "function_expression", "arrow_function", "lambda_expression"));

    private enum Role {
        PLAIN,
        TARGET,
        CALLEE
    }

    public DataFlowGraph build(TreeNode root) {
        DataFlowGraph graph = new DataFlowGraph();
        if (root != null) {
            visit(graph, root, Role.PLAIN, new HashMap<String, Integer>());
        }
        logger.debug("Built data-flow graph: {} nodes, {} edges", graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    private int visit(DataFlowGraph graph, TreeNode node, Role role, Map<String, Integer> definitions) {
        int id = graph.addNode(node);
        String kind = node.getKind();

        if (IDENTIFIER.equals(kind) && role == Role.PLAIN && node.getText() != null) {
            Integer definition = definitions.get(node.getText());
            if (definition != null) {
                graph.addEdge(definition, id, EdgeKind.DATA_FLOW);
            }
        }

        Map<String, Integer> scope = FUNCTION_KINDS.contains(kind)
            ? new HashMap<String, Integer>(definitions)
            : definitions;
        boolean assignment = ASSIGNMENT.equals(kind) || DECLARATOR.equals(kind);
        List<? extends TreeNode> children = node.getChildren();
        Integer target = null;

        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            boolean bareIdentifier = IDENTIFIER.equals(child.getKind());
            Role childRole = Role.PLAIN;
            if (assignment && i == 0 && bareIdentifier) {
                childRole = Role.TARGET;
            } else if (CALL.equals(kind) && i == 0 && bareIdentifier) {
                childRole = Role.CALLEE;
            }

            int childId = visit(graph, child, childRole, scope);
            graph.addEdge(id, childId, EdgeKind.CONTROL_FLOW);

            if (assignment) {
                if (childRole == Role.TARGET) {
                    graph.addEdge(id, childId, EdgeKind.DATA_FLOW);
                    target = childId;
                } else {
                    graph.addEdge(childId, id, EdgeKind.DATA_FLOW);
                }
            } else if (CALL.equals(kind)) {
                if (childRole != Role.CALLEE) {
                    graph.addEdge(childId, id, EdgeKind.DATA_FLOW);
                }
            } else if (RETURN.equals(kind)) {
                graph.addEdge(childId, id, EdgeKind.DATA_FLOW);
            }
        }

        if (target != null) {
            String name = graph.getNode(target).getText();
            if (name != null) {
                scope.put(name, target);
            }
        }
        return id;
    }
}

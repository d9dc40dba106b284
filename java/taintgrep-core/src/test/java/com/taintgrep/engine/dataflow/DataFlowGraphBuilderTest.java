package com.taintgrep.engine.dataflow;

import com.taintgrep.engine.SampleTrees;
import com.taintgrep.engine.tree.UniversalNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataFlowGraphBuilderTest {

    private final DataFlowGraphBuilder builder = new DataFlowGraphBuilder();

    // id = request.getParameter("id"); stmt.executeQuery(id)
    private static UniversalNode program() {
        return UniversalNode.branch("program", null,
            UniversalNode.branch("assignment_expression", "id = request.getParameter(\"id\")",
                UniversalNode.leaf("identifier", "id"),
                UniversalNode.branch("call_expression", "request.getParameter(\"id\")",
                    UniversalNode.leaf("identifier", "request.getParameter"),
                    UniversalNode.leaf("string_literal", "\"id\""))),
            UniversalNode.branch("call_expression", "stmt.executeQuery(id)",
                UniversalNode.leaf("identifier", "stmt.executeQuery"),
                UniversalNode.leaf("identifier", "id")));
    }

    @Test
    void preOrderIdsAndControlEdges() {
        DataFlowGraph graph = builder.build(program());

        assertEquals(9, graph.nodeCount());
        assertEquals("program", graph.getNode(0).getKind());
        assertEquals("assignment_expression", graph.getNode(1).getKind());
        assertEquals("stmt.executeQuery(id)", graph.getNode(6).getText());
        assertTrue(graph.successors(0).contains(1));
        assertTrue(graph.successors(0).contains(6));
    }

    @Test
    void valueFlowsThroughAssignmentIntoLaterRead() {
        DataFlowGraph graph = builder.build(program());

        assertTrue(graph.hasDataFlowEdge(3, 1));
        assertTrue(graph.hasDataFlowEdge(1, 2));
        assertTrue(graph.hasDataFlowEdge(2, 8));
        assertTrue(graph.hasDataFlowEdge(8, 6));
        assertEquals(1, graph.findPaths(3, 6).size());
    }

    @Test
    void calleeIdentifierDoesNotFlowIntoCall() {
        DataFlowGraph graph = builder.build(program());

        assertFalse(graph.hasDataFlowEdge(7, 6));
        assertFalse(graph.hasDataFlowEdge(4, 3));
        assertTrue(graph.hasDataFlowEdge(5, 3));
    }

    @Test
    void definitionsDoNotLeakIntoSiblingMethods() {
        DataFlowGraph graph = builder.build(SampleTrees.unrelatedMethods());

        assertEquals("q", graph.getNode(3).getText());
        assertEquals("q", graph.getNode(10).getText());
        assertFalse(graph.hasDataFlowEdge(3, 10));
        assertTrue(graph.dataFlowPredecessors(10).isEmpty());
        assertTrue(graph.findPaths(4, 8).isEmpty());
    }

    @Test
    void classLevelDefinitionsReachMethodBodies() {
        UniversalNode clazz = UniversalNode.branch("class_declaration", "Config",
            UniversalNode.branch("variable_declarator", "SECRET = \"x\"",
                UniversalNode.leaf("identifier", "SECRET"),
                UniversalNode.leaf("string_literal", "\"x\"")),
            UniversalNode.branch("method_declaration", "use",
                UniversalNode.branch("call_expression", "send(SECRET)",
                    UniversalNode.leaf("identifier", "send"),
                    UniversalNode.leaf("identifier", "SECRET"))));

        DataFlowGraph graph = builder.build(clazz);

        assertTrue(graph.hasDataFlowEdge(2, 7));
        assertTrue(graph.hasDataFlowEdge(7, 5));
    }

    @Test
    void readBeforeDefinitionHasNoIncomingFlow() {
        UniversalNode tree = UniversalNode.branch("program", null,
            UniversalNode.branch("call_expression", "use(x)",
                UniversalNode.leaf("identifier", "use"),
                UniversalNode.leaf("identifier", "x")),
            UniversalNode.branch("variable_declarator", "x = 1",
                UniversalNode.leaf("identifier", "x"),
                UniversalNode.leaf("number_literal", "1")));

        DataFlowGraph graph = builder.build(tree);

        assertTrue(graph.dataFlowPredecessors(3).isEmpty());
        assertTrue(graph.hasDataFlowEdge(6, 4));
        assertTrue(graph.hasDataFlowEdge(4, 5));
    }

    @Test
    void returnReceivesItsValue() {
        UniversalNode tree = UniversalNode.branch("return_statement", "return y",
            UniversalNode.leaf("identifier", "y"));

        DataFlowGraph graph = builder.build(tree);

        assertTrue(graph.hasDataFlowEdge(1, 0));
    }

    @Test
    void nullRootGivesEmptyGraph() {
        assertEquals(0, builder.build(null).nodeCount());
    }
}

package com.taintgrep.engine.dataflow;

import com.taintgrep.engine.tree.UniversalNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataFlowGraphTest {

    @Test
    void idsAreAssignedInInsertionOrder() {
        DataFlowGraph graph = new DataFlowGraph();

        assertEquals(0, graph.addNode(UniversalNode.leaf("identifier", "a")));
        assertEquals(1, graph.addNode(UniversalNode.leaf("identifier", "b")));
        assertEquals(Arrays.asList(0, 1), graph.getNodeIds());
    }

    @Test
    void unknownIdsAreRejected() {
        DataFlowGraph graph = new DataFlowGraph();
        graph.addNode(UniversalNode.leaf("identifier", "a"));

        assertThrows(IllegalArgumentException.class, () -> graph.getNode(7));
        assertThrows(IllegalArgumentException.class, () -> graph.addEdge(0, 7, EdgeKind.DATA_FLOW));
        assertThrows(IllegalArgumentException.class, () -> graph.addNode(null));
    }

    @Test
    void dataFlowQueriesIgnoreControlEdges() {
        DataFlowGraph graph = new DataFlowGraph();
        int a = graph.addNode(UniversalNode.leaf("identifier", "a"));
        int b = graph.addNode(UniversalNode.leaf("identifier", "b"));
        int c = graph.addNode(UniversalNode.leaf("identifier", "c"));
        graph.addEdge(a, b, EdgeKind.CONTROL_FLOW);
        graph.addEdge(a, c, EdgeKind.DATA_FLOW);

        assertEquals(Arrays.asList(b, c), graph.successors(a));
        assertEquals(Arrays.asList(c), graph.dataFlowSuccessors(a));
        assertEquals(Arrays.asList(a), graph.dataFlowPredecessors(c));
        assertTrue(graph.hasDataFlowEdge(a, c));
        assertFalse(graph.hasDataFlowEdge(a, b));
        assertEquals(2, graph.edgeCount());
    }

    @Test
    void findPathsEnumeratesSimplePaths() {
        DataFlowGraph graph = new DataFlowGraph();
        for (int i = 0; i < 4; i++) {
            graph.addNode(UniversalNode.leaf("identifier", "n" + i));
        }
        graph.addEdge(0, 1, EdgeKind.DATA_FLOW);
        graph.addEdge(1, 3, EdgeKind.DATA_FLOW);
        graph.addEdge(0, 2, EdgeKind.DATA_FLOW);
        graph.addEdge(2, 3, EdgeKind.DATA_FLOW);
        graph.addEdge(3, 0, EdgeKind.DATA_FLOW);

        List<List<Integer>> paths = graph.findPaths(0, 3);

        assertEquals(2, paths.size());
        assertEquals(Arrays.asList(0, 1, 3), paths.get(0));
        assertEquals(Arrays.asList(0, 2, 3), paths.get(1));
        assertTrue(graph.findPaths(3, 1).contains(Arrays.asList(3, 0, 1)));
    }

    @Test
    void lookupByKindAndTreeNode() {
        DataFlowGraph graph = new DataFlowGraph();
        UniversalNode call = UniversalNode.leaf("call_expression", "f()");
        graph.addNode(UniversalNode.leaf("identifier", "x"));
        int id = graph.addNode(call);

        assertEquals(Arrays.asList(id), graph.nodesByKind("call_expression"));
        assertEquals(id, graph.findByTreeNode(call));
        assertEquals(-1, graph.findByTreeNode(UniversalNode.leaf("call_expression", "f()")));

        graph.clear();
        assertEquals(0, graph.nodeCount());
        assertEquals(0, graph.addNode(call));
    }
}

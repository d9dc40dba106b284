package com.taintgrep.engine.bytecode;

import com.taintgrep.engine.dataflow.CallGraph;
import com.taintgrep.engine.dataflow.CallSite;
import com.taintgrep.engine.dataflow.FunctionDefinition;
import com.taintgrep.engine.dataflow.FunctionId;
import com.taintgrep.engine.dataflow.FunctionSignature;
import com.taintgrep.engine.dataflow.ParameterMapping;
import com.taintgrep.engine.fixtures.ClassFiles;
import com.taintgrep.engine.fixtures.ScriptRunner;
import com.taintgrep.engine.fixtures.UserLookup;
import com.taintgrep.engine.tree.UniversalNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BytecodeCallGraphBuilderTest {

    private static final String LOOKUP = "com.taintgrep.engine.fixtures.UserLookup";

    private final BytecodeTreeBuilder treeBuilder = new BytecodeTreeBuilder();
    private final BytecodeCallGraphBuilder callGraphBuilder = new BytecodeCallGraphBuilder();
    private List<UniversalNode> classes;

    @BeforeEach
    void setUp() {
        classes = Arrays.asList(
            treeBuilder.build(ClassFiles.bytesOf(UserLookup.class)),
            treeBuilder.build(ClassFiles.bytesOf(ScriptRunner.class)));
    }

    @Test
    void everyMethodIsRegistered() {
        CallGraph graph = new CallGraph();
        List<FunctionId> ids = callGraphBuilder.register(classes, graph);

        assertEquals(6, ids.size());
        assertEquals(6, graph.functionCount());
        FunctionDefinition find = graph.getFunction(ids.get(1));
        assertEquals(new FunctionSignature(LOOKUP + ".find", 1, "java"), find.getSignature());
        assertEquals(Collections.singletonList("request"), find.getParameters());
        assertEquals("java.sql.ResultSet", find.getReturnType());
        assertEquals(BytecodeCallGraphBuilder.NO_NODE, find.getNodeId());
    }

    @Test
    void callsBetweenGivenClassesAreMapped() {
        CallGraph graph = callGraphBuilder.build(classes);
        FunctionId checked = graph.findFunction(BytecodeCallGraphBuilder.signature(LOOKUP, "findChecked", 1));
        FunctionId validate = graph.findFunction(BytecodeCallGraphBuilder.signature(LOOKUP, "validate", 1));
        assertNotNull(checked);
        assertNotNull(validate);

        CallSite site = null;
        for (CallSite call : graph.callsFrom(checked)) {
            if (call.getCalleeSignature().getName().equals(LOOKUP + ".validate")) {
                site = call;
            }
        }
        assertNotNull(site);
        ParameterMapping mapping = graph.getParameterMapping(site.getId());
        assertEquals("id", mapping.getArgument(0));
        assertTrue(graph.hasCallPath(checked, validate));
        assertEquals(Arrays.asList(checked, validate), graph.tracePath(checked, validate));
    }

    @Test
    void libraryCallsStayUnresolved() {
        CallGraph graph = callGraphBuilder.build(classes);
        FunctionId find = graph.findFunction(BytecodeCallGraphBuilder.signature(LOOKUP, "find", 1));

        FunctionSignature executeQuery = BytecodeCallGraphBuilder.signature("java.sql.Statement", "executeQuery", 1);
        assertTrue(graph.findCallees(find).contains(executeQuery));
        FunctionId checked = graph.findFunction(BytecodeCallGraphBuilder.signature(LOOKUP, "findChecked", 1));
        assertEquals(Arrays.asList(find, checked), graph.findCallers(executeQuery));
        for (CallSite call : graph.callsFrom(find)) {
            assertNull(graph.getParameterMapping(call.getId()));
            assertFalse(call.getCalleeSignature().getName().contains("makeConcatWithConstants"));
        }
    }
}

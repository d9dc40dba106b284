package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.CallGraph;
import com.taintgrep.engine.dataflow.FunctionId;
import com.taintgrep.engine.dataflow.FunctionSignature;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InterproceduralTaintTrackerTest {

    private CallGraph graph;
    private FunctionId handle;
    private FunctionId load;
    private FunctionId run;
    private InterproceduralTaintTracker tracker;

    @BeforeEach
    void setUp() {
        graph = new CallGraph();
        FunctionSignature handleSig = new FunctionSignature("Controller.handle", 1, "java");
        FunctionSignature loadSig = new FunctionSignature("Dao.load", 1, "java");
        FunctionSignature runSig = new FunctionSignature("Dao.run", 1, "java");
        handle = graph.addFunction(handleSig, Collections.singletonList("request"), "void", 0);
        load = graph.addFunction(loadSig, Collections.singletonList("id"), "String", 1);
        run = graph.addFunction(runSig, Collections.singletonList("sql"), "void", 2);
        graph.addCall(handle, loadSig, Collections.singletonList("request.id"), 10);
        graph.addCall(load, runSig, Collections.singletonList("\"select * from t where id=\" + id"), 11);
        graph.addCall(run, handleSig, Collections.singletonList("sql"), 12);

        tracker = new InterproceduralTaintTracker(graph);
        tracker.registerSinkParameter(run, "sql", "Statement.executeQuery");
    }

    @Test
    void taintReachesSinkThroughCallChain() {
        List<InterproceduralFlow> flows = tracker.trace(handle, Collections.singletonList("request"));

        assertEquals(1, flows.size());
        InterproceduralFlow flow = flows.get(0);
        assertEquals(Arrays.asList(handle, load, run), flow.getCallChain());
        assertEquals(handle, flow.getEntry());
        assertEquals(run, flow.getSinkFunction());
        assertEquals("sql", flow.getParameter());
        assertEquals("Statement.executeQuery", flow.getSinkDescription());
        assertEquals(0.81, flow.getConfidence(), 1e-9);
    }

    @Test
    void sanitizedParameterStopsPropagation() {
        tracker.registerSanitizedParameter(load, "id");

        List<InterproceduralFlow> flows = tracker.trace(handle, Collections.singletonList("request"));

        assertTrue(flows.isEmpty());
        assertEquals(0.9, tracker.getEntryTaints(load).get("id"), 1e-9);
        assertTrue(tracker.getExitTaints(load).isEmpty());
        assertTrue(tracker.getEntryTaints(run).isEmpty());
    }

    @Test
    void untaintedArgumentsDoNotPropagate() {
        List<InterproceduralFlow> flows = tracker.trace(handle, Collections.singletonList("requestId"));

        assertTrue(flows.isEmpty());
        assertTrue(tracker.getEntryTaints(load).isEmpty());
    }

    @Test
    void sinkInEntryFunctionIsReportedDirectly() {
        List<InterproceduralFlow> flows = tracker.trace(run, Collections.singletonList("sql"));

        assertEquals(1, flows.size());
        assertEquals(Collections.singletonList(run), flows.get(0).getCallChain());
        assertEquals(1.0, flows.get(0).getConfidence(), 1e-9);
    }

    @Test
    void sharedCalleeIsReachedOncePerPath() {
        CallGraph diamond = new CallGraph();
        FunctionSignature entrySig = new FunctionSignature("Api.submit", 1, "java");
        FunctionSignature auditSig = new FunctionSignature("Audit.record", 1, "java");
        FunctionSignature cacheSig = new FunctionSignature("Cache.put", 1, "java");
        FunctionSignature storeSig = new FunctionSignature("Store.write", 1, "java");
        FunctionId entry = diamond.addFunction(entrySig, Collections.singletonList("input"), "void", 0);
        FunctionId audit = diamond.addFunction(auditSig, Collections.singletonList("event"), "void", 1);
        FunctionId cache = diamond.addFunction(cacheSig, Collections.singletonList("value"), "void", 2);
        FunctionId store = diamond.addFunction(storeSig, Collections.singletonList("row"), "void", 3);
        diamond.addCall(entry, auditSig, Collections.singletonList("input"), 10);
        diamond.addCall(entry, cacheSig, Collections.singletonList("input"), 11);
        diamond.addCall(audit, storeSig, Collections.singletonList("event"), 12);
        diamond.addCall(cache, storeSig, Collections.singletonList("value"), 13);

        InterproceduralTaintTracker diamondTracker = new InterproceduralTaintTracker(diamond);
        diamondTracker.registerSinkParameter(store, "row", "Statement.executeUpdate");

        List<InterproceduralFlow> flows = diamondTracker.trace(entry, Collections.singletonList("input"));

        assertEquals(2, flows.size());
        assertEquals(Arrays.asList(entry, audit, store), flows.get(0).getCallChain());
        assertEquals(Arrays.asList(entry, cache, store), flows.get(1).getCallChain());
        assertEquals(0.81, flows.get(0).getConfidence(), 1e-9);
        assertEquals(0.81, flows.get(1).getConfidence(), 1e-9);
    }

    @Test
    void identifierMentionIsWholeWord() {
        assertTrue(InterproceduralTaintTracker.mentions("a + id", "id"));
        assertTrue(InterproceduralTaintTracker.mentions("id.trim()", "id"));
        assertFalse(InterproceduralTaintTracker.mentions("userid", "id"));
        assertFalse(InterproceduralTaintTracker.mentions("id_2", "id"));
    }

    @Test
    void registrationLookups() {
        assertTrue(tracker.isSinkParameter(run, "sql"));
        assertFalse(tracker.isSinkParameter(load, "sql"));
        tracker.clear();
        assertFalse(tracker.isSinkParameter(run, "sql"));
    }
}

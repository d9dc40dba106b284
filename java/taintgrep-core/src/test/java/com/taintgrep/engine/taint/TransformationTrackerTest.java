package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.DataFlowGraph;
import com.taintgrep.engine.dataflow.EdgeKind;
import com.taintgrep.engine.tree.UniversalNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TransformationTrackerTest {

    private final TransformationTracker tracker = new TransformationTracker();

    private static DataFlowGraph chain(int length) {
        DataFlowGraph graph = new DataFlowGraph();
        for (int i = 0; i < length; i++) {
            graph.addNode(UniversalNode.leaf("identifier", "n" + i));
        }
        for (int i = 0; i + 1 < length; i++) {
            graph.addEdge(i, i + 1, EdgeKind.DATA_FLOW);
        }
        return graph;
    }

    @Test
    void hashingRemovesAllConfidence() {
        Map<Integer, TaintTransformation> transformations = new HashMap<>();
        transformations.put(1, TaintTransformation.hashing("SHA-256"));

        Map<Integer, TaintState> states = tracker.propagate(chain(3), 0, transformations);

        assertEquals(0.0, states.get(2).getConfidence());
        assertTrue(states.get(2).isSanitized());
        assertTrue(states.get(2).isTainted());
    }

    @Test
    void encodingLeavesThirtyPercent() {
        Map<Integer, TaintTransformation> transformations = new HashMap<>();
        transformations.put(1, TaintTransformation.encoding("base64"));

        Map<Integer, TaintState> states = tracker.propagate(chain(3), 0, transformations);

        assertEquals(1.0, states.get(0).getConfidence());
        assertEquals(0.3, states.get(2).getConfidence());
        assertFalse(states.get(2).isSanitized());
        assertEquals(Collections.singletonList(TaintTransformation.encoding("base64")),
            states.get(2).getTransformations());
    }

    @Test
    void transformationsCompose() {
        Map<Integer, TaintTransformation> transformations = new HashMap<>();
        transformations.put(0, TaintTransformation.encoding("url"));
        transformations.put(2, TaintTransformation.encryption("AES"));

        Map<Integer, TaintState> states = tracker.propagate(chain(3), 0, transformations);

        assertEquals(0.3, states.get(0).getConfidence());
        assertEquals(0.015, states.get(2).getConfidence());
        assertEquals(2, states.get(2).getTransformations().size());
        assertEquals(states.get(2).getConfidence(), tracker.getState(2).getConfidence());
    }

    @Test
    void unreachedNodesHaveNoState() {
        DataFlowGraph graph = chain(3);
        graph.addNode(UniversalNode.leaf("identifier", "island"));

        tracker.propagate(graph, 1, null);

        assertNull(tracker.getState(0));
        assertNull(tracker.getState(3));
        assertEquals(1.0, tracker.getState(2).getConfidence());
        tracker.clear();
        assertNull(tracker.getState(2));
    }

    @Test
    void mergeAveragesConfidenceAndUnionsTransformations() {
        TaintState encoded = TaintState.tainted();
        encoded.apply(TaintTransformation.encoding("html"));
        TaintState raw = TaintState.tainted();

        TaintState merged = tracker.merge(Arrays.asList(encoded, raw, TaintState.clean()));

        assertTrue(merged.isTainted());
        assertEquals((0.3 + 1.0 + 0.0) / 3, merged.getConfidence(), 1e-12);
        assertEquals(Collections.singletonList(TaintTransformation.encoding("html")), merged.getTransformations());
        assertFalse(tracker.merge(Collections.<TaintState>emptyList()).isTainted());
    }

    @Test
    void splitTagsBranches() {
        List<TaintState> branches = tracker.split(TaintState.tainted(), "isAdmin");

        assertEquals("true", branches.get(0).getContext(TransformationTracker.CONTEXT_BRANCH));
        assertEquals("false", branches.get(1).getContext(TransformationTracker.CONTEXT_BRANCH));
        assertEquals("isAdmin", branches.get(1).getContext(TransformationTracker.CONTEXT_CONDITION));
        assertEquals(1, tracker.filterByContext(branches, TransformationTracker.CONTEXT_BRANCH, "false").size());
    }

    @Test
    void filterStrategyKeepsTrueBranchOnly() {
        TaintState state = TaintState.tainted();
        List<TaintState> branches = tracker.split(state, "ok");
        branches.get(1).apply(TaintTransformation.hashing("md5"));

        TaintState combined = tracker.combine(branches, TransformationTracker.STRATEGY_FILTER);

        assertEquals(1.0, combined.getConfidence());
        assertTrue(combined.getTransformations().isEmpty());
    }

    @Test
    void intersectionAndUnionStrategies() {
        TaintState first = TaintState.tainted();
        first.apply(TaintTransformation.encoding("html"));
        first.apply(TaintTransformation.hashing("sha1"));
        TaintState second = TaintState.tainted();
        second.apply(TaintTransformation.hashing("sha1"));
        second.apply(TaintTransformation.validation("checkId"));

        TaintState intersection = tracker.combine(Arrays.asList(first, second),
            TransformationTracker.STRATEGY_INTERSECTION);
        TaintState union = tracker.combine(Arrays.asList(first, second), TransformationTracker.STRATEGY_UNION);

        assertEquals(Collections.singletonList(TaintTransformation.hashing("sha1")),
            intersection.getTransformations());
        assertEquals(3, union.getTransformations().size());
    }

    @Test
    void mostRestrictivePicksHighestTotalEffectiveness() {
        TaintState weak = TaintState.tainted();
        weak.apply(TaintTransformation.validation("check"));
        TaintState strong = TaintState.tainted();
        strong.apply(TaintTransformation.encryption("AES"));

        TaintState combined = tracker.combine(Arrays.asList(weak, strong),
            TransformationTracker.STRATEGY_MOST_RESTRICTIVE);

        assertEquals(TaintTransformation.encryption("AES"), combined.getTransformations().get(0));
    }

    @Test
    void unknownStrategyFallsBackToMerge() {
        TaintState combined = tracker.combine(Arrays.asList(TaintState.tainted(), TaintState.clean()), "bogus");

        assertEquals(0.5, combined.getConfidence(), 1e-12);
        assertFalse(tracker.combine(null, TransformationTracker.STRATEGY_UNION).isTainted());
    }

    @Test
    void classifiesCallsByMethodName() {
        assertEquals(TaintTransformation.Kind.HASHING, tracker.classify("MessageDigest.digest").getKind());
        assertEquals(TaintTransformation.Kind.ENCODING, tracker.classify("encoder.encode").getKind());
        assertEquals(TaintTransformation.Kind.DECODING, tracker.classify("URLDecoder.decode").getKind());
        assertEquals(TaintTransformation.Kind.DECODING, tracker.classify("StringEscapeUtils.unescapeHtml").getKind());
        assertEquals(TaintTransformation.Kind.ENCRYPTION, tracker.classify("encryptPayload").getKind());
        assertEquals(TaintTransformation.Kind.VALIDATION, tracker.classify("checkLength").getKind());
        assertEquals(TaintTransformation.Kind.FILTERING, tracker.classify("sanitizeHtml").getKind());
        assertEquals(TaintTransformation.CONCATENATION, tracker.classify("sb.append"));
        assertEquals(TaintTransformation.methodCall("toUpperCase"), tracker.classify("name.toUpperCase"));
        assertEquals(TaintTransformation.methodCall("doFinal"), tracker.classify("c.doFinal"));
        assertEquals(TaintTransformation.IDENTITY, tracker.classify(null));
    }

    @Test
    void hashingNeedsAWholeHashWord() {
        assertEquals(TaintTransformation.Kind.HASHING, tracker.classify("DigestUtils.sha256Hex").getKind());
        assertEquals(TaintTransformation.Kind.HASHING, tracker.classify("Hashing.md5").getKind());
        assertEquals(TaintTransformation.Kind.HASHING, tracker.classify("encoder.hashPassword").getKind());
        assertEquals(TaintTransformation.Kind.HASHING, tracker.classify("crypto.SHA-1").getKind());

        assertEquals(TaintTransformation.methodCall("shape"), tracker.classify("obj.shape"));
        assertEquals(TaintTransformation.methodCall("share"), tracker.classify("obj.share"));
        assertEquals(TaintTransformation.methodCall("shallowCopy"), tracker.classify("obj.shallowCopy"));
        assertEquals(TaintTransformation.methodCall("pushAll"), tracker.classify("obj.pushAll"));
        assertEquals(TaintTransformation.methodCall("thrash"), tracker.classify("disk.thrash"));
    }

    @Test
    void effectivenessTable() {
        assertFalse(TaintTransformation.IDENTITY.sanitizes());
        assertFalse(TaintTransformation.decoding("base64").sanitizes());
        assertTrue(TaintTransformation.filtering("strip").sanitizes());
        assertEquals(0.2, TaintTransformation.filtering("strip").apply(1.0));
    }
}

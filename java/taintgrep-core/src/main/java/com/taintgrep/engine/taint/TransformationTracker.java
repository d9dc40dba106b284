package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.DataFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Transformation-aware taint propagation.
 *
 * Each node may carry a transformation; walking the data-flow successors from a
 * tainted start node applies them in order, so partial sanitization lowers the
 * confidence instead of cutting the flow.
 */
public class TransformationTracker {
    private static final Logger logger = LoggerFactory.getLogger(TransformationTracker.class);

    public static final String STRATEGY_FILTER = "filter";
    public static final String STRATEGY_UNION = "union";
    public static final String STRATEGY_INTERSECTION = "intersection";
    public static final String STRATEGY_MOST_RESTRICTIVE = "most_restrictive";
    public static final String STRATEGY_MERGE = "merge";

    public static final String CONTEXT_BRANCH = "branch";
    public static final String CONTEXT_CONDITION = "condition";

    private static final Pattern WORD_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])|[_$\\-]");
    private static final Pattern HASH_WORD = Pattern.compile("hash(es|ed|ing)?|digest|sha(-?\\d+)?|md[245]");

    private final Map<Integer, TaintState> states = new LinkedHashMap<>();

    // ============================================
    // 1. PROPAGATION
    // ============================================

    /**
     * Breadth-first walk over data-flow successors of {@code start}. A node
     * receives a copy of the state of the node it was first reached from, with its
     * own transformation applied.
     *
     * @param transformationsByNode node id to the transformation that node performs
     * @return state per reached node, in visit order; the start node included
     */
    public Map<Integer, TaintState> propagate(DataFlowGraph graph, int start,
                                              Map<Integer, TaintTransformation> transformationsByNode) {
        Map<Integer, TaintTransformation> transformations = transformationsByNode != null
            ? transformationsByNode
            : Collections.<Integer, TaintTransformation>emptyMap();

        Map<Integer, TaintState> reached = new LinkedHashMap<>();
        TaintState initial = TaintState.tainted();
        initial.apply(transformations.get(start));
        reached.put(start, initial);

        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(start);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            TaintState currentState = reached.get(current);
            for (int next : graph.dataFlowSuccessors(current)) {
                if (reached.containsKey(next)) {
                    continue;
                }
                TaintState nextState = currentState.copy();
                nextState.apply(transformations.get(next));
                reached.put(next, nextState);
                queue.add(next);
            }
        }

        states.putAll(reached);
        logger.debug("Propagated taint from node {} to {} node(s)", start, reached.size());
        return reached;
    }

    public TaintState getState(int nodeId) {
        return states.get(nodeId);
    }

    public void setState(int nodeId, TaintState state) {
        states.put(nodeId, state);
    }

    public void clear() {
        states.clear();
    }

    // ============================================
    // 2. MERGE / SPLIT
    // ============================================

    /**
     * Union of transformations in first-seen order, mean confidence.
     * An empty input gives a clean state.
     */
    public TaintState merge(List<TaintState> taints) {
        if (taints == null || taints.isEmpty()) {
            return TaintState.clean();
        }
        boolean tainted = false;
        double sum = 0.0;
        for (TaintState taint : taints) {
            tainted |= taint.isTainted();
            sum += taint.getConfidence();
        }

        TaintState merged = new TaintState(tainted, sum / taints.size());
        for (TaintState taint : taints) {
            for (TaintTransformation transformation : taint.getTransformations()) {
                merged.addTransformation(transformation);
            }
            for (Map.Entry<String, String> entry : taint.getContextMap().entrySet()) {
                if (merged.getContext(entry.getKey()) == null) {
                    merged.setContext(entry.getKey(), entry.getValue());
                }
            }
        }
        return merged;
    }

    /**
     * @return two copies of {@code taint}: index 0 for the true branch, index 1 for the false branch
     */
    public List<TaintState> split(TaintState taint, String condition) {
        TaintState trueBranch = taint.copy();
        trueBranch.setContext(CONTEXT_BRANCH, "true");
        trueBranch.setContext(CONTEXT_CONDITION, condition);

        TaintState falseBranch = taint.copy();
        falseBranch.setContext(CONTEXT_BRANCH, "false");
        falseBranch.setContext(CONTEXT_CONDITION, condition);

        List<TaintState> branches = new ArrayList<>(2);
        branches.add(trueBranch);
        branches.add(falseBranch);
        return branches;
    }

    public List<TaintState> filterByContext(List<TaintState> taints, String key, String value) {
        List<TaintState> kept = new ArrayList<>();
        for (TaintState taint : taints) {
            if (value != null && value.equals(taint.getContext(key))) {
                kept.add(taint);
            }
        }
        return kept;
    }

    /**
     * Combine states under a named strategy; unknown names fall back to {@link #merge}.
     */
    public TaintState combine(List<TaintState> taints, String strategy) {
        if (taints == null || taints.isEmpty()) {
            return TaintState.clean();
        }
        String key = strategy != null ? strategy.toLowerCase(Locale.ROOT) : STRATEGY_MERGE;

        switch (key) {
            case STRATEGY_FILTER:
                return merge(filterByContext(taints, CONTEXT_BRANCH, "true"));
            case STRATEGY_UNION: {
                TaintState combined = taints.get(0).copy();
                for (TaintState taint : taints.subList(1, taints.size())) {
                    for (TaintTransformation transformation : taint.getTransformations()) {
                        combined.addTransformation(transformation);
                    }
                }
                return combined;
            }
            case STRATEGY_INTERSECTION: {
                TaintState combined = taints.get(0).copy();
                for (TaintState taint : taints.subList(1, taints.size())) {
                    combined.retainTransformations(taint.getTransformations());
                }
                return combined;
            }
            case STRATEGY_MOST_RESTRICTIVE: {
                TaintState best = taints.get(0);
                for (TaintState taint : taints.subList(1, taints.size())) {
                    if (taint.totalEffectiveness() > best.totalEffectiveness()) {
                        best = taint;
                    }
                }
                return best.copy();
            }
            default:
                return merge(taints);
        }
    }

    // ============================================
    // 3. CLASSIFICATION
    // ============================================

    private static final Map<String, TaintTransformation.Kind> STRING_METHODS = new HashMap<>();

    static {
        for (String name : new String[] {"substring", "touppercase", "tolowercase", "trim", "strip",
            "replace", "split", "charat", "tostring", "valueof"}) {
            STRING_METHODS.put(name, TaintTransformation.Kind.METHOD_CALL);
        }
        STRING_METHODS.put("concat", TaintTransformation.Kind.CONCATENATION);
        STRING_METHODS.put("append", TaintTransformation.Kind.CONCATENATION);
        STRING_METHODS.put("join", TaintTransformation.Kind.CONCATENATION);
    }

    /**
     * Map a called function name to the transformation it performs.
     * Only the last dotted segment is considered.
     */
    public TaintTransformation classify(String callName) {
        if (callName == null || callName.isEmpty()) {
            return TaintTransformation.IDENTITY;
        }
        int dot = callName.lastIndexOf('.');
        String method = dot >= 0 ? callName.substring(dot + 1) : callName;
        String lower = method.toLowerCase(Locale.ROOT);

        TaintTransformation.Kind stringKind = STRING_METHODS.get(lower);
        if (stringKind == TaintTransformation.Kind.CONCATENATION) {
            return TaintTransformation.CONCATENATION;
        }
        if (stringKind != null) {
            return TaintTransformation.methodCall(method);
        }
        if (isHashing(method)) {
            return TaintTransformation.hashing(method);
        }
        if (lower.contains("decrypt") || lower.contains("decode") || lower.contains("unescape")) {
            return TaintTransformation.decoding(method);
        }
        if (lower.contains("encrypt") || lower.contains("cipher")) {
            return TaintTransformation.encryption(method);
        }
        if (lower.contains("encode") || lower.contains("escape")) {
            return TaintTransformation.encoding(method);
        }
        if (lower.contains("validate") || lower.startsWith("isvalid") || lower.startsWith("check")) {
            return TaintTransformation.validation(method);
        }
        if (lower.contains("filter") || lower.contains("sanitize") || lower.contains("clean")) {
            return TaintTransformation.filtering(method);
        }
        return TaintTransformation.methodCall(method);
    }

    /**
     * True when one camel-case word of the name is a hash word:
     * {@code sha256Hex}, {@code hashPassword}, {@code MessageDigest.digest}, not {@code shape} or {@code pushAll}.
     */
    private static boolean isHashing(String method) {
        for (String word : WORD_BOUNDARY.split(method)) {
            if (HASH_WORD.matcher(word.toLowerCase(Locale.ROOT)).matches()) {
                return true;
            }
        }
        return false;
    }
}

package com.taintgrep.engine.dataflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Project-scoped call graph.
 *
 * Functions are keyed by {@link FunctionSignature}; call sites keep the callee
 * signature and are resolved when queried. A parameter mapping exists only for
 * calls whose callee was registered before the call, so build the graph fully
 * before running interprocedural passes. Owned by the caller; reset with
 * {@link #clear()}.
 */
public class CallGraph {
    private static final Logger logger = LoggerFactory.getLogger(CallGraph.class);

    private final Map<FunctionId, FunctionDefinition> functions = new LinkedHashMap<>();
    private final Map<FunctionSignature, FunctionId> bySignature = new HashMap<>();
    private final Map<FunctionId, List<CallSite>> calls = new HashMap<>();
    private final Map<Integer, CallSite> callsById = new HashMap<>();
    private final Map<Integer, ParameterMapping> mappings = new HashMap<>();
    private int nextFunctionId;
    private int nextCallId;

    // ============================================
    // 1. REGISTRATION
    // ============================================

    /**
     * Register a function. Re-registering a signature points it at the new id.
     *
     * @return the new function id
     */
    public FunctionId addFunction(FunctionSignature signature, List<String> parameters,
                                  String returnType, int nodeId) {
        FunctionId id = new FunctionId(nextFunctionId++);
        functions.put(id, new FunctionDefinition(id, signature, nodeId, parameters, returnType));
        bySignature.put(signature, id);
        return id;
    }

    /**
     * Register a call. If the callee is already known, argument i maps to
     * parameter i, up to the shorter of the two lists.
     *
     * @return the new call id
     */
    public int addCall(FunctionId caller, FunctionSignature calleeSignature, List<String> arguments, int nodeId) {
        int callId = nextCallId++;
        CallSite call = new CallSite(callId, caller, calleeSignature, arguments, nodeId);
        calls.computeIfAbsent(caller, ignored -> new ArrayList<>()).add(call);
        callsById.put(callId, call);

        FunctionId calleeId = bySignature.get(calleeSignature);
        if (calleeId != null) {
            List<String> parameters = functions.get(calleeId).getParameters();
            List<String> args = call.getArguments();
            Map<Integer, String> mapped = new LinkedHashMap<>();
            for (int i = 0; i < Math.min(parameters.size(), args.size()); i++) {
                mapped.put(i, args.get(i));
            }
            mappings.put(callId, new ParameterMapping(callId, mapped));
        } else {
            logger.trace("Call {} to unregistered {}, no parameter mapping", callId, calleeSignature);
        }
        return callId;
    }

    // ============================================
    // 2. LOOKUP
    // ============================================

    /**
     * @throws IllegalArgumentException if the id was never registered
     */
    public FunctionDefinition getFunction(FunctionId id) {
        FunctionDefinition definition = functions.get(id);
        if (definition == null) {
            throw new IllegalArgumentException("Unknown function " + id);
        }
        return definition;
    }

    /**
     * @return id registered for the signature, or null
     */
    public FunctionId findFunction(FunctionSignature signature) {
        return bySignature.get(signature);
    }

    public List<FunctionDefinition> getFunctions() {
        return new ArrayList<>(functions.values());
    }

    public List<CallSite> callsFrom(FunctionId caller) {
        return Collections.unmodifiableList(calls.getOrDefault(caller, Collections.<CallSite>emptyList()));
    }

    public CallSite getCall(int callId) {
        return callsById.get(callId);
    }

    /**
     * @return mapping for the call, or null when the callee was unknown at call time
     */
    public ParameterMapping getParameterMapping(int callId) {
        return mappings.get(callId);
    }

    /**
     * @return callers with at least one call to the signature, in registration order
     */
    public List<FunctionId> findCallers(FunctionSignature callee) {
        Set<FunctionId> callers = new LinkedHashSet<>();
        for (FunctionId id : functions.keySet()) {
            for (CallSite call : calls.getOrDefault(id, Collections.<CallSite>emptyList())) {
                if (call.getCalleeSignature().equals(callee)) {
                    callers.add(id);
                }
            }
        }
        return new ArrayList<>(callers);
    }

    /**
     * @return distinct callee signatures of the function, resolved or not
     */
    public List<FunctionSignature> findCallees(FunctionId caller) {
        Set<FunctionSignature> callees = new LinkedHashSet<>();
        for (CallSite call : calls.getOrDefault(caller, Collections.<CallSite>emptyList())) {
            callees.add(call.getCalleeSignature());
        }
        return new ArrayList<>(callees);
    }

    // ============================================
    // 3. REACHABILITY
    // ============================================

    /**
     * Breadth-first search over resolved calls.
     *
     * @return first shortest chain from {@code from} to {@code to}, inclusive;
     *         {@code [from]} when equal; empty when unreachable
     */
    public List<FunctionId> tracePath(FunctionId from, FunctionId to) {
        if (from.equals(to)) {
            return Collections.singletonList(from);
        }

        Deque<FunctionId> queue = new ArrayDeque<>();
        Set<FunctionId> visited = new LinkedHashSet<>();
        Map<FunctionId, FunctionId> parent = new HashMap<>();
        queue.add(from);
        visited.add(from);

        while (!queue.isEmpty()) {
            FunctionId current = queue.poll();
            if (current.equals(to)) {
                List<FunctionId> path = new ArrayList<>();
                for (FunctionId step = to; step != null; step = parent.get(step)) {
                    path.add(step);
                }
                Collections.reverse(path);
                return path;
            }
            for (FunctionId next : resolvedCallees(current)) {
                if (visited.add(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Collections.emptyList();
    }

    public boolean hasCallPath(FunctionId from, FunctionId to) {
        return !tracePath(from, to).isEmpty();
    }

    /**
     * @return forward closure over resolved calls, including {@code from}
     */
    public Set<FunctionId> reachableFunctions(FunctionId from) {
        Set<FunctionId> reachable = new LinkedHashSet<>();
        Deque<FunctionId> queue = new ArrayDeque<>();
        reachable.add(from);
        queue.add(from);
        while (!queue.isEmpty()) {
            for (FunctionId next : resolvedCallees(queue.poll())) {
                if (reachable.add(next)) {
                    queue.add(next);
                }
            }
        }
        return reachable;
    }

    private List<FunctionId> resolvedCallees(FunctionId caller) {
        List<FunctionId> resolved = new ArrayList<>();
        for (CallSite call : calls.getOrDefault(caller, Collections.<CallSite>emptyList())) {
            FunctionId callee = bySignature.get(call.getCalleeSignature());
            if (callee != null) {
                resolved.add(callee);
            }
        }
        return resolved;
    }

    public int functionCount() {
        return functions.size();
    }

    public int callCount() {
        return callsById.size();
    }

    public void clear() {
        functions.clear();
        bySignature.clear();
        calls.clear();
        callsById.clear();
        mappings.clear();
        nextFunctionId = 0;
        nextCallId = 0;
    }
}

package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.CallGraph;
import com.taintgrep.engine.dataflow.CallSite;
import com.taintgrep.engine.dataflow.FunctionDefinition;
import com.taintgrep.engine.dataflow.FunctionId;
import com.taintgrep.engine.dataflow.ParameterMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Follows tainted names across call sites using the parameter mappings of a
 * {@link CallGraph} and per-function summaries.
 *
 * A summary says that a parameter of a function reaches a sink inside it, or
 * that the function sanitizes a parameter before using it. Confidence decays by
 * {@link #HOP_DECAY} per call. The call graph must be fully built before tracing.
 */
public class InterproceduralTaintTracker {
    private static final Logger logger = LoggerFactory.getLogger(InterproceduralTaintTracker.class);

    public static final double HOP_DECAY = 0.9;

    private final CallGraph callGraph;
    private final Map<String, String> sinkParameters = new HashMap<>();
    private final Set<String> sanitizedParameters = new HashSet<>();
    private final Map<FunctionId, Map<String, Double>> entryTaints = new LinkedHashMap<>();
    private final Map<FunctionId, Map<String, Double>> exitTaints = new LinkedHashMap<>();

    public InterproceduralTaintTracker(CallGraph callGraph) {
        this.callGraph = callGraph;
    }

    public void registerSinkParameter(FunctionId function, String parameter, String sinkDescription) {
        sinkParameters.put(key(function, parameter), sinkDescription);
    }

    public void registerSanitizedParameter(FunctionId function, String parameter) {
        sanitizedParameters.add(key(function, parameter));
    }

    public boolean isSinkParameter(FunctionId function, String parameter) {
        return sinkParameters.containsKey(key(function, parameter));
    }

    public boolean isSanitizedParameter(FunctionId function, String parameter) {
        return sanitizedParameters.contains(key(function, parameter));
    }

    /**
     * Trace taint from {@code entry}, where {@code taintedNames} hold at confidence 1.0.
     * Entry and exit taints from earlier traces are discarded.
     *
     * @return flows in discovery order
     */
    public List<InterproceduralFlow> trace(FunctionId entry, Collection<String> taintedNames) {
        entryTaints.clear();
        exitTaints.clear();

        Map<String, Double> initial = new LinkedHashMap<>();
        for (String name : taintedNames) {
            initial.put(name, 1.0);
        }

        List<InterproceduralFlow> flows = new ArrayList<>();
        List<FunctionId> chain = new ArrayList<>();
        chain.add(entry);
        traceFunction(entry, initial, chain, new HashSet<FunctionId>(), flows);

        logger.debug("Interprocedural trace from {} found {} flow(s)", entry, flows.size());
        return flows;
    }

    private void traceFunction(FunctionId function, Map<String, Double> taints, List<FunctionId> chain,
                               Set<FunctionId> visited, List<InterproceduralFlow> flows) {
        recordMax(entryTaints, function, taints);

        // 1. Sanitized parameters stop here
        Map<String, Double> live = new LinkedHashMap<>();
        for (Map.Entry<String, Double> taint : taints.entrySet()) {
            if (!isSanitizedParameter(function, taint.getKey())) {
                live.put(taint.getKey(), taint.getValue());
            }
        }

        // 2. Sinks summarized for this function
        for (Map.Entry<String, Double> taint : live.entrySet()) {
            String sink = sinkParameters.get(key(function, taint.getKey()));
            if (sink != null) {
                flows.add(new InterproceduralFlow(chain, taint.getKey(), sink, taint.getValue()));
            }
        }

        // 3. Descend into callees
        visited.add(function);
        for (CallSite call : callGraph.callsFrom(function)) {
            ParameterMapping mapping = callGraph.getParameterMapping(call.getId());
            FunctionId callee = callGraph.findFunction(call.getCalleeSignature());
            if (mapping == null || callee == null || visited.contains(callee)) {
                continue;
            }
            Map<String, Double> calleeTaints = mapArguments(callGraph.getFunction(callee), mapping, live);
            if (calleeTaints.isEmpty()) {
                continue;
            }
            chain.add(callee);
            traceFunction(callee, calleeTaints, chain, visited, flows);
            chain.remove(chain.size() - 1);
        }
        visited.remove(function);

        recordMax(exitTaints, function, live);
    }

    private static Map<String, Double> mapArguments(FunctionDefinition callee, ParameterMapping mapping,
                                                    Map<String, Double> taints) {
        Map<String, Double> mapped = new LinkedHashMap<>();
        List<String> parameters = callee.getParameters();
        for (Map.Entry<Integer, String> argument : mapping.getArguments().entrySet()) {
            double best = 0.0;
            for (Map.Entry<String, Double> taint : taints.entrySet()) {
                if (mentions(argument.getValue(), taint.getKey())) {
                    best = Math.max(best, taint.getValue());
                }
            }
            if (best > 0.0) {
                mapped.put(parameters.get(argument.getKey()), best * HOP_DECAY);
            }
        }
        return mapped;
    }

    /**
     * @return true if {@code name} occurs in {@code text} as a whole identifier
     */
    static boolean mentions(String text, String name) {
        if (text == null || name == null || name.isEmpty()) {
            return false;
        }
        int from = 0;
        while (true) {
            int index = text.indexOf(name, from);
            if (index < 0) {
                return false;
            }
            int end = index + name.length();
            boolean startOk = index == 0 || !isIdentifierChar(text.charAt(index - 1));
            boolean endOk = end == text.length() || !isIdentifierChar(text.charAt(end));
            if (startOk && endOk) {
                return true;
            }
            from = index + 1;
        }
    }

    private static boolean isIdentifierChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }

    private static void recordMax(Map<FunctionId, Map<String, Double>> target, FunctionId function,
                                  Map<String, Double> taints) {
        Map<String, Double> recorded = target.computeIfAbsent(function, ignored -> new LinkedHashMap<>());
        for (Map.Entry<String, Double> taint : taints.entrySet()) {
            recorded.merge(taint.getKey(), taint.getValue(), Math::max);
        }
    }

    /**
     * @return parameter name to confidence on entry to the function during the last trace
     */
    public Map<String, Double> getEntryTaints(FunctionId function) {
        return Collections.unmodifiableMap(entryTaints.getOrDefault(function, Collections.<String, Double>emptyMap()));
    }

    /**
     * @return taints still live when the function returned during the last trace
     */
    public Map<String, Double> getExitTaints(FunctionId function) {
        return Collections.unmodifiableMap(exitTaints.getOrDefault(function, Collections.<String, Double>emptyMap()));
    }

    public void clear() {
        sinkParameters.clear();
        sanitizedParameters.clear();
        entryTaints.clear();
        exitTaints.clear();
    }

    private static String key(FunctionId function, String parameter) {
        return function.getValue() + "#" + parameter;
    }
}

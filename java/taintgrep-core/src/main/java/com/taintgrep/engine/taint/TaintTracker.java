package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.DataFlowGraph;
import com.taintgrep.engine.domain.DataFlowSanitizer;
import com.taintgrep.engine.domain.DataFlowSink;
import com.taintgrep.engine.domain.DataFlowSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Source-to-sink reachability over data-flow edges.
 *
 * A pair is vulnerable when a path survives with every sanitizer whose
 * effectiveness reaches the threshold removed. A pair connected only through
 * such sanitizers is reported as a sanitized flow.
 */
public class TaintTracker {
    private static final Logger logger = LoggerFactory.getLogger(TaintTracker.class);

    public static final double DEFAULT_SANITIZER_THRESHOLD = 0.8;

    private final SourceDetector sourceDetector;
    private final SinkDetector sinkDetector;
    private final SanitizerDetector sanitizerDetector;
    private final double sanitizerThreshold;

    public TaintTracker() {
        this(new SourceDetector(), new SinkDetector(), new SanitizerDetector(), DEFAULT_SANITIZER_THRESHOLD);
    }

    public TaintTracker(SourceDetector sourceDetector, SinkDetector sinkDetector,
                        SanitizerDetector sanitizerDetector, double sanitizerThreshold) {
        this.sourceDetector = sourceDetector;
        this.sinkDetector = sinkDetector;
        this.sanitizerDetector = sanitizerDetector;
        this.sanitizerThreshold = sanitizerThreshold;
    }

    /**
     * Detect sources, sinks and sanitizers with the registries, then track.
     */
    public List<TaintFlow> analyze(DataFlowGraph graph) {
        return track(graph, sourceDetector.detect(graph), sinkDetector.detect(graph),
            sanitizerDetector.detect(graph));
    }

    /**
     * @return flows in source order, then sink order
     */
    public List<TaintFlow> track(DataFlowGraph graph, List<DataFlowSource> sources, List<DataFlowSink> sinks,
                                 List<DataFlowSanitizer> sanitizers) {
        Map<Integer, DataFlowSanitizer> sanitizerByNode = new LinkedHashMap<>();
        Set<Integer> blocking = new HashSet<>();
        for (DataFlowSanitizer sanitizer : sanitizers) {
            sanitizerByNode.put(sanitizer.getNodeId(), sanitizer);
            if (sanitizer.getEffectiveness() >= sanitizerThreshold) {
                blocking.add(sanitizer.getNodeId());
            }
        }

        List<TaintFlow> flows = new ArrayList<>();
        for (DataFlowSource source : sources) {
            for (DataFlowSink sink : sinks) {
                if (source.getNodeId() == sink.getNodeId()) {
                    continue;
                }
                List<Integer> path = shortestPath(graph, source.getNodeId(), sink.getNodeId(), blocking);
                if (path != null) {
                    flows.add(new TaintFlow(source, sink, path, sanitizersOn(path, sanitizerByNode), true));
                    continue;
                }
                path = shortestPath(graph, source.getNodeId(), sink.getNodeId(),
                    Collections.<Integer>emptySet());
                if (path != null) {
                    flows.add(new TaintFlow(source, sink, path, sanitizersOn(path, sanitizerByNode), false));
                }
            }
        }

        logger.debug("Tracked {} source(s) x {} sink(s): {} flow(s)", sources.size(), sinks.size(), flows.size());
        return flows;
    }

    public double getSanitizerThreshold() {
        return sanitizerThreshold;
    }

    private static List<DataFlowSanitizer> sanitizersOn(List<Integer> path, Map<Integer, DataFlowSanitizer> byNode) {
        List<DataFlowSanitizer> onPath = new ArrayList<>();
        for (int id : path) {
            DataFlowSanitizer sanitizer = byNode.get(id);
            if (sanitizer != null) {
                onPath.add(sanitizer);
            }
        }
        return onPath;
    }

    /**
     * Breadth-first search over data-flow edges that never enters a blocked node.
     *
     * @return node ids from source to sink, or null when unreachable
     */
    private static List<Integer> shortestPath(DataFlowGraph graph, int from, int to, Set<Integer> blocked) {
        Deque<Integer> queue = new ArrayDeque<>();
        Map<Integer, Integer> parent = new HashMap<>();
        Set<Integer> visited = new HashSet<>();
        queue.add(from);
        visited.add(from);

        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (current == to) {
                List<Integer> path = new ArrayList<>();
                for (Integer step = to; step != null; step = parent.get(step)) {
                    path.add(step);
                }
                Collections.reverse(path);
                return path;
            }
            for (int next : graph.dataFlowSuccessors(current)) {
                if (blocked.contains(next) && next != to) {
                    continue;
                }
                if (visited.add(next)) {
                    parent.put(next, current);
                    queue.add(next);
                }
            }
        }
        return null;
    }
}

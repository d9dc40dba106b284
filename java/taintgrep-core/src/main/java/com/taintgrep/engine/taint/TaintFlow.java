package com.taintgrep.engine.taint;

import com.taintgrep.engine.domain.DataFlowSanitizer;
import com.taintgrep.engine.domain.DataFlowSink;
import com.taintgrep.engine.domain.DataFlowSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// TaintFlow: a data-flow path from a source to a sink
// ============================================
public class TaintFlow {
    private final DataFlowSource source;
    private final DataFlowSink sink;
    private final List<Integer> path;
    private final List<DataFlowSanitizer> sanitizers;
    private final boolean vulnerable;

    public TaintFlow(DataFlowSource source, DataFlowSink sink, List<Integer> path,
                     List<DataFlowSanitizer> sanitizers, boolean vulnerable) {
        this.source = source;
        this.sink = sink;
        this.path = Collections.unmodifiableList(new ArrayList<>(path));
        this.sanitizers = sanitizers != null
            ? Collections.unmodifiableList(new ArrayList<>(sanitizers))
            : Collections.<DataFlowSanitizer>emptyList();
        this.vulnerable = vulnerable;
    }

    public DataFlowSource getSource() {
        return source;
    }

    public DataFlowSink getSink() {
        return sink;
    }

    /**
     * @return graph node ids from source to sink, inclusive
     */
    public List<Integer> getPath() {
        return path;
    }

    /**
     * @return sanitizers lying on the path, in path order
     */
    public List<DataFlowSanitizer> getSanitizers() {
        return sanitizers;
    }

    public boolean isVulnerable() {
        return vulnerable;
    }

    public String getVulnerabilityType() {
        return sink.getVulnerabilityType();
    }

    /**
     * Source confidence times sink confidence.
     */
    public double getConfidence() {
        return source.getConfidence() * sink.getConfidence();
    }

    @Override
    public String toString() {
        return source.getDescription() + " -> " + sink.getDescription()
            + (vulnerable ? " [vulnerable]" : " [sanitized]") + " " + path;
    }
}

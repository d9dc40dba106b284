package com.taintgrep.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// DataFlowSpec: source/sink categories a match must connect
// ============================================
public class DataFlowSpec {
    private final List<String> sources;
    private final List<String> sinks;
    private final List<String> sanitizers;
    private boolean mustFlow = true;
    private Integer maxDepth;

    public DataFlowSpec(List<String> sources, List<String> sinks) {
        this(sources, sinks, null);
    }

    public DataFlowSpec(List<String> sources, List<String> sinks, List<String> sanitizers) {
        this.sources = sources != null ? new ArrayList<>(sources) : new ArrayList<>();
        this.sinks = sinks != null ? new ArrayList<>(sinks) : new ArrayList<>();
        this.sanitizers = sanitizers != null ? new ArrayList<>(sanitizers) : new ArrayList<>();
    }

    public List<String> getSources() {
        return Collections.unmodifiableList(sources);
    }

    public List<String> getSinks() {
        return Collections.unmodifiableList(sinks);
    }

    public List<String> getSanitizers() {
        return Collections.unmodifiableList(sanitizers);
    }

    public boolean isMustFlow() {
        return mustFlow;
    }

    public void setMustFlow(boolean mustFlow) {
        this.mustFlow = mustFlow;
    }

    public Integer getMaxDepth() {
        return maxDepth;
    }

    public void setMaxDepth(Integer maxDepth) {
        this.maxDepth = maxDepth;
    }
}

package com.taintgrep.engine.taint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ============================================
// TaintState: taint flag, applied transformations, confidence, branch context
// ============================================
public class TaintState {
    public static final double SANITIZED_CONFIDENCE = 0.1;

    private final boolean tainted;
    private final List<TaintTransformation> transformations;
    private final Map<String, String> context;
    private double confidence;

    public TaintState(boolean tainted, double confidence) {
        this.tainted = tainted;
        this.confidence = confidence;
        this.transformations = new ArrayList<>();
        this.context = new LinkedHashMap<>();
    }

    public static TaintState tainted() {
        return new TaintState(true, 1.0);
    }

    public static TaintState clean() {
        return new TaintState(false, 0.0);
    }

    public TaintState copy() {
        TaintState copy = new TaintState(tainted, confidence);
        copy.transformations.addAll(transformations);
        copy.context.putAll(context);
        return copy;
    }

    /**
     * Record a transformation and lower confidence by its effectiveness.
     */
    public void apply(TaintTransformation transformation) {
        if (transformation == null) {
            return;
        }
        transformations.add(transformation);
        confidence = transformation.apply(confidence);
    }

    void addTransformation(TaintTransformation transformation) {
        if (!transformations.contains(transformation)) {
            transformations.add(transformation);
        }
    }

    void retainTransformations(List<TaintTransformation> keep) {
        transformations.retainAll(keep);
    }

    void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    public boolean isTainted() {
        return tainted;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isSanitized() {
        return !tainted || confidence <= SANITIZED_CONFIDENCE;
    }

    public List<TaintTransformation> getTransformations() {
        return Collections.unmodifiableList(transformations);
    }

    /**
     * Sum of transformation effectiveness, used to rank how restrictive a state is.
     */
    public double totalEffectiveness() {
        double total = 0.0;
        for (TaintTransformation transformation : transformations) {
            total += transformation.getEffectiveness();
        }
        return total;
    }

    public void setContext(String key, String value) {
        context.put(key, value);
    }

    public String getContext(String key) {
        return context.get(key);
    }

    public Map<String, String> getContextMap() {
        return Collections.unmodifiableMap(context);
    }

    @Override
    public String toString() {
        return (tainted ? "tainted" : "clean") + "(" + confidence + ") " + transformations
            + (context.isEmpty() ? "" : " " + context);
    }
}

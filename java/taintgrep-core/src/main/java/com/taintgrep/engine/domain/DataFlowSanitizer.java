package com.taintgrep.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// DataFlowSanitizer: operation that weakens or removes taint
// ============================================
public class DataFlowSanitizer {
    private final int nodeId;
    private final String category; // "input_validation", "html_encoding", etc.
    private final String description;
    private final double effectiveness;
    private final List<String> protectedTypes;

    public DataFlowSanitizer(int nodeId, String category, String description, double effectiveness,
                             List<String> protectedTypes) {
        this.nodeId = nodeId;
        this.category = category;
        this.description = description;
        this.effectiveness = DataFlowSource.clamp(effectiveness);
        this.protectedTypes = protectedTypes != null ? new ArrayList<>(protectedTypes) : new ArrayList<>();
    }

    public int getNodeId() {
        return nodeId;
    }

    public String getCategory() {
        return category;
    }

    public String getDescription() {
        return description;
    }

    public double getEffectiveness() {
        return effectiveness;
    }

    /**
     * @return vulnerability types this sanitizer is meant to prevent
     */
    public List<String> getProtectedTypes() {
        return Collections.unmodifiableList(protectedTypes);
    }

    @Override
    public String toString() {
        return category + "@" + nodeId + " (" + description + ", " + effectiveness + ")";
    }
}

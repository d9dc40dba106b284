package com.taintgrep.engine.domain;

// ============================================
// DataFlowSource: untrusted input at a graph node
// ============================================
public class DataFlowSource {
    private final int nodeId;
    private final String category; // "user_input", "file_input", etc.
    private final String description;
    private final double confidence;

    public DataFlowSource(int nodeId, String category, String description, double confidence) {
        this.nodeId = nodeId;
        this.category = category;
        this.description = description;
        this.confidence = clamp(confidence);
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
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

    public double getConfidence() {
        return confidence;
    }

    public boolean isHighConfidence() {
        return confidence >= 0.8;
    }

    @Override
    public String toString() {
        return category + "@" + nodeId + " (" + description + ")";
    }
}

package com.taintgrep.engine.domain;

// ============================================
// DataFlowSink: dangerous operation at a graph node
// ============================================
public class DataFlowSink {
    private final int nodeId;
    private final String category; // "sql_execution", "command_execution", etc.
    private final String vulnerabilityType; // "SQL_INJECTION", "XSS", etc.
    private final String description;
    private final double confidence;

    public DataFlowSink(int nodeId, String category, String vulnerabilityType, String description,
                        double confidence) {
        this.nodeId = nodeId;
        this.category = category;
        this.vulnerabilityType = vulnerabilityType;
        this.description = description;
        this.confidence = DataFlowSource.clamp(confidence);
    }

    public int getNodeId() {
        return nodeId;
    }

    public String getCategory() {
        return category;
    }

    public String getVulnerabilityType() {
        return vulnerabilityType;
    }

    public String getDescription() {
        return description;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return category + "@" + nodeId + " (" + description + ")";
    }
}

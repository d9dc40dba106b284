package com.taintgrep.engine.dataflow;

// ============================================
// ConstantInfo: a registered constant and what is known about it
// ============================================
public class ConstantInfo {
    private final ConstantValue value;
    private final boolean sensitive;
    private boolean mutable;
    private int assignmentCount = 1;

    public ConstantInfo(ConstantValue value, boolean sensitive) {
        this.value = value;
        this.sensitive = sensitive;
    }

    public ConstantValue getValue() {
        return value;
    }

    public boolean isSensitive() {
        return sensitive;
    }

    public boolean isMutable() {
        return mutable;
    }

    void markMutable() {
        this.mutable = true;
    }

    public int getAssignmentCount() {
        return assignmentCount;
    }

    void incrementAssignments() {
        assignmentCount++;
    }
}

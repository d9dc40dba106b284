package com.taintgrep.engine.dataflow;

// ============================================
// DataFlowEdge: directed edge between two graph nodes
// ============================================
public class DataFlowEdge {
    private final int from;
    private final int to;
    private final EdgeKind kind;

    public DataFlowEdge(int from, int to, EdgeKind kind) {
        this.from = from;
        this.to = to;
        this.kind = kind;
    }

    public int getFrom() {
        return from;
    }

    public int getTo() {
        return to;
    }

    public EdgeKind getKind() {
        return kind;
    }

    public boolean isDataFlow() {
        return kind == EdgeKind.DATA_FLOW;
    }

    @Override
    public String toString() {
        return from + " -" + (kind == EdgeKind.DATA_FLOW ? "data" : "control") + "-> " + to;
    }
}

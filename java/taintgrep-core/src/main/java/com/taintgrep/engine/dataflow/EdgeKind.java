package com.taintgrep.engine.dataflow;

public enum EdgeKind {
    CONTROL_FLOW,
    DATA_FLOW
}

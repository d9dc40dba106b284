package com.taintgrep.engine.dataflow;

public enum ScopeType {
    GLOBAL,
    FUNCTION,
    BLOCK,
    CLASS,
    LOOP
}

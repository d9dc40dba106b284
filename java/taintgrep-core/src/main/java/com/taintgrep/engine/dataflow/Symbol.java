package com.taintgrep.engine.dataflow;

// ============================================
// Symbol: a name defined in one scope
// ============================================
public class Symbol {
    private final String name;
    private final int scopeId;
    private final int nodeId;
    private TypeInfo type;

    public Symbol(String name, int scopeId, int nodeId, TypeInfo type) {
        this.name = name;
        this.scopeId = scopeId;
        this.nodeId = nodeId;
        this.type = type != null ? type : TypeInfo.UNKNOWN;
    }

    public String getName() {
        return name;
    }

    public int getScopeId() {
        return scopeId;
    }

    public int getNodeId() {
        return nodeId;
    }

    public TypeInfo getType() {
        return type;
    }

    void setType(TypeInfo type) {
        this.type = type != null ? type : TypeInfo.UNKNOWN;
    }

    @Override
    public String toString() {
        return name + ": " + type + " @scope" + scopeId;
    }
}

package com.taintgrep.engine.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// FunctionDefinition: a registered function
// ============================================
public class FunctionDefinition {
    private final FunctionId id;
    private final FunctionSignature signature;
    private final int nodeId;
    private final List<String> parameters;
    private final String returnType;

    public FunctionDefinition(FunctionId id, FunctionSignature signature, int nodeId,
                              List<String> parameters, String returnType) {
        this.id = id;
        this.signature = signature;
        this.nodeId = nodeId;
        this.parameters = parameters != null ? new ArrayList<>(parameters) : new ArrayList<>();
        this.returnType = returnType;
    }

    public FunctionId getId() {
        return id;
    }

    public FunctionSignature getSignature() {
        return signature;
    }

    public int getNodeId() {
        return nodeId;
    }

    public List<String> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    /**
     * @return declared return type, or null
     */
    public String getReturnType() {
        return returnType;
    }

    @Override
    public String toString() {
        return id + " " + signature;
    }
}

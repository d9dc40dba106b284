package com.taintgrep.engine.dataflow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// CallSite: one call from a registered function
// ============================================
public class CallSite {
    private final int id;
    private final FunctionId callerId;
    private final FunctionSignature calleeSignature;
    private final List<String> arguments;
    private final int nodeId;

    public CallSite(int id, FunctionId callerId, FunctionSignature calleeSignature,
                    List<String> arguments, int nodeId) {
        this.id = id;
        this.callerId = callerId;
        this.calleeSignature = calleeSignature;
        this.arguments = arguments != null ? new ArrayList<>(arguments) : new ArrayList<>();
        this.nodeId = nodeId;
    }

    public int getId() {
        return id;
    }

    public FunctionId getCallerId() {
        return callerId;
    }

    public FunctionSignature getCalleeSignature() {
        return calleeSignature;
    }

    /**
     * @return argument source texts, in call order
     */
    public List<String> getArguments() {
        return Collections.unmodifiableList(arguments);
    }

    public int getNodeId() {
        return nodeId;
    }

    @Override
    public String toString() {
        return "call#" + id + " " + callerId + " -> " + calleeSignature;
    }
}

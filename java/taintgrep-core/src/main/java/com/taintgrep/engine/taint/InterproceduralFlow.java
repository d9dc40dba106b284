package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.FunctionId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// InterproceduralFlow: taint reaching a sink parameter through a call chain
// ============================================
public class InterproceduralFlow {
    private final List<FunctionId> callChain;
    private final String parameter;
    private final String sinkDescription;
    private final double confidence;

    public InterproceduralFlow(List<FunctionId> callChain, String parameter, String sinkDescription,
                               double confidence) {
        this.callChain = Collections.unmodifiableList(new ArrayList<>(callChain));
        this.parameter = parameter;
        this.sinkDescription = sinkDescription;
        this.confidence = confidence;
    }

    /**
     * @return functions from the entry point to the function holding the sink
     */
    public List<FunctionId> getCallChain() {
        return callChain;
    }

    public FunctionId getEntry() {
        return callChain.get(0);
    }

    public FunctionId getSinkFunction() {
        return callChain.get(callChain.size() - 1);
    }

    public String getParameter() {
        return parameter;
    }

    public String getSinkDescription() {
        return sinkDescription;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return callChain + " -> " + parameter + " (" + sinkDescription + ", " + confidence + ")";
    }
}

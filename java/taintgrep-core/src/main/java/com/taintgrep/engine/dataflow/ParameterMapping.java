package com.taintgrep.engine.dataflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

// ============================================
// ParameterMapping: callee parameter index to argument text for one call
// ============================================
public class ParameterMapping {
    private final int callId;
    private final Map<Integer, String> arguments;

    public ParameterMapping(int callId, Map<Integer, String> arguments) {
        this.callId = callId;
        this.arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public int getCallId() {
        return callId;
    }

    public Map<Integer, String> getArguments() {
        return arguments;
    }

    public String getArgument(int parameterIndex) {
        return arguments.get(parameterIndex);
    }

    public int size() {
        return arguments.size();
    }
}

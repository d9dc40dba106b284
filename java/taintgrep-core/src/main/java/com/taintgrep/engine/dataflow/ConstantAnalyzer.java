package com.taintgrep.engine.dataflow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Registry of named constants that flags the ones looking like secrets.
 */
public class ConstantAnalyzer {

    public static final List<String> DEFAULT_SENSITIVE_KEYWORDS = Collections.unmodifiableList(Arrays.asList(
        "password", "secret", "token", "api_key", "private_key", "credential"));

    private final Map<String, ConstantInfo> constants = new LinkedHashMap<>();
    private final Map<String, List<ConstantValue>> functionReturns = new LinkedHashMap<>();
    private final List<String> sensitivePatterns = new ArrayList<>(DEFAULT_SENSITIVE_KEYWORDS);

    public void addSensitivePattern(String pattern) {
        if (pattern != null && !pattern.trim().isEmpty()) {
            sensitivePatterns.add(pattern.trim().toLowerCase(Locale.ROOT));
        }
    }

    /**
     * Register or re-register a constant. A repeated name keeps its count of
     * assignments.
     */
    public void registerConstant(String name, ConstantValue value) {
        ConstantInfo previous = constants.get(name);
        ConstantInfo info = new ConstantInfo(value, isSensitive(name, value));
        if (previous != null) {
            for (int i = 0; i < previous.getAssignmentCount(); i++) {
                info.incrementAssignments();
            }
            if (previous.isMutable()) {
                info.markMutable();
            }
        }
        constants.put(name, info);
    }

    /**
     * Register every named constant a propagator found.
     */
    public void absorb(ConstantPropagator propagator) {
        for (Map.Entry<String, ConstantValue> entry : propagator.getConstants().entrySet()) {
            registerConstant(entry.getKey(), entry.getValue());
        }
    }

    private boolean isSensitive(String name, ConstantValue value) {
        String lowerName = name.toLowerCase(Locale.ROOT);
        String printed = value != null ? value.toStringValue() : null;
        String lowerValue = printed != null ? printed.toLowerCase(Locale.ROOT) : null;
        for (String pattern : sensitivePatterns) {
            if (lowerName.contains(pattern) || (lowerValue != null && lowerValue.contains(pattern))) {
                return true;
            }
        }
        return false;
    }

    /**
     * @see ConstantValue#fold(String)
     */
    public ConstantValue foldConstants(String expression) {
        return ConstantValue.fold(expression);
    }

    public ConstantInfo getConstant(String name) {
        return constants.get(name);
    }

    public ConstantValue getConstantValue(String name) {
        ConstantInfo info = constants.get(name);
        return info != null ? info.getValue() : null;
    }

    public boolean isConstant(String name) {
        ConstantInfo info = constants.get(name);
        return info != null && !info.isMutable();
    }

    public boolean isSensitive(String name) {
        ConstantInfo info = constants.get(name);
        return info != null && info.isSensitive();
    }

    public void markMutable(String name) {
        ConstantInfo info = constants.get(name);
        if (info != null) {
            info.markMutable();
        }
    }

    public Map<String, ConstantInfo> getSensitiveConstants() {
        Map<String, ConstantInfo> sensitive = new LinkedHashMap<>();
        for (Map.Entry<String, ConstantInfo> entry : constants.entrySet()) {
            if (entry.getValue().isSensitive()) {
                sensitive.put(entry.getKey(), entry.getValue());
            }
        }
        return sensitive;
    }

    public void registerFunctionReturn(String functionName, ConstantValue value) {
        functionReturns.computeIfAbsent(functionName, ignored -> new ArrayList<>()).add(value);
    }

    public List<ConstantValue> getFunctionReturns(String functionName) {
        return Collections.unmodifiableList(
            functionReturns.getOrDefault(functionName, Collections.<ConstantValue>emptyList()));
    }

    public Map<String, ConstantInfo> getConstants() {
        return Collections.unmodifiableMap(constants);
    }
}

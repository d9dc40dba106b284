package com.taintgrep.engine;

import com.taintgrep.engine.domain.Finding;
import com.taintgrep.engine.taint.TaintFlow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// RuleResult: outcome of executing one rule on one tree
// ============================================
public class RuleResult {
    private final String ruleId;
    private final RuleState state;
    private final List<Finding> findings;
    private final List<TaintFlow> taintFlows;
    private final List<String> patternErrors;
    private final long durationMillis;
    private final String error;

    public RuleResult(String ruleId, RuleState state, List<Finding> findings, List<TaintFlow> taintFlows,
                      List<String> patternErrors, long durationMillis, String error) {
        this.ruleId = ruleId;
        this.state = state;
        this.findings = copy(findings);
        this.taintFlows = copy(taintFlows);
        this.patternErrors = copy(patternErrors);
        this.durationMillis = durationMillis;
        this.error = error;
    }

    static RuleResult failed(String ruleId, long durationMillis, String error) {
        return new RuleResult(ruleId, RuleState.FAILED, null, null, null, durationMillis, error);
    }

    private static <T> List<T> copy(List<T> values) {
        return values != null
            ? Collections.unmodifiableList(new ArrayList<>(values))
            : Collections.<T>emptyList();
    }

    public String getRuleId() {
        return ruleId;
    }

    public RuleState getState() {
        return state;
    }

    public List<Finding> getFindings() {
        return findings;
    }

    public List<TaintFlow> getTaintFlows() {
        return taintFlows;
    }

    /**
     * @return one message per pattern that failed to parse; the rule still ran its other patterns
     */
    public List<String> getPatternErrors() {
        return patternErrors;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public String getError() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }

    @Override
    public String toString() {
        return ruleId + " " + state + " findings=" + findings.size()
            + (error != null ? " error=" + error : "");
    }
}

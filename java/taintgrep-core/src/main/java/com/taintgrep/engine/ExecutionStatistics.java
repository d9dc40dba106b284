package com.taintgrep.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// ============================================
// ExecutionStatistics: counters collected across rule executions
// ============================================
public class ExecutionStatistics {
    private int rulesExecuted;
    private int totalFindings;
    private final Map<String, Long> ruleTimings = new LinkedHashMap<>();
    private final Map<String, Integer> findingsPerRule = new LinkedHashMap<>();
    private final List<String> errors = new ArrayList<>();

    public void record(RuleResult result) {
        rulesExecuted++;
        totalFindings += result.getFindings().size();
        ruleTimings.merge(result.getRuleId(), result.getDurationMillis(), Long::sum);
        findingsPerRule.merge(result.getRuleId(), result.getFindings().size(), Integer::sum);
        if (!result.isSuccess()) {
            errors.add(result.getRuleId() + ": " + result.getError());
        }
        for (String patternError : result.getPatternErrors()) {
            errors.add(result.getRuleId() + ": " + patternError);
        }
    }

    public void merge(ExecutionStatistics other) {
        rulesExecuted += other.rulesExecuted;
        totalFindings += other.totalFindings;
        for (Map.Entry<String, Long> entry : other.ruleTimings.entrySet()) {
            ruleTimings.merge(entry.getKey(), entry.getValue(), Long::sum);
        }
        for (Map.Entry<String, Integer> entry : other.findingsPerRule.entrySet()) {
            findingsPerRule.merge(entry.getKey(), entry.getValue(), Integer::sum);
        }
        errors.addAll(other.errors);
    }

    public int getRulesExecuted() {
        return rulesExecuted;
    }

    public int getTotalFindings() {
        return totalFindings;
    }

    public Map<String, Long> getRuleTimings() {
        return Collections.unmodifiableMap(ruleTimings);
    }

    public Map<String, Integer> getFindingsPerRule() {
        return Collections.unmodifiableMap(findingsPerRule);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }
}

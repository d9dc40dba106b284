package com.taintgrep.engine;

import com.taintgrep.engine.domain.Finding;
import com.taintgrep.engine.taint.TaintFlow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// ============================================
// EngineResult: every rule result for one tree, plus statistics
// ============================================
public class EngineResult {
    private final List<RuleResult> ruleResults;
    private final ExecutionStatistics statistics;

    public EngineResult(List<RuleResult> ruleResults, ExecutionStatistics statistics) {
        this.ruleResults = Collections.unmodifiableList(new ArrayList<>(ruleResults));
        this.statistics = statistics;
    }

    public List<RuleResult> getRuleResults() {
        return ruleResults;
    }

    /**
     * @return findings ordered by rule, then by match
     */
    public List<Finding> getFindings() {
        List<Finding> findings = new ArrayList<>();
        for (RuleResult result : ruleResults) {
            findings.addAll(result.getFindings());
        }
        return findings;
    }

    public List<TaintFlow> getTaintFlows() {
        List<TaintFlow> flows = new ArrayList<>();
        for (RuleResult result : ruleResults) {
            flows.addAll(result.getTaintFlows());
        }
        return flows;
    }

    public ExecutionStatistics getStatistics() {
        return statistics;
    }

    public AnalysisSummary summary() {
        return new AnalysisSummary(getFindings());
    }

    public boolean hasErrors() {
        for (RuleResult result : ruleResults) {
            if (!result.isSuccess()) {
                return true;
            }
        }
        return false;
    }
}

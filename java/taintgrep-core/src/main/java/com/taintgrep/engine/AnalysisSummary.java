package com.taintgrep.engine;

import com.taintgrep.engine.domain.Finding;
import com.taintgrep.engine.domain.Severity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

// ============================================
// AnalysisSummary: finding counts by severity
// ============================================
public class AnalysisSummary {
    private final Map<Severity, Integer> bySeverity = new EnumMap<>(Severity.class);
    private final int total;

    public AnalysisSummary(List<Finding> findings) {
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity, 0);
        }
        for (Finding finding : findings) {
            bySeverity.merge(finding.getSeverity(), 1, Integer::sum);
        }
        this.total = findings.size();
    }

    public int getTotal() {
        return total;
    }

    /**
     * CRITICAL counts as an error.
     */
    public int getErrors() {
        return bySeverity.get(Severity.ERROR) + bySeverity.get(Severity.CRITICAL);
    }

    public int getWarnings() {
        return bySeverity.get(Severity.WARNING);
    }

    public int getInfos() {
        return bySeverity.get(Severity.INFO);
    }

    public int count(Severity severity) {
        return bySeverity.get(severity);
    }

    public int countAtLeast(Severity threshold) {
        int count = 0;
        for (Map.Entry<Severity, Integer> entry : bySeverity.entrySet()) {
            if (entry.getKey().isAtLeast(threshold)) {
                count += entry.getValue();
            }
        }
        return count;
    }

    public Map<Severity, Integer> getBySeverity() {
        return Collections.unmodifiableMap(bySeverity);
    }

    @Override
    public String toString() {
        return "total=" + total + " errors=" + getErrors() + " warnings=" + getWarnings() + " infos=" + getInfos();
    }
}

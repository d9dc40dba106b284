package com.taintgrep.engine.domain;

/**
 * A rule is missing a required field. The rule is excluded; its siblings load.
 */
public class RuleValidationException extends Exception {
    private final String ruleId;

    public RuleValidationException(String ruleId, String message) {
        super((ruleId != null ? "Rule '" + ruleId + "': " : "Rule: ") + message);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}

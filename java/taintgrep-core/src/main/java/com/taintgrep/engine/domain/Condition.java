package com.taintgrep.engine.domain;

// ============================================
// Condition: side condition over a bound metavariable
// ============================================
public class Condition {

    public enum Kind {
        METAVARIABLE_REGEX,
        METAVARIABLE_COMPARISON,
        METAVARIABLE_NAME,
        METAVARIABLE_ANALYSIS
    }

    private final Kind kind;
    private final String metavariable;
    private final String operator;
    private final String value;
    private final MetavariableAnalysis analysis;

    private Condition(Kind kind, String metavariable, String operator, String value,
                      MetavariableAnalysis analysis) {
        this.kind = kind;
        this.metavariable = metavariable;
        this.operator = operator;
        this.value = value;
        this.analysis = analysis;
    }

    public static Condition regex(String metavariable, String regex) {
        return new Condition(Kind.METAVARIABLE_REGEX, metavariable, null, regex, null);
    }

    /**
     * @param operator one of ==, !=, contains, starts_with, ends_with, matches, &gt;, &lt;,
     *                 &gt;=, &lt;=, len&gt;, len&lt;, len==
     */
    public static Condition comparison(String metavariable, String operator, String value) {
        return new Condition(Kind.METAVARIABLE_COMPARISON, metavariable, operator, value, null);
    }

    public static Condition name(String metavariable, String namePattern) {
        return new Condition(Kind.METAVARIABLE_NAME, metavariable, null, namePattern, null);
    }

    public static Condition analysis(String metavariable, MetavariableAnalysis analysis) {
        return new Condition(Kind.METAVARIABLE_ANALYSIS, metavariable, null, null, analysis);
    }

    public Kind getKind() {
        return kind;
    }

    public String getMetavariable() {
        return metavariable;
    }

    public String getOperator() {
        return operator;
    }

    public String getValue() {
        return value;
    }

    public MetavariableAnalysis getAnalysis() {
        return analysis;
    }

    @Override
    public String toString() {
        return kind + "(" + metavariable + (operator != null ? " " + operator : "")
            + (value != null ? " " + value : "") + ")";
    }
}

package com.taintgrep.engine.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

// ============================================
// Pattern: one rule pattern with combinator, conditions and focus
// ============================================
public class Pattern {
    private final PatternType type;
    private final String value;
    private final List<Pattern> subPatterns;
    private final List<Condition> conditions;
    private final List<String> focus;

    private Pattern(PatternType type, String value, List<Pattern> subPatterns) {
        this.type = type;
        this.value = value;
        this.subPatterns = subPatterns != null ? new ArrayList<>(subPatterns) : new ArrayList<>();
        this.conditions = new ArrayList<>();
        this.focus = new ArrayList<>();
    }

    public static Pattern simple(String pattern) {
        return new Pattern(PatternType.SIMPLE, pattern, null);
    }

    public static Pattern either(Pattern... patterns) {
        return new Pattern(PatternType.EITHER, null, Arrays.asList(patterns));
    }

    public static Pattern inside(Pattern pattern) {
        return new Pattern(PatternType.INSIDE, null, Collections.singletonList(pattern));
    }

    public static Pattern notInside(Pattern pattern) {
        return new Pattern(PatternType.NOT_INSIDE, null, Collections.singletonList(pattern));
    }

    public static Pattern not(Pattern pattern) {
        return new Pattern(PatternType.NOT, null, Collections.singletonList(pattern));
    }

    public static Pattern regex(String regex) {
        return new Pattern(PatternType.REGEX, regex, null);
    }

    public static Pattern notRegex(String regex) {
        return new Pattern(PatternType.NOT_REGEX, regex, null);
    }

    public static Pattern all(Pattern... patterns) {
        return new Pattern(PatternType.ALL, null, Arrays.asList(patterns));
    }

    public static Pattern any(Pattern... patterns) {
        return new Pattern(PatternType.ANY, null, Arrays.asList(patterns));
    }

    public Pattern addCondition(Condition condition) {
        if (condition != null) {
            conditions.add(condition);
        }
        return this;
    }

    public Pattern addFocus(String metavariable) {
        if (metavariable != null && !metavariable.isEmpty()) {
            focus.add(metavariable);
        }
        return this;
    }

    public PatternType getType() {
        return type;
    }

    /**
     * @return pattern string for SIMPLE, regex for REGEX / NOT_REGEX, otherwise null
     */
    public String getValue() {
        return value;
    }

    public List<Pattern> getSubPatterns() {
        return Collections.unmodifiableList(subPatterns);
    }

    /**
     * @return the single operand of INSIDE, NOT_INSIDE and NOT
     */
    public Pattern getInner() {
        return subPatterns.isEmpty() ? null : subPatterns.get(0);
    }

    public List<Condition> getConditions() {
        return Collections.unmodifiableList(conditions);
    }

    public List<String> getFocus() {
        return Collections.unmodifiableList(focus);
    }

    public boolean hasFocus() {
        return !focus.isEmpty();
    }

    /**
     * Text used in finding metadata.
     */
    public String describe() {
        switch (type) {
            case SIMPLE:
                return value;
            case REGEX:
                return "regex:" + value;
            case NOT_REGEX:
                return "not-regex:" + value;
            default: {
                StringBuilder sb = new StringBuilder(type.name().toLowerCase(Locale.ROOT).replace('_', '-')).append('(');
                for (int i = 0; i < subPatterns.size(); i++) {
                    if (i > 0) {
                        sb.append(", ");
                    }
                    sb.append(subPatterns.get(i).describe());
                }
                return sb.append(')').toString();
            }
        }
    }

    @Override
    public String toString() {
        return describe();
    }
}

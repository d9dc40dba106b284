package com.taintgrep.engine.pattern;

import com.taintgrep.engine.domain.Condition;
import com.taintgrep.engine.domain.MetavariableAnalysis;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Evaluates side conditions against the bindings of a structural match.
 * A condition over an unbound metavariable fails.
 */
public class ConditionEvaluator {

    private static final double LOG_2 = Math.log(2);

    private final RegexCache regexes;

    public ConditionEvaluator() {
        this(new RegexCache());
    }

    ConditionEvaluator(RegexCache regexes) {
        this.regexes = regexes;
    }

    /**
     * @return true when every condition holds
     * @throws MatchException on an invalid regex or an unknown comparison operator
     */
    public boolean evaluateAll(List<Condition> conditions, Map<String, String> bindings) {
        for (Condition condition : conditions) {
            if (!evaluate(condition, bindings)) {
                return false;
            }
        }
        return true;
    }

    public boolean evaluate(Condition condition, Map<String, String> bindings) {
        String value = bindings.get(condition.getMetavariable());
        if (value == null) {
            return false;
        }

        switch (condition.getKind()) {
            case METAVARIABLE_REGEX:
                return regexes.find(condition.getValue(), value);
            case METAVARIABLE_COMPARISON:
                return compare(value, condition.getOperator(), condition.getValue());
            case METAVARIABLE_NAME:
                return matchesName(value, condition.getValue());
            case METAVARIABLE_ANALYSIS:
                return analyze(value, condition.getAnalysis());
            default:
                throw new MatchException("Unsupported condition " + condition.getKind());
        }
    }

    // ============================================
    // 1. COMPARISON
    // ============================================

    boolean compare(String value, String operator, String expected) {
        if (operator == null) {
            throw new MatchException("Comparison operator is required");
        }
        switch (operator) {
            case "==":
                return value.equals(expected);
            case "!=":
                return !value.equals(expected);
            case "contains":
                return value.contains(expected);
            case "starts_with":
                return value.startsWith(expected);
            case "ends_with":
                return value.endsWith(expected);
            case "matches":
                return regexes.find(expected, value);
            case ">":
                return order(value, expected) > 0;
            case "<":
                return order(value, expected) < 0;
            case ">=":
                return order(value, expected) >= 0;
            case "<=":
                return order(value, expected) <= 0;
            case "len>":
                return value.length() > parseLength(expected);
            case "len<":
                return value.length() < parseLength(expected);
            case "len==":
                return value.length() == parseLength(expected);
            default:
                throw new MatchException("Unknown comparison operator '" + operator + "'");
        }
    }

    private static int order(String value, String expected) {
        Double left = parseNumber(value);
        Double right = parseNumber(expected);
        if (left != null && right != null) {
            return Double.compare(left, right);
        }
        LocalDate leftDate = parseDate(value);
        LocalDate rightDate = parseDate(expected);
        if (leftDate != null && rightDate != null) {
            return leftDate.compareTo(rightDate);
        }
        return value.compareTo(expected);
    }

    private static Double parseNumber(String text) {
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static LocalDate parseDate(String text) {
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static int parseLength(String expected) {
        try {
            return Integer.parseInt(expected.trim());
        } catch (NumberFormatException e) {
            throw new MatchException("Length comparison needs an integer, got '" + expected + "'", e);
        }
    }

    // ============================================
    // 2. NAME
    // ============================================

    boolean matchesName(String value, String namePattern) {
        if (namePattern.contains("*")) {
            StringBuilder regex = new StringBuilder();
            String[] pieces = namePattern.split("\\*", -1);
            for (int i = 0; i < pieces.length; i++) {
                if (i > 0) {
                    regex.append(".*");
                }
                if (!pieces[i].isEmpty()) {
                    regex.append(Pattern.quote(pieces[i]));
                }
            }
            return regexes.get(regex.toString()).matcher(value).matches();
        }
        return value.equals(namePattern);
    }

    // ============================================
    // 3. ANALYSIS
    // ============================================

    boolean analyze(String value, MetavariableAnalysis analysis) {
        if (analysis == null) {
            return true;
        }
        MetavariableAnalysis.Entropy entropy = analysis.getEntropy();
        if (entropy != null) {
            double measured = shannonEntropy(value);
            if (measured < entropy.getMinEntropy()) {
                return false;
            }
            if (entropy.getMaxEntropy() != null && measured > entropy.getMaxEntropy()) {
                return false;
            }
            if (entropy.getCharset() != null && !matchesCharset(value, entropy.getCharset())) {
                return false;
            }
        }

        MetavariableAnalysis.TypeCheck typeCheck = analysis.getTypeCheck();
        if (typeCheck != null) {
            if (!typeCheck.getExpectedTypes().isEmpty()) {
                boolean expected = false;
                for (String type : typeCheck.getExpectedTypes()) {
                    if (matchesType(value, type)) {
                        expected = true;
                        break;
                    }
                }
                if (!expected) {
                    return false;
                }
            }
            for (String type : typeCheck.getForbiddenTypes()) {
                if (matchesType(value, type)) {
                    return false;
                }
            }
        }

        MetavariableAnalysis.Complexity complexity = analysis.getComplexity();
        if (complexity != null && lineCount(value) > complexity.getMaxLines()) {
            return false;
        }
        return true;
    }

    /**
     * Shannon entropy in bits per character.
     */
    public static double shannonEntropy(String text) {
        if (text.isEmpty()) {
            return 0.0;
        }
        Map<Character, Integer> counts = new HashMap<>();
        for (int i = 0; i < text.length(); i++) {
            counts.merge(text.charAt(i), 1, Integer::sum);
        }
        double length = text.length();
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = count / length;
            entropy -= p * (Math.log(p) / LOG_2);
        }
        return entropy;
    }

    private static boolean matchesCharset(String value, String charset) {
        switch (charset) {
            case "alphanumeric":
                return value.chars().allMatch(Character::isLetterOrDigit);
            case "alphabetic":
                return value.chars().allMatch(Character::isLetter);
            case "numeric":
                return value.chars().allMatch(Character::isDigit);
            case "ascii":
                return value.chars().allMatch(c -> c < 128);
            default:
                return true;
        }
    }

    private static boolean matchesType(String value, String type) {
        switch (type) {
            case "string":
                return true;
            case "number":
                return parseNumber(value) != null;
            case "integer":
                try {
                    Long.parseLong(value.trim());
                    return true;
                } catch (NumberFormatException e) {
                    return false;
                }
            case "boolean":
                return "true".equals(value) || "false".equals(value);
            case "null":
                return "null".equals(value) || "None".equals(value) || "nil".equals(value);
            default:
                return false;
        }
    }

    private static int lineCount(String value) {
        if (value.isEmpty()) {
            return 0;
        }
        return value.split("\r?\n", -1).length - (value.endsWith("\n") ? 1 : 0);
    }
}

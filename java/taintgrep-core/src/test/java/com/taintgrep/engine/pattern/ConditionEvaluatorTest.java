package com.taintgrep.engine.pattern;

import com.taintgrep.engine.domain.Condition;
import com.taintgrep.engine.domain.MetavariableAnalysis;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    private static Map<String, String> bind(String name, String value) {
        Map<String, String> bindings = new HashMap<>();
        bindings.put(name, value);
        return bindings;
    }

    @Test
    void unboundMetavariableFails() {
        assertFalse(evaluator.evaluate(Condition.regex("X", ".*"), Collections.<String, String>emptyMap()));
    }

    @Test
    void regexSearchesAnywhere() {
        assertTrue(evaluator.evaluate(Condition.regex("KEY", "(?i)password"), bind("KEY", "dbPassword")));
        assertFalse(evaluator.evaluate(Condition.regex("KEY", "^password"), bind("KEY", "dbPassword")));
    }

    @Test
    void orderingComparesNumbersNumerically() {
        assertTrue(evaluator.evaluate(Condition.comparison("N", ">", "9"), bind("N", "10")));
        assertTrue(evaluator.evaluate(Condition.comparison("N", "<=", "10"), bind("N", "10.0")));
    }

    @Test
    void orderingComparesIsoDates() {
        assertTrue(evaluator.evaluate(Condition.comparison("D", ">", "2023-12-31"), bind("D", "2024-01-02")));
    }

    @Test
    void stringAndLengthOperators() {
        Map<String, String> bindings = bind("S", "getParameter");

        assertTrue(evaluator.evaluate(Condition.comparison("S", "starts_with", "get"), bindings));
        assertTrue(evaluator.evaluate(Condition.comparison("S", "contains", "Param"), bindings));
        assertTrue(evaluator.evaluate(Condition.comparison("S", "len==", "12"), bindings));
        assertFalse(evaluator.evaluate(Condition.comparison("S", "==", "getparameter"), bindings));
    }

    @Test
    void unknownOperatorIsRejected() {
        assertThrows(MatchException.class,
            () -> evaluator.evaluate(Condition.comparison("S", "~=", "x"), bind("S", "x")));
    }

    @Test
    void nameSupportsWildcards() {
        assertTrue(evaluator.evaluate(Condition.name("T", "java.sql.*"), bind("T", "java.sql.Statement")));
        assertFalse(evaluator.evaluate(Condition.name("T", "java.sql.*"), bind("T", "javaxsql.Statement")));
        assertTrue(evaluator.evaluate(Condition.name("T", "Statement"), bind("T", "Statement")));
    }

    @Test
    void nameWildcardTreatsOtherCharactersLiterally() {
        assertFalse(evaluator.evaluate(Condition.name("N", "foo+*"), bind("N", "fooo_bar")));
        assertTrue(evaluator.evaluate(Condition.name("N", "foo+*"), bind("N", "foo+bar")));
        assertTrue(evaluator.evaluate(Condition.name("N", "$ref[*]"), bind("N", "$ref[0]")));
        assertFalse(evaluator.evaluate(Condition.name("N", "get(*"), bind("N", "getter")));
        assertTrue(evaluator.evaluate(Condition.name("N", "*.get?"), bind("N", "map.get?")));
    }

    @Test
    void entropyOfUniformAlphabet() {
        assertEquals(0.0, ConditionEvaluator.shannonEntropy("aaaa"), 1e-9);
        assertEquals(2.0, ConditionEvaluator.shannonEntropy("abcd"), 1e-9);
    }

    @Test
    void entropyAnalysisRejectsLowEntropySecrets() {
        Condition condition = Condition.analysis("V",
            new MetavariableAnalysis().withEntropy(3.0, null, "alphanumeric"));

        assertFalse(evaluator.evaluate(condition, bind("V", "aaaaaaaa")));
        assertTrue(evaluator.evaluate(condition, bind("V", "x7Kq9Lm2Zp4W")));
        assertFalse(evaluator.evaluate(condition, bind("V", "x7Kq-9Lm2-Zp4W")));
    }

    @Test
    void typeAnalysisChecksExpectedAndForbiddenTypes() {
        Condition numeric = Condition.analysis("V",
            new MetavariableAnalysis().withTypes(Arrays.asList("number"), null));
        Condition notNull = Condition.analysis("V",
            new MetavariableAnalysis().withTypes(null, Arrays.asList("null")));

        assertTrue(evaluator.evaluate(numeric, bind("V", "42")));
        assertFalse(evaluator.evaluate(numeric, bind("V", "abc")));
        assertFalse(evaluator.evaluate(notNull, bind("V", "None")));
        assertTrue(evaluator.evaluate(notNull, bind("V", "value")));
    }

    @Test
    void complexityAnalysisCountsLines() {
        Condition condition = Condition.analysis("V", new MetavariableAnalysis().withMaxLines(2));

        assertTrue(evaluator.evaluate(condition, bind("V", "a\nb\n")));
        assertFalse(evaluator.evaluate(condition, bind("V", "a\nb\nc")));
    }

    @Test
    void allConditionsMustHold() {
        Map<String, String> bindings = bind("S", "exec");

        assertTrue(evaluator.evaluateAll(Arrays.asList(
            Condition.regex("S", "ex"), Condition.comparison("S", "len<", "5")), bindings));
        assertFalse(evaluator.evaluateAll(Arrays.asList(
            Condition.regex("S", "ex"), Condition.comparison("S", "len>", "5")), bindings));
    }
}

package com.taintgrep.engine;

import com.taintgrep.engine.domain.Confidence;
import com.taintgrep.engine.domain.Pattern;
import com.taintgrep.engine.domain.Rule;
import com.taintgrep.engine.domain.Severity;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleSetTest {

    private static Rule rule(String id) {
        return new Rule(id, "Rule " + id, "description", Severity.WARNING, Confidence.MEDIUM)
            .addLanguage("java")
            .addPattern(Pattern.simple("eval"));
    }

    @Test
    void defaultsAllValidate() {
        RuleSet rules = RuleSet.defaults();

        assertEquals(5, rules.size());
        assertTrue(rules.getRejected().isEmpty());
        assertNotNull(rules.find(DefaultRules.SQL_INJECTION));
    }

    @Test
    void invalidRuleIsRejectedButSiblingsLoad() {
        Rule noPattern = new Rule("empty", "Empty", "no patterns", Severity.INFO, Confidence.LOW).addLanguage("java");

        RuleSet rules = RuleSet.load(Arrays.asList(rule("a"), noPattern, rule("b")));

        assertEquals(2, rules.size());
        assertEquals(1, rules.getRejected().size());
        assertEquals("empty", rules.getRejected().get(0).getRuleId());
        assertNull(rules.find("empty"));
    }

    @Test
    void duplicateIdKeepsFirst() {
        Rule first = rule("dup");
        Rule second = rule("dup");

        RuleSet rules = RuleSet.load(Arrays.asList(first, second));

        assertEquals(1, rules.size());
        assertTrue(rules.find("dup") == first);
        assertTrue(rules.getRejected().get(0).getMessage().contains("duplicate rule id"));
    }
}

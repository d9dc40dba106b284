package com.taintgrep.engine.bytecode;

import com.taintgrep.engine.DefaultRules;
import com.taintgrep.engine.EngineConfig;
import com.taintgrep.engine.EngineResult;
import com.taintgrep.engine.RuleExecutionEngine;
import com.taintgrep.engine.RuleResult;
import com.taintgrep.engine.RuleState;
import com.taintgrep.engine.domain.Confidence;
import com.taintgrep.engine.domain.Finding;
import com.taintgrep.engine.fixtures.ClassFiles;
import com.taintgrep.engine.fixtures.ScriptRunner;
import com.taintgrep.engine.fixtures.TokenSigner;
import com.taintgrep.engine.fixtures.UserLookup;
import com.taintgrep.engine.tree.UniversalNode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Default rules run over trees built from the compiled fixture classes.
 */
class BytecodeRuleExecutionTest {

    private final BytecodeTreeBuilder treeBuilder = new BytecodeTreeBuilder();
    private final RuleExecutionEngine engine = new RuleExecutionEngine(EngineConfig.defaults());

    private UniversalNode tree(Class<?> fixture) {
        return treeBuilder.build(ClassFiles.bytesOf(fixture));
    }

    @Test
    void requestParameterReachingQueryIsConfirmed() {
        RuleResult result = engine.executeRule(DefaultRules.sqlInjection(), tree(UserLookup.class),
            BytecodeTreeBuilder.LANGUAGE, "UserLookup.class");

        assertEquals(RuleState.CONFIRMED, result.getState());
        assertEquals(2, result.getFindings().size());

        Finding direct = result.getFindings().get(0);
        assertEquals("confirmed", direct.getMetadata().get("dataflow"));
        assertEquals(Confidence.HIGH, direct.getConfidence());
        assertTrue(direct.getMessage().startsWith("SQL statement executed through Statement.executeQuery("),
            direct.getMessage());
        assertTrue(direct.getLocation().getStartLine() > 1);

        Finding validated = result.getFindings().get(1);
        assertEquals("not_confirmed", validated.getMetadata().get("dataflow"));
        assertEquals(Confidence.LOW, validated.getConfidence());
    }

    @Test
    void validatorBlocksSecondFlow() {
        RuleResult result = engine.executeRule(DefaultRules.sqlInjection(), tree(UserLookup.class),
            BytecodeTreeBuilder.LANGUAGE, "UserLookup.class");

        int vulnerable = 0;
        int blocked = 0;
        for (int i = 0; i < result.getTaintFlows().size(); i++) {
            if (result.getTaintFlows().get(i).isVulnerable()) {
                vulnerable++;
            } else {
                blocked++;
            }
        }
        assertEquals(1, vulnerable);
        assertEquals(1, blocked);
    }

    @Test
    void scriptEvaluationIsReportedOnce() {
        EngineResult result = engine.executeRules(DefaultRules.all(), tree(ScriptRunner.class),
            BytecodeTreeBuilder.LANGUAGE, "ScriptRunner.class");

        assertEquals(1, result.getFindings().size());
        assertEquals(DefaultRules.CODE_EVAL, result.getFindings().get(0).getRuleId());
        assertFalse(result.hasErrors());
    }

    @Test
    void constantTokenAndWeakDigestAreReported() {
        EngineResult result = engine.executeRules(DefaultRules.all(), tree(TokenSigner.class),
            BytecodeTreeBuilder.LANGUAGE, "TokenSigner.class");

        List<String> rules = new ArrayList<>();
        for (Finding finding : result.getFindings()) {
            rules.add(finding.getRuleId());
        }
        assertEquals(2, rules.size(), rules.toString());
        assertTrue(rules.contains(DefaultRules.WEAK_HASH));
        assertTrue(rules.contains(DefaultRules.HARDCODED_SECRET));
    }
}

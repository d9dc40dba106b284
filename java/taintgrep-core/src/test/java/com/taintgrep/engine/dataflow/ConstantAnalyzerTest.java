package com.taintgrep.engine.dataflow;

import com.taintgrep.engine.tree.UniversalNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConstantAnalyzerTest {

    @Test
    void flagsSensitiveNamesAndValues() {
        ConstantAnalyzer analyzer = new ConstantAnalyzer();
        analyzer.registerConstant("DB_PASSWORD", ConstantValue.ofString("hunter2"));
        analyzer.registerConstant("greeting", ConstantValue.ofString("hello"));
        analyzer.registerConstant("header", ConstantValue.ofString("Bearer token-123"));

        assertTrue(analyzer.isSensitive("DB_PASSWORD"));
        assertFalse(analyzer.isSensitive("greeting"));
        assertTrue(analyzer.isSensitive("header"));
        assertEquals(2, analyzer.getSensitiveConstants().size());
    }

    @Test
    void customKeywordsExtendDefaults() {
        ConstantAnalyzer analyzer = new ConstantAnalyzer();
        analyzer.addSensitivePattern(" Signing ");
        analyzer.registerConstant("signingSalt", ConstantValue.ofString("x"));

        assertTrue(analyzer.isSensitive("signingSalt"));
    }

    @Test
    void reRegistrationCountsAssignmentsAndKeepsMutability() {
        ConstantAnalyzer analyzer = new ConstantAnalyzer();
        analyzer.registerConstant("limit", ConstantValue.ofInteger(10));
        analyzer.markMutable("limit");
        analyzer.registerConstant("limit", ConstantValue.ofInteger(20));

        assertEquals(2, analyzer.getConstant("limit").getAssignmentCount());
        assertFalse(analyzer.isConstant("limit"));
        assertEquals(ConstantValue.ofInteger(20), analyzer.getConstantValue("limit"));
    }

    @Test
    void absorbsPropagatorResults() {
        ConstantPropagator propagator = new ConstantPropagator();
        propagator.analyze(new DataFlowGraphBuilder().build(
            UniversalNode.branch("variable_declarator", "apiToken = \"t\"",
                UniversalNode.leaf("identifier", "apiToken"),
                UniversalNode.leaf("string_literal", "\"t\""))));
        ConstantAnalyzer analyzer = new ConstantAnalyzer();

        analyzer.absorb(propagator);

        assertTrue(analyzer.isConstant("apiToken"));
        assertTrue(analyzer.isSensitive("apiToken"));
    }

    @Test
    void functionReturnsAccumulate() {
        ConstantAnalyzer analyzer = new ConstantAnalyzer();
        analyzer.registerFunctionReturn("mode", ConstantValue.ofString("a"));
        analyzer.registerFunctionReturn("mode", ConstantValue.NULL);

        assertEquals(2, analyzer.getFunctionReturns("mode").size());
        assertTrue(analyzer.getFunctionReturns("other").isEmpty());
        assertEquals(ConstantValue.ofInteger(3), analyzer.foldConstants("3"));
    }
}

package com.taintgrep.engine.pattern;

import com.taintgrep.engine.tree.UniversalNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternMatcherTest {

    private final PatternMatcher matcher = new PatternMatcher();

    private static UniversalNode call(String text, UniversalNode... args) {
        return UniversalNode.branch("call_expression", text, args);
    }

    @Test
    void literalIsTokenBounded() throws PatternSyntaxException {
        assertTrue(matcher.matches("eval", UniversalNode.leaf("call_expression", "eval(x)")));
        assertTrue(matcher.matches("eval", UniversalNode.leaf("call_expression", "engine.eval(x)")));
        assertFalse(matcher.matches("eval", UniversalNode.leaf("call_expression", "evaluate(x)")));
        assertFalse(matcher.matches("eval", UniversalNode.leaf("identifier", "$eval")));
    }

    @Test
    void caseInsensitiveMatcherFoldsCase() throws PatternSyntaxException {
        PatternMatcher insensitive = new PatternMatcher(false, null);

        assertTrue(insensitive.matches("EVAL", UniversalNode.leaf("call_expression", "eval(x)")));
        assertFalse(matcher.matches("EVAL", UniversalNode.leaf("call_expression", "eval(x)")));
    }

    @Test
    void metavariableBindsNodeText() throws PatternSyntaxException {
        assertTrue(matcher.matches("$X", UniversalNode.leaf("identifier", "userId")));
        assertEquals("userId", matcher.getBindings().get("X"));
    }

    @Test
    void repeatedMetavariableMustBindIdentically() throws PatternSyntaxException {
        UniversalNode same = UniversalNode.branch("binary_expression", "a == a",
            UniversalNode.leaf("identifier", "a"), UniversalNode.leaf("identifier", "a"));
        UniversalNode different = UniversalNode.branch("binary_expression", "a == b",
            UniversalNode.leaf("identifier", "a"), UniversalNode.leaf("identifier", "b"));

        assertTrue(matcher.matches("$X $X", same));
        assertFalse(matcher.matches("$X $X", different));
    }

    @Test
    void failedWindowRollsBackBindings() throws PatternSyntaxException {
        UniversalNode node = UniversalNode.branch("arguments", "(a, b, c)",
            UniversalNode.leaf("identifier", "a"),
            UniversalNode.leaf("identifier", "b"),
            UniversalNode.leaf("identifier", "c"));

        assertTrue(matcher.matches("$X c", node));
        assertEquals("b", matcher.getBindings().get("X"));
    }

    @Test
    void alternativeTriesBranchesInOrder() throws PatternSyntaxException {
        assertTrue(matcher.matches("exec | system", UniversalNode.leaf("call_expression", "os.system(cmd)")));
        assertFalse(matcher.matches("exec | system", UniversalNode.leaf("call_expression", "spawn(cmd)")));
    }

    @Test
    void failedAlternativeBranchLeavesNoBinding() throws PatternSyntaxException {
        UniversalNode node = call("obj.bar()",
            UniversalNode.leaf("identifier", "obj"), UniversalNode.leaf("identifier", "bar"));

        assertTrue(matcher.matches("($Y foo) | ($X bar)", node));
        assertEquals("obj", matcher.getBindings().get("X"));
        assertFalse(matcher.getBindings().containsKey("Y"));
    }

    @Test
    void failedBranchBindingDoesNotBlockLaterBranch() throws PatternSyntaxException {
        UniversalNode node = call("a.obj.bar()",
            UniversalNode.leaf("identifier", "a"),
            UniversalNode.leaf("identifier", "obj"),
            UniversalNode.leaf("identifier", "bar"));

        assertTrue(matcher.matches("($X foo) | ($X bar)", node));
        assertEquals("obj", matcher.getBindings().get("X"));
    }

    @Test
    void kindSelectorComparesNodeKind() throws PatternSyntaxException {
        UniversalNode node = call("eval(x)", UniversalNode.leaf("identifier", "x"));

        assertTrue(matcher.matches("@call_expression", node));
        assertFalse(matcher.matches("@identifier", node));
    }

    @Test
    void ellipsisMetavariableBindsTextlessNodeToEmpty() throws PatternSyntaxException {
        assertTrue(matcher.matches("$...ARGS", UniversalNode.leaf("arguments", null)));
        assertEquals("", matcher.getBindings().get("ARGS"));
        assertFalse(matcher.matches("$X", UniversalNode.leaf("arguments", null)));
    }

    @Test
    void depthLimitOfZeroRejectsEverything() throws PatternSyntaxException {
        PatternMatcher limited = new PatternMatcher(true, 0);

        assertFalse(limited.matches("...", UniversalNode.leaf("identifier", "x")));
    }

    @Test
    void depthLimitStopsDescentIntoChildren() throws PatternSyntaxException {
        PatternMatcher limited = new PatternMatcher(true, 1);
        UniversalNode node = UniversalNode.branch("binary_expression", "a + b",
            UniversalNode.leaf("identifier", "a"), UniversalNode.leaf("identifier", "b"));

        assertTrue(limited.matches("a", node));
        assertFalse(limited.matches("a b", node));
    }

    @Test
    void bindingsPersistAcrossMatchCallsUntilReset() throws PatternSyntaxException {
        PatternParser parser = new PatternParser();
        matcher.match(parser.parse("$X"), UniversalNode.leaf("identifier", "a"));

        assertFalse(matcher.match(parser.parse("$X"), UniversalNode.leaf("identifier", "b")));
        matcher.reset();
        assertTrue(matcher.match(parser.parse("$X"), UniversalNode.leaf("identifier", "b")));
    }
}

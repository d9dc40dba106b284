package com.taintgrep.engine.pattern;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternParserTest {

    private final PatternParser parser = new PatternParser();

    @Test
    void parsesSingleLiteral() throws PatternSyntaxException {
        assertEquals(ParsedPattern.literal("eval"), parser.parse("eval"));
    }

    @Test
    void parsesMetavariablesAndKindSelectors() throws PatternSyntaxException {
        assertEquals(ParsedPattern.metavariable("X"), parser.parse("$X"));
        assertEquals(ParsedPattern.ellipsisMetavariable("ARGS"), parser.parse("$...ARGS"));
        assertEquals(ParsedPattern.kindSelector("call_expression"), parser.parse("@call_expression"));
    }

    @Test
    void emptyPatternIsWildcard() throws PatternSyntaxException {
        assertEquals(ParsedPattern.Kind.WILDCARD, parser.parse("").getKind());
        assertEquals(ParsedPattern.Kind.WILDCARD, parser.parse("   ").getKind());
    }

    @Test
    void parenthesesCollapseToTheirContent() throws PatternSyntaxException {
        ParsedPattern parsed = parser.parse("foo(...)");

        assertEquals(ParsedPattern.sequence(ParsedPattern.literal("foo"), ParsedPattern.wildcard()), parsed);
    }

    @Test
    void pipeBindsLooserThanSequence() throws PatternSyntaxException {
        ParsedPattern parsed = parser.parse("a b | c");

        assertEquals(ParsedPattern.alternative(
            ParsedPattern.sequence(ParsedPattern.literal("a"), ParsedPattern.literal("b")),
            ParsedPattern.literal("c")), parsed);
    }

    @Test
    void quotedLiteralKeepsSpacesAndEscapes() throws PatternSyntaxException {
        assertEquals(ParsedPattern.literal("a \"b\""), parser.parse("\"a \\\"b\\\"\""));
    }

    @Test
    void rejectsBareDollar() {
        PatternSyntaxException e = assertThrows(PatternSyntaxException.class, () -> parser.parse("$"));
        assertTrue(e.getMessage().startsWith("Invalid metavariable"));
        assertEquals(1, e.getPosition());
        assertEquals("$", e.getPattern());
    }

    @Test
    void rejectsShortEllipsis() {
        PatternSyntaxException e = assertThrows(PatternSyntaxException.class, () -> parser.parse("$..X"));
        assertTrue(e.getMessage().startsWith("Invalid ellipsis pattern"));
    }

    @Test
    void rejectsTwoDotWildcard() {
        assertThrows(PatternSyntaxException.class, () -> parser.parse("foo(..)"));
    }

    @Test
    void reportsUnbalancedParentheses() {
        PatternSyntaxException open = assertThrows(PatternSyntaxException.class, () -> parser.parse("(a"));
        assertTrue(open.getMessage().startsWith("Missing closing parenthesis"));
        assertEquals(1, open.getPosition());

        PatternSyntaxException close = assertThrows(PatternSyntaxException.class, () -> parser.parse("a)"));
        assertTrue(close.getMessage().startsWith("Unexpected closing parenthesis"));
        assertEquals(2, close.getPosition());
    }

    @Test
    void rejectsNullPattern() {
        PatternSyntaxException e = assertThrows(PatternSyntaxException.class, () -> parser.parse(null));
        assertEquals(-1, e.getPosition());
    }
}

package com.taintgrep.engine.pattern;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses pattern strings into {@link ParsedPattern} trees.
 *
 * Grammar, lowest precedence first:
 * <pre>
 *   alternative := sequence ('|' sequence)*
 *   sequence    := primary*
 *   primary     := literal | $NAME | $...NAME | @kind | ... | '(' alternative ')'
 * </pre>
 * Stateless; one instance can be shared by every matcher on a thread.
 */
public class PatternParser {

    private static final String LITERAL_CONTINUATION = "_-+*=<>!&^%#";

    // ============================================
    // 1. PUBLIC API
    // ============================================

    /**
     * Parse a pattern string.
     *
     * @param pattern pattern text
     * @return parsed pattern; an empty pattern parses to a wildcard
     * @throws PatternSyntaxException on malformed metavariables, wildcards or parentheses
     */
    public ParsedPattern parse(String pattern) throws PatternSyntaxException {
        if (pattern == null) {
            throw new PatternSyntaxException("Pattern is null", null, -1);
        }
        List<Token> tokens = tokenize(pattern);
        if (tokens.isEmpty()) {
            return ParsedPattern.wildcard();
        }
        Cursor cursor = new Cursor(pattern, tokens);
        ParsedPattern parsed = parseAlternative(cursor);
        if (cursor.hasMore()) {
            Token stray = cursor.peek();
            if (stray.type == TokenType.RIGHT_PAREN) {
                throw new PatternSyntaxException("Unexpected closing parenthesis", pattern, stray.position);
            }
            throw new PatternSyntaxException("Unexpected token '" + stray.text + "'", pattern, stray.position);
        }
        return parsed;
    }

    // ============================================
    // 2. TOKENIZER
    // ============================================

    List<Token> tokenize(String pattern) throws PatternSyntaxException {
        List<Token> tokens = new ArrayList<>();
        int length = pattern.length();
        int i = 0;

        while (i < length) {
            char ch = pattern.charAt(i);
            int position = i + 1;

            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }

            switch (ch) {
                case '$': {
                    i++;
                    boolean ellipsis = false;
                    if (i < length && pattern.charAt(i) == '.') {
                        int dots = 0;
                        while (i < length && pattern.charAt(i) == '.' && dots < 3) {
                            dots++;
                            i++;
                        }
                        if (dots < 3) {
                            throw new PatternSyntaxException("Invalid ellipsis pattern", pattern, i);
                        }
                        ellipsis = true;
                    }
                    int start = i;
                    while (i < length && isNameChar(pattern.charAt(i))) {
                        i++;
                    }
                    String name = pattern.substring(start, i);
                    if (name.isEmpty()) {
                        throw new PatternSyntaxException(
                            ellipsis ? "Invalid ellipsis metavariable" : "Invalid metavariable", pattern, i);
                    }
                    tokens.add(new Token(ellipsis ? TokenType.ELLIPSIS_METAVARIABLE : TokenType.METAVARIABLE,
                        name, position));
                    break;
                }
                case '@': {
                    i++;
                    int start = i;
                    while (i < length && isNameChar(pattern.charAt(i))) {
                        i++;
                    }
                    if (start == i) {
                        throw new PatternSyntaxException("Invalid node kind", pattern, i);
                    }
                    tokens.add(new Token(TokenType.KIND_SELECTOR, pattern.substring(start, i), position));
                    break;
                }
                case '(':
                    tokens.add(new Token(TokenType.LEFT_PAREN, "(", position));
                    i++;
                    break;
                case ')':
                    tokens.add(new Token(TokenType.RIGHT_PAREN, ")", position));
                    i++;
                    break;
                case '|':
                    tokens.add(new Token(TokenType.PIPE, "|", position));
                    i++;
                    break;
                case '.': {
                    if (i + 1 < length && pattern.charAt(i + 1) == '.') {
                        if (i + 2 < length && pattern.charAt(i + 2) == '.') {
                            tokens.add(new Token(TokenType.WILDCARD, "...", position));
                            i += 3;
                        } else {
                            throw new PatternSyntaxException("Invalid wildcard", pattern, i + 2);
                        }
                    } else {
                        tokens.add(new Token(TokenType.LITERAL, ".", position));
                        i++;
                    }
                    break;
                }
                case '"': {
                    i++;
                    StringBuilder literal = new StringBuilder();
                    boolean escaped = false;
                    while (i < length) {
                        char next = pattern.charAt(i++);
                        if (escaped) {
                            literal.append(unescape(next));
                            escaped = false;
                        } else if (next == '\\') {
                            escaped = true;
                        } else if (next == '"') {
                            break;
                        } else {
                            literal.append(next);
                        }
                    }
                    tokens.add(new Token(TokenType.LITERAL, literal.toString(), position));
                    break;
                }
                default: {
                    int start = i;
                    i++;
                    while (i < length && isLiteralChar(pattern.charAt(i))) {
                        i++;
                    }
                    tokens.add(new Token(TokenType.LITERAL, pattern.substring(start, i), position));
                    break;
                }
            }
        }

        return tokens;
    }

    private static boolean isNameChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private static boolean isLiteralChar(char ch) {
        return Character.isLetterOrDigit(ch) || LITERAL_CONTINUATION.indexOf(ch) >= 0;
    }

    private static String unescape(char ch) {
        switch (ch) {
            case 'n':
                return "\n";
            case 't':
                return "\t";
            case 'r':
                return "\r";
            case '\\':
                return "\\";
            case '"':
                return "\"";
            default:
                return "\\" + ch;
        }
    }

    // ============================================
    // 3. RECURSIVE DESCENT
    // ============================================

    private ParsedPattern parseAlternative(Cursor cursor) throws PatternSyntaxException {
        List<ParsedPattern> alternatives = new ArrayList<>();
        alternatives.add(parseSequence(cursor));

        while (cursor.hasMore() && cursor.peek().type == TokenType.PIPE) {
            cursor.next();
            alternatives.add(parseSequence(cursor));
        }

        return alternatives.size() == 1 ? alternatives.get(0) : ParsedPattern.alternative(alternatives);
    }

    private ParsedPattern parseSequence(Cursor cursor) throws PatternSyntaxException {
        List<ParsedPattern> elements = new ArrayList<>();

        while (cursor.hasMore()) {
            TokenType type = cursor.peek().type;
            if (type == TokenType.RIGHT_PAREN || type == TokenType.PIPE) {
                break;
            }
            elements.add(parsePrimary(cursor));
        }

        if (elements.isEmpty()) {
            return ParsedPattern.wildcard();
        }
        return elements.size() == 1 ? elements.get(0) : ParsedPattern.sequence(elements);
    }

    private ParsedPattern parsePrimary(Cursor cursor) throws PatternSyntaxException {
        if (!cursor.hasMore()) {
            throw new PatternSyntaxException("Unexpected end of pattern", cursor.source, -1);
        }
        Token token = cursor.next();
        switch (token.type) {
            case LITERAL:
                return ParsedPattern.literal(token.text);
            case METAVARIABLE:
                return ParsedPattern.metavariable(token.text);
            case ELLIPSIS_METAVARIABLE:
                return ParsedPattern.ellipsisMetavariable(token.text);
            case KIND_SELECTOR:
                return ParsedPattern.kindSelector(token.text);
            case WILDCARD:
                return ParsedPattern.wildcard();
            case LEFT_PAREN: {
                ParsedPattern inner = parseAlternative(cursor);
                if (!cursor.hasMore() || cursor.peek().type != TokenType.RIGHT_PAREN) {
                    throw new PatternSyntaxException("Missing closing parenthesis", cursor.source, token.position);
                }
                cursor.next();
                return inner;
            }
            case RIGHT_PAREN:
                throw new PatternSyntaxException("Unexpected closing parenthesis", cursor.source, token.position);
            default:
                throw new PatternSyntaxException("Unexpected pipe operator", cursor.source, token.position);
        }
    }

    enum TokenType {
        LITERAL,
        METAVARIABLE,
        ELLIPSIS_METAVARIABLE,
        KIND_SELECTOR,
        LEFT_PAREN,
        RIGHT_PAREN,
        PIPE,
        WILDCARD
    }

    static final class Token {
        final TokenType type;
        final String text;
        final int position;

        Token(TokenType type, String text, int position) {
            this.type = type;
            this.text = text;
            this.position = position;
        }
    }

    private static final class Cursor {
        private final String source;
        private final List<Token> tokens;
        private int index;

        Cursor(String source, List<Token> tokens) {
            this.source = source;
            this.tokens = tokens;
        }

        boolean hasMore() {
            return index < tokens.size();
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next() {
            return tokens.get(index++);
        }
    }
}

package com.taintgrep.engine.pattern;

import com.taintgrep.engine.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structural matcher for {@link ParsedPattern} trees.
 *
 * Bindings persist across {@link #match(ParsedPattern, TreeNode)} calls so that
 * a caller can match several sub-patterns against one binding set; call
 * {@link #reset()} between unrelated attempts. Not thread-safe.
 */
public class PatternMatcher {
    private static final Logger logger = LoggerFactory.getLogger(PatternMatcher.class);

    private final PatternParser parser = new PatternParser();
    private final BindingMap bindings = new BindingMap();
    private final boolean caseSensitive;
    private final Integer maxDepth;

    public PatternMatcher() {
        this(true, null);
    }

    /**
     * @param caseSensitive literal comparison mode
     * @param maxDepth recursion limit, or null for none; 0 rejects every attempt
     */
    public PatternMatcher(boolean caseSensitive, Integer maxDepth) {
        this.caseSensitive = caseSensitive;
        this.maxDepth = maxDepth;
    }

    // ============================================
    // 1. ENTRY POINTS
    // ============================================

    /**
     * Match an already parsed pattern against a node, keeping existing bindings.
     *
     * @param pattern parsed pattern
     * @param node candidate node
     * @return true if the node matches
     */
    public boolean match(ParsedPattern pattern, TreeNode node) {
        return matchAt(pattern, node, 0);
    }

    /**
     * Clear bindings, parse the pattern and match it against a node.
     *
     * @param pattern pattern text
     * @param node candidate node
     * @return true if the node matches
     * @throws PatternSyntaxException if the pattern is malformed
     */
    public boolean matches(String pattern, TreeNode node) throws PatternSyntaxException {
        bindings.clear();
        ParsedPattern parsed = parser.parse(pattern);
        return matchAt(parsed, node, 0);
    }

    public void reset() {
        bindings.clear();
    }

    /**
     * @return copy of the current bindings
     */
    public Map<String, String> getBindings() {
        return bindings.snapshot();
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public Integer getMaxDepth() {
        return maxDepth;
    }

    BindingMap bindingMap() {
        return bindings;
    }

    PatternParser parser() {
        return parser;
    }

    // ============================================
    // 2. PER-KIND MATCHING
    // ============================================

    private boolean matchAt(ParsedPattern pattern, TreeNode node, int depth) {
        if (maxDepth != null && depth >= maxDepth) {
            logger.trace("Depth limit {} reached matching {}", maxDepth, pattern);
            return false;
        }
        if (node == null) {
            return false;
        }

        switch (pattern.getKind()) {
            case LITERAL:
                return matchLiteral(pattern.getValue(), node.getText());
            case METAVARIABLE:
                return bindText(pattern.getValue(), node.getText(), false);
            case ELLIPSIS_METAVARIABLE:
                return bindText(pattern.getValue(), node.getText(), true);
            case KIND_SELECTOR:
                return pattern.getValue().equals(node.getKind());
            case SEQUENCE:
                return matchSequence(pattern.getElements(), node, depth);
            case ALTERNATIVE:
                return matchAlternative(pattern.getElements(), node, depth);
            case WILDCARD:
                return true;
            default:
                return false;
        }
    }

    private boolean bindText(String name, String text, boolean ellipsis) {
        if (text == null) {
            if (!ellipsis) {
                return false;
            }
            text = "";
        }
        if (bindings.isBound(name)) {
            return bindings.get(name).equals(text);
        }
        bindings.bind(name, text);
        return true;
    }

    private boolean matchSequence(List<ParsedPattern> elements, TreeNode node, int depth) {
        if (elements.isEmpty()) {
            return true;
        }
        if (elements.size() == 1) {
            return matchAt(elements.get(0), node, depth + 1);
        }

        List<? extends TreeNode> children = node.getChildren();
        int width = elements.size();
        for (int start = 0; start + width <= children.size(); start++) {
            Map<String, String> snapshot = bindings.snapshot();
            boolean windowMatched = true;
            for (int i = 0; i < width; i++) {
                if (!matchAt(elements.get(i), children.get(start + i), depth + 1)) {
                    windowMatched = false;
                    break;
                }
            }
            if (windowMatched) {
                return true;
            }
            bindings.restore(snapshot);
        }
        return false;
    }

    private boolean matchAlternative(List<ParsedPattern> elements, TreeNode node, int depth) {
        for (ParsedPattern element : elements) {
            Map<String, String> snapshot = bindings.snapshot();
            if (matchAt(element, node, depth + 1)) {
                return true;
            }
            bindings.restore(snapshot);
        }
        return false;
    }

    // ============================================
    // 3. LITERAL TEXT
    // ============================================

    /**
     * Token-bounded substring test: an identifier-like edge of the literal may not
     * continue an identifier in the surrounding text, so {@code eval} finds
     * {@code eval(x)} and {@code obj.eval} but not {@code evaluate}.
     */
    boolean matchLiteral(String literal, String text) {
        if (text == null) {
            return false;
        }
        if (literal.isEmpty()) {
            return true;
        }
        String haystack = caseSensitive ? text : text.toLowerCase(Locale.ROOT);
        String needle = caseSensitive ? literal : literal.toLowerCase(Locale.ROOT);

        boolean checkBefore = isIdentifierChar(needle.charAt(0));
        boolean checkAfter = isIdentifierChar(needle.charAt(needle.length() - 1));

        int from = 0;
        while (true) {
            int index = haystack.indexOf(needle, from);
            if (index < 0) {
                return false;
            }
            int end = index + needle.length();
            boolean boundedBefore = !checkBefore || index == 0 || !isIdentifierChar(haystack.charAt(index - 1));
            boolean boundedAfter = !checkAfter || end == haystack.length() || !isIdentifierChar(haystack.charAt(end));
            if (boundedBefore && boundedAfter) {
                return true;
            }
            from = index + 1;
        }
    }

    private static boolean isIdentifierChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }
}

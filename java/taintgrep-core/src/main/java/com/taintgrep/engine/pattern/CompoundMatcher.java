package com.taintgrep.engine.pattern;

import com.taintgrep.engine.domain.Pattern;
import com.taintgrep.engine.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interprets rule {@link Pattern}s (either, inside, not, regex, all, any) on top
 * of a {@link PatternMatcher}, then applies their side conditions.
 *
 * Every branch attempt is wrapped in a binding snapshot; failed branches and
 * negated patterns leave the bindings as they were.
 */
public class CompoundMatcher {
    private static final Logger logger = LoggerFactory.getLogger(CompoundMatcher.class);

    private final PatternMatcher matcher;
    private final RegexCache regexes = new RegexCache();
    private final ConditionEvaluator conditions = new ConditionEvaluator(regexes);
    private final Map<String, ParsedPattern> parsedPatterns = new HashMap<>();

    public CompoundMatcher(PatternMatcher matcher) {
        this.matcher = matcher;
    }

    public PatternMatcher getMatcher() {
        return matcher;
    }

    // ============================================
    // 1. SINGLE NODE
    // ============================================

    /**
     * Match a rule pattern against one node.
     *
     * @param pattern rule pattern
     * @param node candidate node
     * @param ancestors ancestors of the node, root first
     * @return true if the pattern and all of its conditions hold
     * @throws PatternSyntaxException if a simple pattern string is malformed
     * @throws MatchException on an invalid regex or comparison operator
     */
    public boolean matches(Pattern pattern, TreeNode node, List<? extends TreeNode> ancestors)
        throws PatternSyntaxException {
        BindingMap bindings = matcher.bindingMap();
        Map<String, String> snapshot = bindings.snapshot();

        if (!matchStructure(pattern, node, ancestors)) {
            bindings.restore(snapshot);
            return false;
        }
        if (!pattern.getConditions().isEmpty()
            && !conditions.evaluateAll(pattern.getConditions(), bindings.asMap())) {
            bindings.restore(snapshot);
            return false;
        }
        return true;
    }

    private boolean matchStructure(Pattern pattern, TreeNode node, List<? extends TreeNode> ancestors)
        throws PatternSyntaxException {
        BindingMap bindings = matcher.bindingMap();

        switch (pattern.getType()) {
            case SIMPLE:
                return matcher.match(parse(pattern.getValue()), node);

            case EITHER:
            case ANY:
                for (Pattern sub : pattern.getSubPatterns()) {
                    if (matches(sub, node, ancestors)) {
                        return true;
                    }
                }
                return false;

            case INSIDE:
                return insideAncestor(pattern.getInner(), ancestors);

            case NOT_INSIDE: {
                Map<String, String> snapshot = bindings.snapshot();
                boolean inside = insideAncestor(pattern.getInner(), ancestors);
                bindings.restore(snapshot);
                return !inside;
            }

            case NOT: {
                Map<String, String> snapshot = bindings.snapshot();
                boolean matched = matches(pattern.getInner(), node, ancestors);
                bindings.restore(snapshot);
                return !matched;
            }

            case REGEX:
                return node.getText() != null && regexes.find(pattern.getValue(), node.getText());

            case NOT_REGEX:
                return node.getText() == null || !regexes.find(pattern.getValue(), node.getText());

            case ALL:
                for (Pattern sub : pattern.getSubPatterns()) {
                    if (!matches(sub, node, ancestors)) {
                        return false;
                    }
                }
                return true;

            default:
                return false;
        }
    }

    private boolean insideAncestor(Pattern inner, List<? extends TreeNode> ancestors)
        throws PatternSyntaxException {
        if (inner == null) {
            return false;
        }
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            if (matches(inner, ancestors.get(i), ancestors.subList(0, i))) {
                return true;
            }
        }
        return false;
    }

    private ParsedPattern parse(String pattern) throws PatternSyntaxException {
        ParsedPattern parsed = parsedPatterns.get(pattern);
        if (parsed == null) {
            parsed = matcher.parser().parse(pattern);
            parsedPatterns.put(pattern, parsed);
        }
        return parsed;
    }

    // ============================================
    // 2. WHOLE TREE
    // ============================================

    /**
     * Find the innermost nodes matching a pattern. A node is reported only when
     * none of its descendants matched.
     *
     * @param pattern rule pattern
     * @param root tree root
     * @return matches in post-order
     * @throws PatternSyntaxException if a simple pattern string is malformed
     */
    public List<MatchResult> findMatches(Pattern pattern, TreeNode root) throws PatternSyntaxException {
        List<MatchResult> results = new ArrayList<>();
        if (root != null) {
            collect(pattern, root, new ArrayList<TreeNode>(), results);
        }
        logger.debug("Pattern {} matched {} node(s)", pattern, results.size());
        return results;
    }

    private boolean collect(Pattern pattern, TreeNode node, List<TreeNode> ancestors, List<MatchResult> results)
        throws PatternSyntaxException {
        boolean descendantMatched = false;
        ancestors.add(node);
        for (TreeNode child : node.getChildren()) {
            if (collect(pattern, child, ancestors, results)) {
                descendantMatched = true;
            }
        }
        ancestors.remove(ancestors.size() - 1);

        if (descendantMatched) {
            return true;
        }

        BindingMap bindings = matcher.bindingMap();
        Map<String, String> snapshot = bindings.snapshot();
        bindings.clear();
        boolean matched = matches(pattern, node, ancestors);
        if (matched) {
            results.add(new MatchResult(node, bindings.snapshot(), ancestors));
        }
        bindings.restore(snapshot);
        return matched;
    }
}

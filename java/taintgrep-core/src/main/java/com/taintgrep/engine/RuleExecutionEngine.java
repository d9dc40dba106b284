package com.taintgrep.engine;

import com.taintgrep.engine.dataflow.ConstantAnalyzer;
import com.taintgrep.engine.dataflow.ConstantPropagator;
import com.taintgrep.engine.dataflow.DataFlowGraph;
import com.taintgrep.engine.dataflow.DataFlowGraphBuilder;
import com.taintgrep.engine.domain.Confidence;
import com.taintgrep.engine.domain.DataFlowSanitizer;
import com.taintgrep.engine.domain.DataFlowSink;
import com.taintgrep.engine.domain.DataFlowSource;
import com.taintgrep.engine.domain.DataFlowSpec;
import com.taintgrep.engine.domain.Finding;
import com.taintgrep.engine.domain.Location;
import com.taintgrep.engine.domain.Pattern;
import com.taintgrep.engine.domain.Rule;
import com.taintgrep.engine.pattern.CompoundMatcher;
import com.taintgrep.engine.pattern.FocusResolver;
import com.taintgrep.engine.pattern.MatchResult;
import com.taintgrep.engine.pattern.PatternMatcher;
import com.taintgrep.engine.pattern.PatternSyntaxException;
import com.taintgrep.engine.taint.SanitizerDetector;
import com.taintgrep.engine.taint.SinkDetector;
import com.taintgrep.engine.taint.SourceDetector;
import com.taintgrep.engine.taint.TaintFlow;
import com.taintgrep.engine.taint.TaintTracker;
import com.taintgrep.engine.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Runs rules against a syntax tree and turns matches into findings.
 *
 * Each rule is matched pattern by pattern; a rule with a data-flow requirement
 * is then verified against taint flows of the same tree, and each finding's
 * confidence moves one step up or down with the verdict for its match. Failures
 * are contained per rule. Not thread-safe: use one engine per thread.
 */
public class RuleExecutionEngine {
    private static final Logger logger = LoggerFactory.getLogger(RuleExecutionEngine.class);

    private static final java.util.regex.Pattern PLACEHOLDER = java.util.regex.Pattern.compile("\\$([A-Za-z0-9_]+)");

    private final EngineConfig config;
    private final CompoundMatcher compoundMatcher;
    private final FocusResolver focusResolver = new FocusResolver();
    private final DataFlowGraphBuilder graphBuilder = new DataFlowGraphBuilder();
    private final SourceDetector sourceDetector;
    private final SinkDetector sinkDetector;
    private final SanitizerDetector sanitizerDetector;
    private final TaintTracker taintTracker;

    private TreeNode graphRoot;
    private DataFlowGraph graph;
    private boolean batch;

    public RuleExecutionEngine() {
        this(EngineConfig.fromSystemProperties());
    }

    public RuleExecutionEngine(EngineConfig config) {
        this(config, new SourceDetector(), new SinkDetector(), new SanitizerDetector());
    }

    public RuleExecutionEngine(EngineConfig config, SourceDetector sourceDetector, SinkDetector sinkDetector,
                               SanitizerDetector sanitizerDetector) {
        this.config = config;
        this.compoundMatcher = new CompoundMatcher(new PatternMatcher(config.isCaseSensitive(), config.getMaxDepth()));
        this.sourceDetector = sourceDetector;
        this.sinkDetector = sinkDetector;
        this.sanitizerDetector = sanitizerDetector;
        this.taintTracker = new TaintTracker(sourceDetector, sinkDetector, sanitizerDetector,
            config.getSanitizerThreshold());
    }

    public EngineConfig getConfig() {
        return config;
    }

    // ============================================
    // 1. RULE SET EXECUTION
    // ============================================

    /**
     * Execute every enabled rule declaring {@code language}. One rule's failure
     * never stops the others.
     */
    public EngineResult executeRules(List<Rule> rules, TreeNode root, String language, String file) {
        ExecutionStatistics statistics = new ExecutionStatistics();
        List<RuleResult> results = new ArrayList<>();
        batch = true;
        try {
            for (Rule rule : rules) {
                if (!rule.appliesTo(language)) {
                    logger.trace("Skipping rule {} for language {}", rule.getId(), language);
                    continue;
                }
                RuleResult result = runRule(rule, root, file);
                statistics.record(result);
                results.add(result);
            }
        } finally {
            batch = false;
            releaseGraph();
        }
        logger.debug("Executed {} rule(s) on {}: {} finding(s)", statistics.getRulesExecuted(), file,
            statistics.getTotalFindings());
        return new EngineResult(results, statistics);
    }

    // ============================================
    // 2. SINGLE RULE
    // ============================================

    /**
     * Execute one rule regardless of its enabled flag and languages.
     *
     * @param language language tag of the tree
     * @param file path reported in finding locations
     */
    public RuleResult executeRule(Rule rule, TreeNode root, String language, String file) {
        logger.trace("Executing rule {} on {} ({})", rule.getId(), file, language);
        try {
            return runRule(rule, root, file);
        } finally {
            if (!batch) {
                releaseGraph();
            }
        }
    }

    private RuleResult runRule(Rule rule, TreeNode root, String file) {
        long start = System.nanoTime();
        RuleState state = RuleState.LOADED;
        try {
            // 1. Pattern matching
            state = RuleState.MATCHING;
            List<String> patternErrors = new ArrayList<>();
            List<PatternMatch> matches = new ArrayList<>();
            for (Pattern pattern : rule.getPatterns()) {
                try {
                    for (MatchResult match : compoundMatcher.findMatches(pattern, root)) {
                        matches.add(new PatternMatch(pattern, match));
                    }
                } catch (PatternSyntaxException e) {
                    logger.warn("Rule {}: skipping malformed pattern '{}': {}", rule.getId(), e.getPattern(),
                        e.getMessage());
                    patternErrors.add(e.getMessage());
                }
            }

            if (matches.isEmpty()) {
                state = RuleState.NO_MATCH;
                return new RuleResult(rule.getId(), state, null, null, patternErrors, elapsed(start), null);
            }
            state = RuleState.MATCHED;

            // 2. Taint verification
            DataFlowSpec spec = rule.getDataFlow();
            List<TaintFlow> flows = new ArrayList<>();
            if (spec != null) {
                state = RuleState.VERIFYING;
                flows = verify(spec, root);
            }

            // 3. Findings
            List<Finding> findings = new ArrayList<>();
            boolean anyConfirmed = false;
            for (PatternMatch match : matches) {
                String verdict = null;
                Confidence confidence = rule.getConfidence();
                if (spec != null) {
                    boolean confirmed = confirms(flows, match.result);
                    anyConfirmed |= confirmed;
                    verdict = confirmed ? "confirmed" : "not_confirmed";
                    if (confirmed) {
                        confidence = confidence.raise();
                    } else if (spec.isMustFlow()) {
                        confidence = confidence.lower();
                    }
                }
                findings.addAll(toFindings(rule, match, confidence, verdict, file));
            }
            if (spec != null) {
                state = anyConfirmed ? RuleState.CONFIRMED : RuleState.NOT_CONFIRMED;
            }

            logger.debug("Rule {} on {}: {} ({} finding(s))", rule.getId(), file, state, findings.size());
            return new RuleResult(rule.getId(), state, findings, flows, patternErrors, elapsed(start), null);
        } catch (RuntimeException e) {
            logger.error("Rule {} failed on {} while {}", rule.getId(), file, state, e);
            return RuleResult.failed(rule.getId(), elapsed(start), e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private List<Finding> toFindings(Rule rule, PatternMatch match, Confidence confidence, String verdict,
                                     String file) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("rule_name", rule.getName());
        metadata.put("pattern", match.pattern.describe());
        String category = rule.getMetadata().get("category");
        if (category != null) {
            metadata.put("category", category);
        }
        if (verdict != null) {
            metadata.put("dataflow", verdict);
        }

        String message = substitute(rule.getDescription(), match.result.getBindings());
        List<Finding> findings = new ArrayList<>();
        for (TreeNode node : focusResolver.resolve(match.result, match.pattern.getFocus())) {
            findings.add(new Finding(rule.getId(), message, rule.getSeverity(), confidence,
                Location.of(file, node.getSpan()), metadata, rule.getFix()));
        }
        return findings;
    }

    static String substitute(String template, Map<String, String> bindings) {
        if (template == null) {
            return "";
        }
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuffer out = new StringBuffer();
        while (matcher.find()) {
            String value = bindings.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    // ============================================
    // 3. TAINT VERIFICATION
    // ============================================

    private List<TaintFlow> verify(DataFlowSpec spec, TreeNode root) {
        DataFlowGraph unitGraph = graphFor(root);

        List<DataFlowSource> sources = new ArrayList<>();
        for (DataFlowSource source : sourceDetector.detect(unitGraph)) {
            if (accepts(spec.getSources(), source.getCategory(), null)) {
                sources.add(source);
            }
        }
        List<DataFlowSink> sinks = new ArrayList<>();
        for (DataFlowSink sink : sinkDetector.detect(unitGraph)) {
            if (accepts(spec.getSinks(), sink.getCategory(), sink.getVulnerabilityType())) {
                sinks.add(sink);
            }
        }
        List<DataFlowSanitizer> sanitizers = new ArrayList<>();
        for (DataFlowSanitizer sanitizer : sanitizerDetector.detect(unitGraph)) {
            if (accepts(spec.getSanitizers(), sanitizer.getCategory(), null)) {
                sanitizers.add(sanitizer);
            }
        }

        List<TaintFlow> flows = new ArrayList<>();
        for (TaintFlow flow : taintTracker.track(unitGraph, sources, sinks, sanitizers)) {
            if (spec.getMaxDepth() == null || flow.getPath().size() - 1 <= spec.getMaxDepth()) {
                flows.add(flow);
            }
        }
        return flows;
    }

    /**
     * An empty category list accepts everything.
     */
    private static boolean accepts(List<String> wanted, String category, String vulnerabilityType) {
        if (wanted.isEmpty()) {
            return true;
        }
        for (String name : wanted) {
            if (name.equalsIgnoreCase(category)
                || (vulnerabilityType != null && name.toUpperCase(Locale.ROOT).equals(vulnerabilityType))) {
                return true;
            }
        }
        return false;
    }

    /**
     * A match is confirmed by a vulnerable flow whose sink is the matched node,
     * one of its ancestors or one of its descendants.
     */
    private boolean confirms(List<TaintFlow> flows, MatchResult match) {
        for (TaintFlow flow : flows) {
            if (!flow.isVulnerable()) {
                continue;
            }
            TreeNode sinkNode = graph.getNode(flow.getSink().getNodeId()).getTreeNode();
            if (contains(match.getNode(), sinkNode) || containsSame(match.getAncestors(), sinkNode)) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(TreeNode subtree, TreeNode target) {
        if (subtree == target) {
            return true;
        }
        for (TreeNode child : subtree.getChildren()) {
            if (contains(child, target)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsSame(List<TreeNode> nodes, TreeNode target) {
        for (TreeNode node : nodes) {
            if (node == target) {
                return true;
            }
        }
        return false;
    }

    private DataFlowGraph graphFor(TreeNode root) {
        if (graph == null || graphRoot != root) {
            graph = graphBuilder.build(root);
            graphRoot = root;
        }
        return graph;
    }

    private void releaseGraph() {
        graph = null;
        graphRoot = null;
    }

    // ============================================
    // 4. CONSTANTS
    // ============================================

    /**
     * Propagate constants over the tree's data-flow graph and collect them,
     * flagging the ones that look like secrets.
     */
    public ConstantAnalyzer analyzeConstants(TreeNode root) {
        ConstantPropagator propagator = new ConstantPropagator(config.getMaxIterations());
        propagator.analyze(graphBuilder.build(root));

        ConstantAnalyzer analyzer = new ConstantAnalyzer();
        for (String keyword : config.getSensitiveKeywords()) {
            analyzer.addSensitivePattern(keyword);
        }
        analyzer.absorb(propagator);
        logger.debug("Constant analysis: {} constant(s), {} sensitive, {} iteration(s)",
            analyzer.getConstants().size(), analyzer.getSensitiveConstants().size(), propagator.getIterations());
        return analyzer;
    }

    private static long elapsed(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    private static final class PatternMatch {
        final Pattern pattern;
        final MatchResult result;

        PatternMatch(Pattern pattern, MatchResult result) {
            this.pattern = pattern;
            this.result = result;
        }
    }
}

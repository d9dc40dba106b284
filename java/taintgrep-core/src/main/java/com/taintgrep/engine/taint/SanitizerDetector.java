package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.DataFlowGraph;
import com.taintgrep.engine.dataflow.DataFlowNode;
import com.taintgrep.engine.domain.DataFlowSanitizer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of sanitizing-call patterns with their effectiveness.
 */
public class SanitizerDetector {
    private static final List<String> INPUT_VALIDATION_TYPES = Arrays.asList(
        "SQL_INJECTION", "XSS", "COMMAND_INJECTION", "PATH_TRAVERSAL");

    private final Map<String, SanitizerPattern> sanitizers = new LinkedHashMap<>();

    public SanitizerDetector() {
        initializeDefaults();
    }

    public static SanitizerDetector empty() {
        SanitizerDetector detector = new SanitizerDetector();
        detector.sanitizers.clear();
        return detector;
    }

    private void initializeDefaults() {
        register("call_expression", "prepareStatement", "sql_parameter_binding", "SQL prepared statement",
            0.95, Collections.singletonList("SQL_INJECTION"));
        register("call_expression", "htmlEncode", "html_encoding", "HTML encoding", 0.9,
            Collections.singletonList("XSS"));
        register("call_expression", "escapeHtml", "html_encoding", "HTML escaping", 0.9,
            Collections.singletonList("XSS"));
        register("call_expression", "encodeURIComponent", "url_encoding", "URL component encoding", 0.8,
            Collections.singletonList("XSS"));
        register("call_expression", "validate", "input_validation", "Input validation", 0.8,
            INPUT_VALIDATION_TYPES);
        register("call_expression", "sanitize", "input_validation", "Input sanitization", 0.7,
            INPUT_VALIDATION_TYPES);
        register("call_expression", "path.normalize", "path_normalization", "Path normalization", 0.8,
            Collections.singletonList("PATH_TRAVERSAL"));
        register("call_expression", "match", "regex_validation", "Regex validation", 0.6,
            Collections.<String>emptyList());
        register("call_expression", "length", "length_validation", "Length check", 0.5,
            Collections.<String>emptyList());
    }

    public void register(String nodeKind, String namePattern, String category, String description,
                         double effectiveness, List<String> protectedTypes) {
        sanitizers.put(key(nodeKind, namePattern),
            new SanitizerPattern(nodeKind, namePattern, category, description, effectiveness, protectedTypes));
    }

    public boolean isSanitizer(String nodeKind, String name) {
        return find(nodeKind, name) != null;
    }

    /**
     * @return first registered pattern matching the name for this node kind, or null
     */
    public SanitizerPattern find(String nodeKind, String name) {
        for (SanitizerPattern pattern : sanitizers.values()) {
            if (pattern.nodeKind.equals(nodeKind) && CallNames.matches(name, pattern.namePattern)) {
                return pattern;
            }
        }
        return null;
    }

    public List<DataFlowSanitizer> detect(DataFlowGraph graph) {
        List<DataFlowSanitizer> detected = new ArrayList<>();
        for (DataFlowNode node : graph.getNodes()) {
            SanitizerPattern pattern = find(node.getKind(), CallNames.nameOf(node));
            if (pattern != null) {
                detected.add(new DataFlowSanitizer(node.getId(), pattern.category, pattern.description,
                    pattern.effectiveness, pattern.protectedTypes));
            }
        }
        return detected;
    }

    private String key(String nodeKind, String namePattern) {
        return nodeKind + "#" + namePattern;
    }

    public static final class SanitizerPattern {
        private final String nodeKind;
        private final String namePattern;
        private final String category;
        private final String description;
        private final double effectiveness;
        private final List<String> protectedTypes;

        SanitizerPattern(String nodeKind, String namePattern, String category, String description,
                         double effectiveness, List<String> protectedTypes) {
            this.nodeKind = nodeKind;
            this.namePattern = namePattern;
            this.category = category;
            this.description = description;
            this.effectiveness = effectiveness;
            this.protectedTypes = protectedTypes;
        }

        public String getNamePattern() {
            return namePattern;
        }

        public String getCategory() {
            return category;
        }

        public double getEffectiveness() {
            return effectiveness;
        }
    }
}

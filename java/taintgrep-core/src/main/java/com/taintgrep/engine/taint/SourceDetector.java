package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.DataFlowGraph;
import com.taintgrep.engine.dataflow.DataFlowNode;
import com.taintgrep.engine.domain.DataFlowSource;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of untrusted-input patterns, keyed by node kind and name.
 */
public class SourceDetector {
    private final Map<String, SourcePattern> sources = new LinkedHashMap<>();

    public SourceDetector() {
        initializeDefaults();
    }

    public static SourceDetector empty() {
        SourceDetector detector = new SourceDetector();
        detector.sources.clear();
        return detector;
    }

    private void initializeDefaults() {
        register("call_expression", "request.getParameter", "user_input", "HTTP request parameter", 0.9);
        register("call_expression", "request.getHeader", "header_input", "HTTP request header", 0.9);
        register("call_expression", "request.getCookies", "cookie_input", "HTTP cookies", 0.9);
        register("call_expression", "getQueryString", "url_parameter_input", "URL query string", 0.9);
        register("call_expression", "getParameter", "user_input", "Request parameter", 0.8);
        register("call_expression", "getHeader", "header_input", "Request header", 0.8);
        register("call_expression", "readFile", "file_input", "File read", 0.8);
        register("call_expression", "fs.readFileSync", "file_input", "Synchronous file read", 0.9);
        register("call_expression", "getenv", "environment_input", "Environment variable", 0.6);
        register("identifier", "process.env", "environment_input", "Process environment", 0.7);
        register("identifier", "sys.argv", "command_line_input", "Command line arguments", 0.8);
        register("identifier", "process.argv", "command_line_input", "Command line arguments", 0.8);
    }

    public void register(String nodeKind, String namePattern, String category, String description,
                         double confidence) {
        sources.put(key(nodeKind, namePattern),
            new SourcePattern(nodeKind, namePattern, category, description, confidence));
    }

    public boolean isSource(String nodeKind, String name) {
        return find(nodeKind, name) != null;
    }

    /**
     * @return first registered pattern matching the name for this node kind, or null
     */
    public SourcePattern find(String nodeKind, String name) {
        for (SourcePattern pattern : sources.values()) {
            if (pattern.nodeKind.equals(nodeKind) && CallNames.matches(name, pattern.namePattern)) {
                return pattern;
            }
        }
        return null;
    }

    public List<DataFlowSource> detect(DataFlowGraph graph) {
        List<DataFlowSource> detected = new ArrayList<>();
        for (DataFlowNode node : graph.getNodes()) {
            SourcePattern pattern = find(node.getKind(), CallNames.nameOf(node));
            if (pattern != null) {
                detected.add(new DataFlowSource(node.getId(), pattern.category, pattern.description,
                    pattern.confidence));
            }
        }
        return detected;
    }

    private String key(String nodeKind, String namePattern) {
        return nodeKind + "#" + namePattern;
    }

    public static final class SourcePattern {
        private final String nodeKind;
        private final String namePattern;
        private final String category;
        private final String description;
        private final double confidence;

        SourcePattern(String nodeKind, String namePattern, String category, String description, double confidence) {
            this.nodeKind = nodeKind;
            this.namePattern = namePattern;
            this.category = category;
            this.description = description;
            this.confidence = confidence;
        }

        public String getNamePattern() {
            return namePattern;
        }

        public String getCategory() {
            return category;
        }

        public double getConfidence() {
            return confidence;
        }
    }
}

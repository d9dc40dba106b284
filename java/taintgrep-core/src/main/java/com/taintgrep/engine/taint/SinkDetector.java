package com.taintgrep.engine.taint;

import com.taintgrep.engine.dataflow.DataFlowGraph;
import com.taintgrep.engine.dataflow.DataFlowNode;
import com.taintgrep.engine.domain.DataFlowSink;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of dangerous-operation patterns, keyed by node kind and name.
 */
public class SinkDetector {
    private final Map<String, SinkPattern> sinks = new LinkedHashMap<>();

    public SinkDetector() {
        initializeDefaults();
    }

    public static SinkDetector empty() {
        SinkDetector detector = new SinkDetector();
        detector.sinks.clear();
        return detector;
    }

    private void initializeDefaults() {
        register("call_expression", "executeQuery", "sql_execution", "SQL_INJECTION", "SQL query execution", 0.9);
        register("call_expression", "executeUpdate", "sql_execution", "SQL_INJECTION", "SQL update execution", 0.9);
        register("call_expression", "query", "sql_execution", "SQL_INJECTION", "Database query", 0.8);
        register("call_expression", "exec", "command_execution", "COMMAND_INJECTION", "Command execution", 0.9);
        register("call_expression", "system", "command_execution", "COMMAND_INJECTION", "System command", 0.9);
        register("call_expression", "writeFile", "file_operation", "PATH_TRAVERSAL", "File write", 0.8);
        register("call_expression", "open", "file_operation", "PATH_TRAVERSAL", "File open", 0.7);
        register("member_expression", "innerHTML", "html_output", "XSS", "DOM HTML assignment", 0.9);
        register("call_expression", "document.write", "html_output", "XSS", "Document write", 0.9);
        register("call_expression", "eval", "javascript_evaluation", "CODE_INJECTION", "Dynamic code evaluation", 0.95);
        register("call_expression", "readObject", "deserialization", "INSECURE_DESERIALIZATION",
            "Object deserialization", 0.8);
        register("call_expression", "log", "log_output", "LOG_INJECTION", "Log output", 0.6);
        register("call_expression", "console.log", "log_output", "LOG_INJECTION", "Console output", 0.5);
    }

    public void register(String nodeKind, String namePattern, String category, String vulnerabilityType,
                         String description, double confidence) {
        sinks.put(key(nodeKind, namePattern),
            new SinkPattern(nodeKind, namePattern, category, vulnerabilityType, description, confidence));
    }

    public boolean isSink(String nodeKind, String name) {
        return find(nodeKind, name) != null;
    }

    /**
     * @return first registered pattern matching the name for this node kind, or null
     */
    public SinkPattern find(String nodeKind, String name) {
        for (SinkPattern pattern : sinks.values()) {
            if (pattern.nodeKind.equals(nodeKind) && CallNames.matches(name, pattern.namePattern)) {
                return pattern;
            }
        }
        return null;
    }

    public List<DataFlowSink> detect(DataFlowGraph graph) {
        List<DataFlowSink> detected = new ArrayList<>();
        for (DataFlowNode node : graph.getNodes()) {
            SinkPattern pattern = find(node.getKind(), CallNames.nameOf(node));
            if (pattern != null) {
                detected.add(new DataFlowSink(node.getId(), pattern.category, pattern.vulnerabilityType,
                    pattern.description, pattern.confidence));
            }
        }
        return detected;
    }

    private String key(String nodeKind, String namePattern) {
        return nodeKind + "#" + namePattern;
    }

    public static final class SinkPattern {
        private final String nodeKind;
        private final String namePattern;
        private final String category;
        private final String vulnerabilityType;
        private final String description;
        private final double confidence;

        SinkPattern(String nodeKind, String namePattern, String category, String vulnerabilityType,
                    String description, double confidence) {
            this.nodeKind = nodeKind;
            this.namePattern = namePattern;
            this.category = category;
            this.vulnerabilityType = vulnerabilityType;
            this.description = description;
            this.confidence = confidence;
        }

        public String getNamePattern() {
            return namePattern;
        }

        public String getCategory() {
            return category;
        }

        public String getVulnerabilityType() {
            return vulnerabilityType;
        }
    }
}

package com.taintgrep.engine;

import com.taintgrep.engine.dataflow.ConstantPropagator;
import com.taintgrep.engine.taint.TaintTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Engine settings. Defaults are read from {@code taintgrep.*} system properties;
 * setters override them.
 */
public class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String MAX_DEPTH = "taintgrep.maxDepth";
    public static final String CASE_SENSITIVE = "taintgrep.caseSensitive";
    public static final String SANITIZER_THRESHOLD = "taintgrep.sanitizerThreshold";
    public static final String MAX_ITERATIONS = "taintgrep.maxIterations";
    public static final String SENSITIVE_KEYWORDS = "taintgrep.sensitiveKeywords";

    private Integer maxDepth;
    private boolean caseSensitive = true;
    private double sanitizerThreshold = TaintTracker.DEFAULT_SANITIZER_THRESHOLD;
    private int maxIterations = ConstantPropagator.DEFAULT_MAX_ITERATIONS;
    private final List<String> sensitiveKeywords = new ArrayList<>();

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Read settings from a property set; malformed values are logged and ignored.
     */
    public static EngineConfig fromProperties(Properties properties) {
        EngineConfig config = new EngineConfig();

        String depth = properties.getProperty(MAX_DEPTH, "").trim();
        if (!depth.isEmpty()) {
            try {
                config.setMaxDepth(Integer.valueOf(depth));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}: not an integer", MAX_DEPTH, depth);
            }
        }

        config.setCaseSensitive(Boolean.parseBoolean(properties.getProperty(CASE_SENSITIVE, "true").trim()));

        String threshold = properties.getProperty(SANITIZER_THRESHOLD, "").trim();
        if (!threshold.isEmpty()) {
            try {
                config.setSanitizerThreshold(Double.parseDouble(threshold));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}: not a number", SANITIZER_THRESHOLD, threshold);
            }
        }

        String iterations = properties.getProperty(MAX_ITERATIONS, "").trim();
        if (!iterations.isEmpty()) {
            try {
                config.setMaxIterations(Integer.parseInt(iterations));
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}={}: not an integer", MAX_ITERATIONS, iterations);
            }
        }

        String keywords = properties.getProperty(SENSITIVE_KEYWORDS, "");
        for (String keyword : keywords.split(",")) {
            config.addSensitiveKeyword(keyword);
        }
        return config;
    }

    /**
     * @return maximum matcher recursion depth, or null for no limit
     */
    public Integer getMaxDepth() {
        return maxDepth;
    }

    public EngineConfig setMaxDepth(Integer maxDepth) {
        if (maxDepth != null && maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        return this;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public EngineConfig setCaseSensitive(boolean caseSensitive) {
        this.caseSensitive = caseSensitive;
        return this;
    }

    public double getSanitizerThreshold() {
        return sanitizerThreshold;
    }

    public EngineConfig setSanitizerThreshold(double sanitizerThreshold) {
        if (sanitizerThreshold < 0.0 || sanitizerThreshold > 1.0) {
            throw new IllegalArgumentException("sanitizerThreshold must be in [0, 1]: " + sanitizerThreshold);
        }
        this.sanitizerThreshold = sanitizerThreshold;
        return this;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    public EngineConfig setMaxIterations(int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1: " + maxIterations);
        }
        this.maxIterations = maxIterations;
        return this;
    }

    /**
     * @return keywords added to the built-in sensitive-constant list
     */
    public List<String> getSensitiveKeywords() {
        return Collections.unmodifiableList(sensitiveKeywords);
    }

    public EngineConfig addSensitiveKeyword(String keyword) {
        if (keyword != null && !keyword.trim().isEmpty()) {
            sensitiveKeywords.add(keyword.trim());
        }
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{maxDepth=" + maxDepth + ", caseSensitive=" + caseSensitive
            + ", sanitizerThreshold=" + sanitizerThreshold + ", maxIterations=" + maxIterations
            + ", sensitiveKeywords=" + sensitiveKeywords + "}";
    }
}

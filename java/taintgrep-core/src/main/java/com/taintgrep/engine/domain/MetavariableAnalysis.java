package com.taintgrep.engine.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Heuristic checks run against a bound metavariable. Each part is optional;
 * an analysis with no parts always passes.
 */
public class MetavariableAnalysis {
    private Entropy entropy;
    private TypeCheck typeCheck;
    private Complexity complexity;

    public MetavariableAnalysis withEntropy(double minEntropy, Double maxEntropy, String charset) {
        this.entropy = new Entropy(minEntropy, maxEntropy, charset);
        return this;
    }

    public MetavariableAnalysis withTypes(List<String> expectedTypes, List<String> forbiddenTypes) {
        this.typeCheck = new TypeCheck(expectedTypes, forbiddenTypes);
        return this;
    }

    public MetavariableAnalysis withMaxLines(int maxLines) {
        this.complexity = new Complexity(maxLines);
        return this;
    }

    public Entropy getEntropy() {
        return entropy;
    }

    public TypeCheck getTypeCheck() {
        return typeCheck;
    }

    public Complexity getComplexity() {
        return complexity;
    }

    public static final class Entropy {
        private final double minEntropy;
        private final Double maxEntropy;
        private final String charset;

        Entropy(double minEntropy, Double maxEntropy, String charset) {
            this.minEntropy = minEntropy;
            this.maxEntropy = maxEntropy;
            this.charset = charset;
        }

        public double getMinEntropy() {
            return minEntropy;
        }

        public Double getMaxEntropy() {
            return maxEntropy;
        }

        public String getCharset() {
            return charset;
        }
    }

    public static final class TypeCheck {
        private final List<String> expectedTypes;
        private final List<String> forbiddenTypes;

        TypeCheck(List<String> expectedTypes, List<String> forbiddenTypes) {
            this.expectedTypes = expectedTypes != null ? new ArrayList<>(expectedTypes) : new ArrayList<>();
            this.forbiddenTypes = forbiddenTypes != null ? new ArrayList<>(forbiddenTypes) : new ArrayList<>();
        }

        public List<String> getExpectedTypes() {
            return Collections.unmodifiableList(expectedTypes);
        }

        public List<String> getForbiddenTypes() {
            return Collections.unmodifiableList(forbiddenTypes);
        }
    }

    public static final class Complexity {
        private final int maxLines;

        Complexity(int maxLines) {
            this.maxLines = maxLines;
        }

        public int getMaxLines() {
            return maxLines;
        }
    }
}

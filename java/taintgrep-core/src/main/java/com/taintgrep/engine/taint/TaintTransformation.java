package com.taintgrep.engine.taint;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * An operation applied to a tainted value on its way through the graph.
 * Each kind has a fixed sanitizing effectiveness in [0, 1].
 */
public final class TaintTransformation {

    public enum Kind {
        IDENTITY(0.0),
        CONCATENATION(0.0),
        METHOD_CALL(0.0),
        ENCODING(0.7),
        DECODING(0.0),
        ENCRYPTION(0.95),
        HASHING(1.0),
        FILTERING(0.8),
        VALIDATION(0.5);

        private final double effectiveness;

        Kind(double effectiveness) {
            this.effectiveness = effectiveness;
        }

        public double getEffectiveness() {
            return effectiveness;
        }
    }

    public static final TaintTransformation IDENTITY = new TaintTransformation(Kind.IDENTITY, null);
    public static final TaintTransformation CONCATENATION = new TaintTransformation(Kind.CONCATENATION, null);

    private final Kind kind;
    private final String detail;

    private TaintTransformation(Kind kind, String detail) {
        this.kind = kind;
        this.detail = detail;
    }

    public static TaintTransformation methodCall(String name) {
        return new TaintTransformation(Kind.METHOD_CALL, name);
    }

    public static TaintTransformation encoding(String scheme) {
        return new TaintTransformation(Kind.ENCODING, scheme);
    }

    public static TaintTransformation decoding(String scheme) {
        return new TaintTransformation(Kind.DECODING, scheme);
    }

    public static TaintTransformation encryption(String algorithm) {
        return new TaintTransformation(Kind.ENCRYPTION, algorithm);
    }

    public static TaintTransformation hashing(String algorithm) {
        return new TaintTransformation(Kind.HASHING, algorithm);
    }

    public static TaintTransformation filtering(String name) {
        return new TaintTransformation(Kind.FILTERING, name);
    }

    public static TaintTransformation validation(String name) {
        return new TaintTransformation(Kind.VALIDATION, name);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return method name, scheme or algorithm; null for identity and concatenation
     */
    public String getDetail() {
        return detail;
    }

    public double getEffectiveness() {
        return kind.getEffectiveness();
    }

    public boolean sanitizes() {
        return kind.getEffectiveness() > 0.0;
    }

    /**
     * Confidence after this transformation: {@code confidence * (1 - effectiveness)},
     * computed in decimal so that 1.0 through an encoding is exactly 0.3.
     */
    public double apply(double confidence) {
        return BigDecimal.valueOf(confidence)
            .multiply(BigDecimal.ONE.subtract(BigDecimal.valueOf(kind.getEffectiveness())))
            .doubleValue();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TaintTransformation)) {
            return false;
        }
        TaintTransformation that = (TaintTransformation) o;
        return kind == that.kind && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, detail);
    }

    @Override
    public String toString() {
        return detail != null ? kind + "(" + detail + ")" : kind.toString();
    }
}

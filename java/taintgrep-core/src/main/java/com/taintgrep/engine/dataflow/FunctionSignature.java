package com.taintgrep.engine.dataflow;

import java.util.Objects;

// ============================================
// FunctionSignature: name, arity and language; the call-resolution key
// ============================================
public final class FunctionSignature {
    private final String name;
    private final int parameterCount;
    private final String language;

    public FunctionSignature(String name, int parameterCount, String language) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Function name is required");
        }
        this.name = name;
        this.parameterCount = parameterCount;
        this.language = language;
    }

    public String getName() {
        return name;
    }

    public int getParameterCount() {
        return parameterCount;
    }

    public String getLanguage() {
        return language;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FunctionSignature)) {
            return false;
        }
        FunctionSignature that = (FunctionSignature) o;
        return parameterCount == that.parameterCount
            && name.equals(that.name)
            && Objects.equals(language, that.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, parameterCount, language);
    }

    @Override
    public String toString() {
        return name + "/" + parameterCount + (language != null ? " [" + language + "]" : "");
    }
}

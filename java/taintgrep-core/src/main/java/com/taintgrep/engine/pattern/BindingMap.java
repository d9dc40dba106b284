package com.taintgrep.engine.pattern;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metavariable name to matched text.
 *
 * A name bound once within an attempt must match identically on reuse. Callers
 * take a {@link #snapshot()} before a tentative match and {@link #restore(Map)}
 * it when the attempt fails.
 */
public class BindingMap {
    private final Map<String, String> bindings = new LinkedHashMap<>();

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    public String get(String name) {
        return bindings.get(name);
    }

    public void bind(String name, String text) {
        bindings.put(name, text);
    }

    public Map<String, String> snapshot() {
        return new LinkedHashMap<>(bindings);
    }

    public void restore(Map<String, String> snapshot) {
        bindings.clear();
        if (snapshot != null) {
            bindings.putAll(snapshot);
        }
    }

    public void clear() {
        bindings.clear();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    public int size() {
        return bindings.size();
    }

    /**
     * @return read-only view of the current bindings
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(bindings);
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}

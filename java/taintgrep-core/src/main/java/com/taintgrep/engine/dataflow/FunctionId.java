package com.taintgrep.engine.dataflow;

/**
 * Call-graph function id, assigned in registration order.
 */
public final class FunctionId implements Comparable<FunctionId> {
    private final int value;

    public FunctionId(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    @Override
    public int compareTo(FunctionId other) {
        return Integer.compare(value, other.value);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof FunctionId && ((FunctionId) o).value == value);
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        return "fn#" + value;
    }
}

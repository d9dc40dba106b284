package com.taintgrep.engine.tree;

import java.util.Objects;

// ============================================
// SourceSpan: 1-based start/end line and column
// ============================================
public final class SourceSpan {
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public SourceSpan(int startLine, int startColumn, int endLine, int endColumn) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public static SourceSpan ofLine(int line) {
        return new SourceSpan(line, 1, line, 1);
    }

    public int getStartLine() {
        return startLine;
    }

    public int getStartColumn() {
        return startColumn;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceSpan)) {
            return false;
        }
        SourceSpan that = (SourceSpan) o;
        return startLine == that.startLine
            && startColumn == that.startColumn
            && endLine == that.endLine
            && endColumn == that.endColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}

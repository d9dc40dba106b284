package com.taintgrep.engine.domain;

import com.taintgrep.engine.tree.SourceSpan;

import java.util.Objects;

// ============================================
// Location: file plus 1-based line/column range
// ============================================
public class Location {
    private final String file;
    private final int startLine;
    private final int startColumn;
    private final int endLine;
    private final int endColumn;

    public Location(String file, int startLine, int startColumn, int endLine, int endColumn) {
        this.file = file;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public static Location of(String file, SourceSpan span) {
        if (span == null) {
            return new Location(file, 1, 1, 1, 1);
        }
        return new Location(file, span.getStartLine(), span.getStartColumn(),
            span.getEndLine(), span.getEndColumn());
    }

    public String getFile() {
        return file;
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
        if (!(o instanceof Location)) {
            return false;
        }
        Location that = (Location) o;
        return startLine == that.startLine
            && startColumn == that.startColumn
            && endLine == that.endLine
            && endColumn == that.endColumn
            && Objects.equals(file, that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, startLine, startColumn, endLine, endColumn);
    }

    @Override
    public String toString() {
        return file + ":" + startLine + ":" + startColumn;
    }
}

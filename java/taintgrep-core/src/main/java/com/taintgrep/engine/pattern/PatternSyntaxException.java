package com.taintgrep.engine.pattern;

/**
 * Raised when a pattern string cannot be parsed. Only the offending pattern is
 * rejected; callers decide whether the surrounding rule survives.
 */
public class PatternSyntaxException extends Exception {
    private final String pattern;
    private final int position;

    public PatternSyntaxException(String message, String pattern, int position) {
        super(position >= 0 ? message + " at position " + position : message);
        this.pattern = pattern;
        this.position = position;
    }

    public String getPattern() {
        return pattern;
    }

    /**
     * @return 1-based character position, or -1 when the error is not positional
     */
    public int getPosition() {
        return position;
    }
}

package com.taintgrep.engine.pattern;

/**
 * Raised when matching itself is broken (invalid regex, unknown comparison
 * operator), as opposed to a node that simply does not match.
 */
public class MatchException extends RuntimeException {

    public MatchException(String message) {
        super(message);
    }

    public MatchException(String message, Throwable cause) {
        super(message, cause);
    }
}

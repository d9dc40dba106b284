package com.taintgrep.engine.domain;

/**
 * How a {@link Pattern} combines its pattern string or sub-patterns.
 */
public enum PatternType {
    SIMPLE,
    EITHER,
    INSIDE,
    NOT_INSIDE,
    NOT,
    REGEX,
    NOT_REGEX,
    ALL,
    ANY
}

package com.taintgrep.engine;

/**
 * Per-rule execution state.
 *
 * LOADED moves to MATCHING, then to NO_MATCH or MATCHED. A rule with a data-flow
 * requirement moves from MATCHED to VERIFYING, then to CONFIRMED or NOT_CONFIRMED.
 */
public enum RuleState {
    LOADED,
    MATCHING,
    NO_MATCH,
    MATCHED,
    VERIFYING,
    CONFIRMED,
    NOT_CONFIRMED,
    FAILED;

    public boolean isTerminal() {
        return this == NO_MATCH || this == MATCHED || this == CONFIRMED || this == NOT_CONFIRMED || this == FAILED;
    }
}

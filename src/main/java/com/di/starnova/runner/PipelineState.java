package com.di.starnova.runner;

import java.util.List;

/**
 * Run lifecycle. States are reached strictly in declaration order; {@link #FAILED} is
 * reachable from any non-terminal state.
 */
public enum PipelineState {
    INIT,
    EXTRACTED,
    DIMENSIONS_BUILT,
    FACT_BUILT,
    VALIDATED,
    PROFILED,
    PERSISTED,
    FAILED;

    /** Happy-path order. */
    public static final List<PipelineState> SEQUENCE = List.of(
            INIT, EXTRACTED, DIMENSIONS_BUILT, FACT_BUILT, VALIDATED, PROFILED, PERSISTED);

    public boolean isTerminal() {
        return this == PERSISTED || this == FAILED;
    }

    public boolean canTransitionTo(PipelineState next) {
        if (isTerminal() || next == null) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}

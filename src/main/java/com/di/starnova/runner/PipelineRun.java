package com.di.starnova.runner;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * State of one run. Not thread-safe; a run is driven by a single thread.
 */
@Slf4j
@Getter
public class PipelineRun {

    private final String runId;
    private PipelineState state = PipelineState.INIT;
    private PipelineState failedStage;
    private final List<PipelineState> history = new ArrayList<>(List.of(PipelineState.INIT));

    public PipelineRun(String runId) {
        this.runId = runId;
    }

    public void advance(PipelineState next) {
        if (!state.canTransitionTo(next) || next == PipelineState.FAILED) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next);
        }
        log.info("[RUNNER] {} -> {}", state, next);
        state = next;
        history.add(next);
    }

    /** Marks the run failed while attempting {@code stage}. */
    public void fail(PipelineState stage) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Run already finished in state " + state);
        }
        failedStage = stage;
        state = PipelineState.FAILED;
        history.add(PipelineState.FAILED);
    }

    public List<PipelineState> getHistory() {
        return Collections.unmodifiableList(history);
    }
}

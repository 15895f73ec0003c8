package com.di.starnova.runner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PipelineRun Tests")
class PipelineRunTest {

    // ============================================================================
    // PipelineState
    // ============================================================================

    @Test
    @DisplayName("Should only allow the next state or FAILED")
    void testState_Transitions() {
        assertTrue(PipelineState.INIT.canTransitionTo(PipelineState.EXTRACTED));
        assertFalse(PipelineState.INIT.canTransitionTo(PipelineState.DIMENSIONS_BUILT));
        assertFalse(PipelineState.FACT_BUILT.canTransitionTo(PipelineState.EXTRACTED));
        assertTrue(PipelineState.PROFILED.canTransitionTo(PipelineState.PERSISTED));
        for (PipelineState state : PipelineState.SEQUENCE) {
            assertEquals(!state.isTerminal(), state.canTransitionTo(PipelineState.FAILED), state.name());
        }
    }

    @Test
    @DisplayName("Should treat PERSISTED and FAILED as terminal")
    void testState_Terminal() {
        assertTrue(PipelineState.PERSISTED.isTerminal());
        assertTrue(PipelineState.FAILED.isTerminal());
        assertFalse(PipelineState.FAILED.canTransitionTo(PipelineState.INIT));
        assertFalse(PipelineState.VALIDATED.isTerminal());
    }

    // ============================================================================
    // PipelineRun
    // ============================================================================

    @Test
    @DisplayName("Should record the full happy-path history")
    void testRun_HappyPath() {
        PipelineRun run = new PipelineRun("run-1");
        for (PipelineState next : PipelineState.SEQUENCE.subList(1, PipelineState.SEQUENCE.size())) {
            run.advance(next);
        }

        assertEquals(PipelineState.PERSISTED, run.getState());
        assertEquals(PipelineState.SEQUENCE, run.getHistory());
        assertNull(run.getFailedStage());
    }

    @Test
    @DisplayName("Should reject skipped stages")
    void testRun_SkipRejected() {
        PipelineRun run = new PipelineRun("run-1");
        assertThrows(IllegalStateException.class, () -> run.advance(PipelineState.FACT_BUILT));
        assertThrows(IllegalStateException.class, () -> run.advance(PipelineState.FAILED));
        assertEquals(PipelineState.INIT, run.getState());
    }

    @Test
    @DisplayName("Should record the stage being attempted when failing")
    void testRun_Fail() {
        PipelineRun run = new PipelineRun("run-1");
        run.advance(PipelineState.EXTRACTED);
        run.fail(PipelineState.DIMENSIONS_BUILT);

        assertEquals(PipelineState.FAILED, run.getState());
        assertEquals(PipelineState.DIMENSIONS_BUILT, run.getFailedStage());
        assertEquals(List.of(PipelineState.INIT, PipelineState.EXTRACTED, PipelineState.FAILED), run.getHistory());
        assertThrows(IllegalStateException.class, () -> run.fail(PipelineState.FACT_BUILT));
        assertThrows(UnsupportedOperationException.class, () -> run.getHistory().add(PipelineState.INIT));
    }
}

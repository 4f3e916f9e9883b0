package com.questrail.helix.observability;

import com.questrail.helix.internal.state.PipelineOperation;
import com.questrail.helix.internal.state.PipelineState;

import java.time.Instant;

/**
 * Record representing a pipeline state transition within one codec call.
 */
public record PipelineTransitionEvent(
    Instant timestamp,
    PipelineOperation operation,
    PipelineState from,
    PipelineState to
) {
    /**
     * Checks if this transition ends the call.
     */
    public boolean isTerminal() {
        return to.isTerminal();
    }
}

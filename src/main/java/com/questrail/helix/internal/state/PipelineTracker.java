package com.questrail.helix.internal.state;

import com.questrail.helix.observability.CodecObservabilitySink;
import com.questrail.helix.observability.PipelineTransitionEvent;

import java.time.Clock;
import java.util.Objects;

/**
 * PipelineTracker
 * -----------------------------------------------------------------------------
 * Tracks the state of one codec call and publishes every transition.
 *
 * <p>One instance per call, confined to the calling thread. Transitions out of
 * a terminal state are rejected; they indicate an orchestration bug.</p>
 */
public final class PipelineTracker
{
    private final PipelineOperation operation;
    private final CodecObservabilitySink sink;
    private final Clock clock;
    private PipelineState state = PipelineState.IDLE;

    public PipelineTracker(PipelineOperation operation, CodecObservabilitySink sink, Clock clock) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void moveTo(PipelineState next) {
        Objects.requireNonNull(next, "next");
        if (state.isTerminal()) {
            throw new IllegalStateException(operation + " already " + state + "; cannot move to " + next);
        }
        final PipelineState previous = state;
        state = next;
        sink.onStateTransition(new PipelineTransitionEvent(clock.instant(), operation, previous, next));
    }

    /**
     * Moves to {@link PipelineState#FAILED} unless already terminal.
     */
    public void fail() {
        if (!state.isTerminal()) {
            moveTo(PipelineState.FAILED);
        }
    }

    public PipelineState state() {
        return state;
    }

    public PipelineOperation operation() {
        return operation;
    }
}

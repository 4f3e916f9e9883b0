package com.questrail.helix.observability;

/**
 * Main interface for receiving codec observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from chunk worker threads when the codec is
 * configured with a multi-threaded executor; implementations must be
 * thread-safe.</p>
 */
public interface CodecObservabilitySink {
    /**
     * Called when an encode or decode call changes pipeline state.
     * @param event the transition event details
     */
    void onStateTransition(PipelineTransitionEvent event);

    /**
     * Called when the Reed-Solomon decoder repaired bytes in a chunk.
     * @param event the correction details
     */
    void onChunkCorrected(ChunkCorrectionEvent event);

    /**
     * Called when an encoded sequence violates the synthesis constraint policy.
     * @param event the constraint finding
     */
    void onConstraintViolation(ConstraintViolationEvent event);

    /**
     * Called when a call fails.
     * @param event the error event
     */
    void onError(CodecErrorEvent event);
}

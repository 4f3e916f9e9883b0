package com.questrail.helix.observability;

/**
 * No-op implementation of CodecObservabilitySink.
 */
public final class NullObservabilitySink implements CodecObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(PipelineTransitionEvent event) {}

    @Override
    public void onChunkCorrected(ChunkCorrectionEvent event) {}

    @Override
    public void onConstraintViolation(ConstraintViolationEvent event) {}

    @Override
    public void onError(CodecErrorEvent event) {}
}

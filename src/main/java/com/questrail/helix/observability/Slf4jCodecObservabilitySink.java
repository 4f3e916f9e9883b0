package com.questrail.helix.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CodecObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCodecObservabilitySink implements CodecObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);

    @Override
    public void onStateTransition(PipelineTransitionEvent event) {
        log.debug("{}: {} -> {}", event.operation(), event.from(), event.to());
    }

    @Override
    public void onChunkCorrected(ChunkCorrectionEvent event) {
        log.info("Chunk {} (sequence #{}): repaired {} of {} correctable bytes at {}",
            event.chunkIndex(),
            event.sequencePosition(),
            event.correctedBytes(),
            event.correctionLevel().correctionBound(),
            event.correctionLevel());
    }

    @Override
    public void onConstraintViolation(ConstraintViolationEvent event) {
        var report = event.report();
        log.warn("Sequence #{} violates synthesis constraints: gc={} longestRun={} violations={}",
            report.sequenceIndex(),
            String.format("%.3f", report.gcContent()),
            report.longestHomopolymer(),
            report.violations());
    }

    @Override
    public void onError(CodecErrorEvent event) {
        log.error("{} failed in {}: {}", event.operation(), event.failedIn(), event.message(), event.cause());
    }
}

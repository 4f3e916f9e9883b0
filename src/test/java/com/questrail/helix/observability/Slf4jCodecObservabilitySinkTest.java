package com.questrail.helix.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.constraints.ConstraintReport;
import com.questrail.helix.constraints.ConstraintViolation;
import com.questrail.helix.internal.state.PipelineOperation;
import com.questrail.helix.internal.state.PipelineState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class Slf4jCodecObservabilitySinkTest {

    private final Slf4jCodecObservabilitySink sink = new Slf4jCodecObservabilitySink();
    private final Logger logger = (Logger) LoggerFactory.getLogger(Slf4jCodecObservabilitySink.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private Level previousLevel;

    @BeforeEach
    void attach() {
        previousLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void detach() {
        logger.detachAppender(appender);
        logger.setLevel(previousLevel);
    }

    @Test
    void transitionsLogAtDebug() {
        sink.onStateTransition(new PipelineTransitionEvent(Instant.EPOCH,
            PipelineOperation.ENCODE, PipelineState.IDLE, PipelineState.VALIDATING_INPUT));

        ILoggingEvent event = single();
        assertEquals(Level.DEBUG, event.getLevel());
        assertEquals("ENCODE: IDLE -> VALIDATING_INPUT", event.getFormattedMessage());
    }

    @Test
    void correctionsLogAtInfo() {
        sink.onChunkCorrected(new ChunkCorrectionEvent(Instant.EPOCH, 3, 1, 2, CorrectionLevel.BASIC));

        ILoggingEvent event = single();
        assertEquals(Level.INFO, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("repaired 2 of 4"));
    }

    @Test
    void constraintViolationsLogAtWarn() {
        ConstraintReport report = new ConstraintReport(0, 0.2, 5,
            List.of(new ConstraintViolation.Homopolymer(4, 'A', 5, 3)));
        sink.onConstraintViolation(new ConstraintViolationEvent(Instant.EPOCH, report));

        ILoggingEvent event = single();
        assertEquals(Level.WARN, event.getLevel());
        assertTrue(event.getFormattedMessage().contains("Sequence #0"));
    }

    @Test
    void errorsLogAtErrorWithCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        sink.onError(new CodecErrorEvent(Instant.EPOCH, PipelineOperation.DECODE,
            PipelineState.REASSEMBLING, "boom", cause));

        ILoggingEvent event = single();
        assertEquals(Level.ERROR, event.getLevel());
        assertEquals("DECODE failed in REASSEMBLING: boom", event.getFormattedMessage());
        assertNotNull(event.getThrowableProxy());
    }

    private ILoggingEvent single() {
        assertEquals(1, appender.list.size());
        return appender.list.get(0);
    }
}

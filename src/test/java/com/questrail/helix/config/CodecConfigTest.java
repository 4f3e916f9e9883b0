package com.questrail.helix.config;

import com.questrail.helix.constraints.ConstraintPolicy;
import com.questrail.helix.internal.exec.ChunkFanOut;
import com.questrail.helix.observability.NullObservabilitySink;
import com.questrail.helix.observability.Slf4jCodecObservabilitySink;
import org.junit.jupiter.api.Test;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;

class CodecConfigTest {

    @Test
    void defaultsAreProductionValues() {
        CodecConfig config = CodecConfig.defaults();

        assertEquals(CodecConfig.DEFAULT_KDF_ITERATIONS, config.kdfIterations());
        assertEquals(100_000, config.kdfIterations());
        assertSame(ChunkFanOut.CALLER_THREAD, config.chunkExecutor());
        assertInstanceOf(Slf4jCodecObservabilitySink.class, config.observabilitySink());
        assertEquals(ConstraintPolicy.defaults(), config.constraintPolicy());
        assertNotNull(config.secureRandom());
        assertNotNull(config.clock());
    }

    @Test
    void builderOverridesEveryField() {
        SecureRandom random = new SecureRandom();
        Executor executor = Runnable::run;
        ConstraintPolicy policy = new ConstraintPolicy(0.45, 0.05, 4);
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);

        CodecConfig config = CodecConfig.builder()
            .withKdfIterations(2_000)
            .withSecureRandom(random)
            .withChunkExecutor(executor)
            .withObservabilitySink(NullObservabilitySink.INSTANCE)
            .withConstraintPolicy(policy)
            .withClock(clock)
            .build();

        assertEquals(2_000, config.kdfIterations());
        assertSame(random, config.secureRandom());
        assertSame(executor, config.chunkExecutor());
        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
        assertSame(policy, config.constraintPolicy());
        assertSame(clock, config.clock());
    }

    @Test
    void rejectsIterationsOutOfRange() {
        assertThrows(IllegalArgumentException.class,
            () -> CodecConfig.builder().withKdfIterations(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> CodecConfig.builder().withKdfIterations(20_000_000).build());
    }

    @Test
    void rejectsNullCollaborators() {
        assertThrows(NullPointerException.class,
            () -> CodecConfig.builder().withChunkExecutor(null).build());
        assertThrows(NullPointerException.class,
            () -> CodecConfig.builder().withConstraintPolicy(null).build());
        assertThrows(NullPointerException.class,
            () -> CodecConfig.builder().withClock(null).build());
    }
}

package com.questrail.helix.config;

import com.questrail.helix.constraints.ConstraintPolicy;
import com.questrail.helix.internal.crypto.EncryptionEnvelope;
import com.questrail.helix.internal.exec.ChunkFanOut;
import com.questrail.helix.observability.CodecObservabilitySink;
import com.questrail.helix.observability.Slf4jCodecObservabilitySink;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Aggregated, immutable configuration for a codec instance.
 *
 * <p>Per-call choices (password, base length, correction level) are not part
 * of this record; they travel in
 * {@link com.questrail.helix.api.EncodeOptions} and
 * {@link com.questrail.helix.api.DecodeOptions}.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>kdfIterations</b>: PBKDF2 work factor applied when sealing. Opening
 *       uses the count recorded in the envelope.</li>
 *   <li><b>secureRandom</b>: source of salts and nonces.</li>
 *   <li><b>chunkExecutor</b>: where per-chunk work runs. Defaults to the calling
 *       thread. The codec never shuts it down.</li>
 *   <li><b>observabilitySink</b>: receives state transitions, corrections,
 *       constraint findings and errors.</li>
 *   <li><b>constraintPolicy</b>: limits for the report-only synthesis check.</li>
 *   <li><b>clock</b>: timestamps for observability events.</li>
 * </ul>
 */
public record CodecConfig(
    int kdfIterations,
    SecureRandom secureRandom,
    Executor chunkExecutor,
    CodecObservabilitySink observabilitySink,
    ConstraintPolicy constraintPolicy,
    Clock clock
) {
    public static final int DEFAULT_KDF_ITERATIONS = 100_000;

    public CodecConfig {
        Objects.requireNonNull(secureRandom, "secureRandom");
        Objects.requireNonNull(chunkExecutor, "chunkExecutor");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(constraintPolicy, "constraintPolicy");
        Objects.requireNonNull(clock, "clock");

        if (kdfIterations < 1 || kdfIterations > EncryptionEnvelope.MAX_ITERATIONS) {
            throw new IllegalArgumentException(
                    "kdfIterations must be within 1.." + EncryptionEnvelope.MAX_ITERATIONS);
        }
    }

    /**
     * Creates a configuration with production defaults: 100 000 PBKDF2
     * iterations, caller-thread execution, SLF4J observability, default
     * constraint policy, UTC system clock.
     */
    public static CodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int kdfIterations = DEFAULT_KDF_ITERATIONS;
        private SecureRandom secureRandom;
        private Executor chunkExecutor = ChunkFanOut.CALLER_THREAD;
        private CodecObservabilitySink observabilitySink;
        private ConstraintPolicy constraintPolicy = ConstraintPolicy.defaults();
        private Clock clock = Clock.systemUTC();

        public Builder withKdfIterations(int kdfIterations) {
            this.kdfIterations = kdfIterations;
            return this;
        }

        public Builder withSecureRandom(SecureRandom secureRandom) {
            this.secureRandom = secureRandom;
            return this;
        }

        public Builder withChunkExecutor(Executor chunkExecutor) {
            this.chunkExecutor = chunkExecutor;
            return this;
        }

        public Builder withObservabilitySink(CodecObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withConstraintPolicy(ConstraintPolicy constraintPolicy) {
            this.constraintPolicy = constraintPolicy;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public CodecConfig build() {
            return new CodecConfig(
                    kdfIterations,
                    secureRandom != null ? secureRandom : new SecureRandom(),
                    chunkExecutor,
                    observabilitySink != null ? observabilitySink : new Slf4jCodecObservabilitySink(),
                    constraintPolicy,
                    clock);
        }
    }
}

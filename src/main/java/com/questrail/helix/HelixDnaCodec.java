package com.questrail.helix;

import com.questrail.helix.api.CorrectionLevel;
import com.questrail.helix.api.DecodeOptions;
import com.questrail.helix.api.DnaCodec;
import com.questrail.helix.api.EncodeMetadata;
import com.questrail.helix.api.EncodeOptions;
import com.questrail.helix.api.EncodeResult;
import com.questrail.helix.api.HealthStatus;
import com.questrail.helix.codec.ChunkDecoder;
import com.questrail.helix.codec.ChunkEncoder;
import com.questrail.helix.codec.impl.DefaultChunkDecoder;
import com.questrail.helix.codec.impl.DefaultChunkEncoder;
import com.questrail.helix.codec.impl.SymbolCodec;
import com.questrail.helix.config.CodecConfig;
import com.questrail.helix.constraints.ConstraintReport;
import com.questrail.helix.constraints.SequenceConstraintAnalyzer;
import com.questrail.helix.error.ChecksumMismatchException;
import com.questrail.helix.error.ChunkFailure;
import com.questrail.helix.error.DecodeFailureException;
import com.questrail.helix.error.DnaCodecException;
import com.questrail.helix.error.UncorrectableChunkException;
import com.questrail.helix.error.ValidationException;
import com.questrail.helix.internal.chunk.Chunk;
import com.questrail.helix.internal.chunk.ChunkHeader;
import com.questrail.helix.internal.chunk.ChunkLayout;
import com.questrail.helix.internal.chunk.Chunker;
import com.questrail.helix.internal.chunk.DecodedChunk;
import com.questrail.helix.internal.chunk.Reassembler;
import com.questrail.helix.internal.crypto.PasswordCipher;
import com.questrail.helix.internal.exec.ChunkFanOut;
import com.questrail.helix.internal.state.PipelineOperation;
import com.questrail.helix.internal.state.PipelineState;
import com.questrail.helix.internal.state.PipelineTracker;
import com.questrail.helix.observability.ChunkCorrectionEvent;
import com.questrail.helix.observability.CodecErrorEvent;
import com.questrail.helix.observability.CodecObservabilitySink;
import com.questrail.helix.observability.ConstraintViolationEvent;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * HelixDnaCodec
 * =============================================================================
 * Production {@link DnaCodec}: composes encryption, chunking, header coding,
 * Reed-Solomon protection and symbol mapping into the two codec operations.
 *
 * <h2>Encode</h2>
 * <pre>
 *   VALIDATING_INPUT   solve the chunk layout; bad base length fails here
 *   ENCRYPTING         (password only) seal payload into an envelope
 *   CHUNKING           split stream, one header per chunk
 *   PROTECTING         per chunk, in parallel: header ‖ data ‖ parity
 *   SYMBOL_MAPPING     per chunk, in parallel: bytes → A/T/C/G
 * </pre>
 * Sequences are then checked against the constraint policy (report only).
 *
 * <h2>Decode</h2>
 * <pre>
 *   SYMBOL_DECODING       per sequence, in parallel: A/T/C/G → bytes
 *   PER_CHUNK_VALIDATING  per sequence, in parallel: correct, parse header, checksum
 *   REASSEMBLING          cross-chunk checks, ordered merge, truncate
 *   DECRYPTING            (encrypted headers only) open the envelope
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Per-chunk failures are collected for every sequence and thrown
 *       together as a {@link DecodeFailureException}; reassembly is not
 *       attempted while any chunk is broken.</li>
 *   <li>Configuration, reassembly and authentication failures abort the call
 *       immediately.</li>
 *   <li>Every failure moves the pipeline to {@code FAILED} and is published to
 *       the observability sink before being rethrown.</li>
 * </ul>
 *
 * <h2>Thread safety</h2>
 * Stateless between calls; safe for concurrent use. Per-chunk work runs on the
 * configured executor and is joined in chunk order.
 */
public final class HelixDnaCodec implements DnaCodec
{
    private final CodecConfig config;
    private final ChunkEncoder chunkEncoder;
    private final ChunkDecoder chunkDecoder;
    private final PasswordCipher cipher;
    private final ChunkFanOut fanOut;
    private final SequenceConstraintAnalyzer constraintAnalyzer;
    private final CodecObservabilitySink sink;

    public HelixDnaCodec()
    {
        this(CodecConfig.defaults());
    }

    public HelixDnaCodec(CodecConfig config)
    {
        this(config, new DefaultChunkEncoder(), new DefaultChunkDecoder());
    }

    public HelixDnaCodec(CodecConfig config, ChunkEncoder chunkEncoder, ChunkDecoder chunkDecoder)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.chunkEncoder = Objects.requireNonNull(chunkEncoder, "chunkEncoder");
        this.chunkDecoder = Objects.requireNonNull(chunkDecoder, "chunkDecoder");
        this.cipher = new PasswordCipher(config.kdfIterations(), config.secureRandom());
        this.fanOut = new ChunkFanOut(config.chunkExecutor());
        this.constraintAnalyzer = new SequenceConstraintAnalyzer(config.constraintPolicy());
        this.sink = config.observabilitySink();
    }

    // ========================================================================
    // Encode
    // ========================================================================

    @Override
    public EncodeResult encode(byte[] payload, EncodeOptions options)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(options, "options");

        final PipelineTracker tracker = new PipelineTracker(PipelineOperation.ENCODE, sink, config.clock());
        try {
            tracker.moveTo(PipelineState.VALIDATING_INPUT);
            final ChunkLayout layout = ChunkLayout.solve(options.baseLength(), options.correctionLevel());

            byte[] stream = payload;
            if (options.encrypted()) {
                tracker.moveTo(PipelineState.ENCRYPTING);
                stream = cipher.seal(payload, options.password());
            }

            tracker.moveTo(PipelineState.CHUNKING);
            final List<Chunk> chunks = Chunker.split(stream, layout, options.encrypted());

            tracker.moveTo(PipelineState.PROTECTING);
            final List<byte[]> blocks = fanOut.map(chunks, (position, chunk) -> chunkEncoder.protect(chunk));

            tracker.moveTo(PipelineState.SYMBOL_MAPPING);
            final List<String> sequences = fanOut.map(blocks, (position, block) -> SymbolCodec.bytesToSymbols(block));

            final List<ConstraintReport> reports = constraintAnalyzer.analyzeAll(sequences);
            for (ConstraintReport report : reports) {
                if (!report.compliant()) {
                    sink.onConstraintViolation(new ConstraintViolationEvent(config.clock().instant(), report));
                }
            }

            tracker.moveTo(PipelineState.DONE);

            final EncodeMetadata metadata = new EncodeMetadata(
                    payload.length,
                    sequences.size(),
                    options.baseLength(),
                    options.correctionLevel(),
                    options.encrypted());
            return new EncodeResult(sequences, metadata, reports);
        }
        catch (RuntimeException e) {
            fail(tracker, e);
            throw e;
        }
    }

    // ========================================================================
    // Decode
    // ========================================================================

    @Override
    public byte[] decode(Collection<String> sequences, DecodeOptions options)
    {
        Objects.requireNonNull(sequences, "sequences");
        Objects.requireNonNull(options, "options");

        final PipelineTracker tracker = new PipelineTracker(PipelineOperation.DECODE, sink, config.clock());
        try {
            tracker.moveTo(PipelineState.SYMBOL_DECODING);
            if (sequences.isEmpty()) {
                throw new ValidationException("No sequences supplied");
            }
            final List<String> inputs = new ArrayList<>(sequences);
            final List<ChunkOutcome> mapped = fanOut.map(inputs, HelixDnaCodec::decodeSymbols);

            tracker.moveTo(PipelineState.PER_CHUNK_VALIDATING);
            final CorrectionLevel preferred = options.correctionLevel();
            final List<ChunkOutcome> validated = fanOut.map(mapped,
                    (position, outcome) -> outcome.failed() ? outcome : validateChunk(position, outcome.block, preferred));

            final List<DecodedChunk> chunks = new ArrayList<>(validated.size());
            final List<ChunkFailure> failures = new ArrayList<>();
            for (ChunkOutcome outcome : validated) {
                if (outcome.failed()) {
                    failures.add(outcome.failure);
                } else {
                    chunks.add(outcome.decoded);
                }
            }
            if (!failures.isEmpty()) {
                throw new DecodeFailureException(failures);
            }
            publishCorrections(chunks);

            tracker.moveTo(PipelineState.REASSEMBLING);
            final Reassembler.ReassembledStream stream = Reassembler.reassemble(chunks);

            byte[] result = stream.bytes();
            if (stream.encrypted()) {
                tracker.moveTo(PipelineState.DECRYPTING);
                result = cipher.open(result, options.password());
            }

            tracker.moveTo(PipelineState.DONE);
            return result;
        }
        catch (RuntimeException e) {
            fail(tracker, e);
            throw e;
        }
    }

    @Override
    public HealthStatus health()
    {
        return new HealthStatus(HealthStatus.HEALTHY, ChunkHeader.CURRENT_VERSION);
    }

    // ========================================================================
    // Per-chunk work (runs on the chunk executor)
    // ========================================================================

    private static ChunkOutcome decodeSymbols(int position, String sequence)
    {
        if (sequence == null) {
            return ChunkOutcome.failed(new ChunkFailure(position, -1,
                    new ValidationException("Sequence #" + position + " is null")));
        }
        try {
            return ChunkOutcome.mapped(SymbolCodec.symbolsToBytes(sequence));
        }
        catch (ValidationException e) {
            return ChunkOutcome.failed(new ChunkFailure(position, -1,
                    new ValidationException("Sequence #" + position + ": " + e.getMessage(), e)));
        }
    }

    private ChunkOutcome validateChunk(int position, byte[] block, CorrectionLevel preferred)
    {
        try {
            return ChunkOutcome.decoded(chunkDecoder.decode(block, position, preferred));
        }
        catch (DnaCodecException e) {
            return ChunkOutcome.failed(new ChunkFailure(position, chunkIndexOf(e), e));
        }
    }

    private static int chunkIndexOf(DnaCodecException e)
    {
        if (e instanceof ChecksumMismatchException checksum) {
            return checksum.chunkIndex();
        }
        if (e instanceof UncorrectableChunkException uncorrectable) {
            return uncorrectable.claimedChunkIndex().orElse(-1);
        }
        return -1;
    }

    // ========================================================================
    // Observability
    // ========================================================================

    private void publishCorrections(List<DecodedChunk> chunks)
    {
        for (DecodedChunk chunk : chunks) {
            if (chunk.correctedBytes() > 0) {
                sink.onChunkCorrected(new ChunkCorrectionEvent(
                        config.clock().instant(),
                        chunk.sequencePosition(),
                        chunk.header().chunkIndex(),
                        chunk.correctedBytes(),
                        chunk.header().correctionLevel()));
            }
        }
    }

    private void fail(PipelineTracker tracker, RuntimeException e)
    {
        final PipelineState failedIn = tracker.state();
        tracker.fail();
        sink.onError(new CodecErrorEvent(
                config.clock().instant(), tracker.operation(), failedIn, e.getMessage(), e));
    }

    /**
     * Result of per-chunk decode work: exactly one of {@code block},
     * {@code decoded} or {@code failure} is set.
     */
    private static final class ChunkOutcome
    {
        final byte[] block;
        final DecodedChunk decoded;
        final ChunkFailure failure;

        private ChunkOutcome(byte[] block, DecodedChunk decoded, ChunkFailure failure)
        {
            this.block = block;
            this.decoded = decoded;
            this.failure = failure;
        }

        static ChunkOutcome mapped(byte[] block)
        {
            return new ChunkOutcome(block, null, null);
        }

        static ChunkOutcome decoded(DecodedChunk decoded)
        {
            return new ChunkOutcome(null, decoded, null);
        }

        static ChunkOutcome failed(ChunkFailure failure)
        {
            return new ChunkOutcome(null, null, failure);
        }

        boolean failed()
        {
            return failure != null;
        }
    }
}

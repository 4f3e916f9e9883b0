package com.questrail.helix.internal.state;

import java.util.EnumSet;
import java.util.Set;

/**
 * PipelineState
 * -----------------------------------------------------------------------------
 * States a single encode or decode call moves through.
 *
 * <pre>
 *   encode: IDLE → VALIDATING_INPUT → [ENCRYPTING] → CHUNKING → PROTECTING → SYMBOL_MAPPING → DONE
 *   decode: IDLE → SYMBOL_DECODING → PER_CHUNK_VALIDATING → REASSEMBLING → [DECRYPTING] → DONE
 * </pre>
 *
 * <p>Any non-terminal state may move to {@link #FAILED}. States exist per call
 * only; nothing is retained between calls.</p>
 */
public enum PipelineState
{
    IDLE,

    // encode
    VALIDATING_INPUT,
    ENCRYPTING,
    CHUNKING,
    PROTECTING,
    SYMBOL_MAPPING,

    // decode
    SYMBOL_DECODING,
    PER_CHUNK_VALIDATING,
    REASSEMBLING,
    DECRYPTING,

    // terminal
    DONE,
    FAILED;

    private static final Set<PipelineState> TERMINAL = EnumSet.of(DONE, FAILED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}

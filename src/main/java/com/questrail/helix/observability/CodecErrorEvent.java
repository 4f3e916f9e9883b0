package com.questrail.helix.observability;

import com.questrail.helix.internal.state.PipelineOperation;
import com.questrail.helix.internal.state.PipelineState;

import java.time.Instant;

/**
 * Record representing a failed codec call.
 *
 * @param failedIn the state the pipeline was in when it failed
 */
public record CodecErrorEvent(
    Instant timestamp,
    PipelineOperation operation,
    PipelineState failedIn,
    String message,
    Throwable cause
) {
}

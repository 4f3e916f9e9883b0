package com.questrail.helix.internal.state;

/**
 * The two top-level codec operations a pipeline run belongs to.
 */
public enum PipelineOperation
{
    ENCODE,
    DECODE
}

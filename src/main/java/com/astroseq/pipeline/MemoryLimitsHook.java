package com.astroseq.pipeline;

/**
 * Number of frames that fit in memory for an operation: as concurrently
 * processed frames, or with {@code forWriter}, as frames processed or
 * waiting to be written. Zero refuses the operation.
 */
@FunctionalInterface
public interface MemoryLimitsHook {
    int compute(SequenceArgs args, boolean forWriter);
}

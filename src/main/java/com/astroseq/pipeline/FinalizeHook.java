package com.astroseq.pipeline;

import com.astroseq.model.SequenceResult;

/**
 * Runs once all frames are processed and every writer has drained, with the
 * result so far. Throwing fails the operation.
 */
@FunctionalInterface
public interface FinalizeHook {
    void finish(SequenceArgs args, SequenceResult result) throws Exception;
}

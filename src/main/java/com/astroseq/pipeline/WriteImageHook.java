package com.astroseq.pipeline;

import com.astroseq.model.Frame;

/**
 * Saves one frame in the output container. Called by the writer thread only,
 * in ascending frame order; {@code position} counts the frames already
 * written, holes excluded.
 */
@FunctionalInterface
public interface WriteImageHook {
    void write(SequenceWriter writer, Frame frame, int position) throws Exception;
}

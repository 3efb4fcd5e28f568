package com.astroseq.pipeline;

import com.astroseq.model.Frame;

import java.awt.Rectangle;

/**
 * Per-frame processing producing one frame for each output of the operation,
 * in the order the outputs were declared.
 */
@FunctionalInterface
public interface SplitImageHook {
    Frame[] process(SequenceArgs args, int outIndex, int inIndex, Frame frame, Rectangle area, int threads)
            throws Exception;
}

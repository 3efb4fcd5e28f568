package com.astroseq.pipeline;

import com.astroseq.model.Frame;

import java.awt.Rectangle;

/**
 * Per-frame processing of a sequence operation. May modify {@code frame} in
 * place and return it, or return a new frame. Throwing marks the frame failed.
 *
 * {@code area} is the selection the operation is limited to, null for the
 * whole frame; {@code threads} is how many threads the hook may use itself.
 */
@FunctionalInterface
public interface ImageHook {
    Frame process(SequenceArgs args, int outIndex, int inIndex, Frame frame, Rectangle area, int threads)
            throws Exception;
}

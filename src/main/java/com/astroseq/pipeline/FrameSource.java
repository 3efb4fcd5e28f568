package com.astroseq.pipeline;

import com.astroseq.model.Frame;
import com.astroseq.model.FrameFormat;

/** Input sequence of an operation. Reads must be safe from several threads. */
public interface FrameSource {

    int frameCount();

    /** Format of the sequence, used to estimate memory needs. */
    FrameFormat format();

    Frame read(int index) throws Exception;

    String frameName(int index);
}

package com.astroseq.pipeline;

import com.astroseq.model.Frame;

/**
 * A write request for one index of the output sequence. A null frame is a
 * hole: nothing is written for that index but the writer moves past it.
 */
final class PendingWrite {

    static final PendingWrite ABORT = new PendingWrite(null, Integer.MIN_VALUE);

    final Frame frame;
    final int index;

    PendingWrite(Frame frame, int index) {
        this.frame = frame;
        this.index = index;
    }

    boolean isHole() {
        return frame == null;
    }
}

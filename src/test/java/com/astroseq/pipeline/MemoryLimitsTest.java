package com.astroseq.pipeline;

import com.astroseq.model.FrameFormat;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MemoryLimitsTest {

    // 1000x1000 float planes: 3.8 MB, rounded up to 4
    private final FrameFormat megapixel = new FrameFormat(1, -32, 1000, 1000);

    @Test
    void imageSizeIsRoundedUpToWholeMegabytes() {
        assertThat(MemoryLimits.imageSizeMb(megapixel)).isEqualTo(4);
        assertThat(MemoryLimits.imageSizeMb(new FrameFormat(1, 16, 10, 10))).isEqualTo(1);
        assertThat(MemoryLimits.imageSizeMb(new FrameFormat(3, 16, 1000, 1000))).isEqualTo(12);
    }

    @Test
    void threadsAreBoundedByMemoryAndByTheThreadLimit() {
        assertThat(MemoryLimits.compute(megapixel, 1.0, 100, 8, 3, false)).isEqualTo(8);
        assertThat(MemoryLimits.compute(megapixel, 1.0, 20, 8, 3, false)).isEqualTo(5);
        assertThat(MemoryLimits.compute(megapixel, 2.0, 20, 8, 3, false)).isEqualTo(2);
    }

    @Test
    void writeQueueUsesWhatTheThreadsLeave() {
        // 8 threads hold 32 MB, 68 MB left hold 17 more frames, capped at 3 x 8
        assertThat(MemoryLimits.compute(megapixel, 1.0, 100, 8, 3, true)).isEqualTo(24);
        assertThat(MemoryLimits.compute(megapixel, 1.0, 100, 8, 0, true)).isEqualTo(25);
        // 8 threads hold 64 MB at factor 2, 36 MB left hold 9 frames
        assertThat(MemoryLimits.compute(megapixel, 2.0, 100, 8, 3, true)).isEqualTo(17);
    }

    @Test
    void notEvenOneFrameFittingRefusesTheOperation() {
        assertThat(MemoryLimits.compute(megapixel, 1.0, 3, 8, 3, false)).isZero();
        assertThat(MemoryLimits.compute(megapixel, 1.0, 3, 8, 3, true)).isZero();
    }

    @Test
    void defaultHookUsesTheSourceFormat() {
        SequenceArgs args = SequenceArgs.createDefault(SyntheticSequences.source(4));
        args.maxThreads = 2;
        assertThat(args.memLimitsHook).isNotNull();
        assertThat(args.memLimitsHook.compute(args, false)).isEqualTo(2);
        assertThat(args.memLimitsHook.compute(args, true)).isGreaterThanOrEqualTo(2);
    }
}

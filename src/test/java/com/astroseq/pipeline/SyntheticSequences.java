package com.astroseq.pipeline;

import com.astroseq.model.Frame;
import com.astroseq.model.FrameFormat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BooleanSupplier;

/** In-memory frames, sources and write hooks for the pipeline tests. */
final class SyntheticSequences {

    private SyntheticSequences() {
    }

    /** Mono 16-bit frame whose first pixel carries its tag. */
    static Frame frame(int tag) {
        return frame(tag, 8, 6, 1, 16);
    }

    static Frame frame(int tag, int width, int height, int channels, int bitpix) {
        Frame f = Frame.blank(width, height, channels, bitpix);
        f.planes[0][0] = tag;
        return f;
    }

    static int tagOf(Frame f) {
        return (int) f.planes[0][0];
    }

    static FrameSource source(int count) {
        return new FrameSource() {
            @Override
            public int frameCount() {
                return count;
            }

            @Override
            public FrameFormat format() {
                return new FrameFormat(1, 16, 8, 6);
            }

            @Override
            public Frame read(int index) {
                return frame(index);
            }

            @Override
            public String frameName(int index) {
                return "frame" + index;
            }
        };
    }

    /** Write hook remembering the tag and position of everything it saves. */
    static class RecordingHook implements WriteImageHook {
        final List<Integer> tags = Collections.synchronizedList(new ArrayList<>());
        final List<Integer> positions = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void write(SequenceWriter writer, Frame frame, int position) throws Exception {
            tags.add(tagOf(frame));
            positions.add(position);
        }

        List<Integer> tags() {
            synchronized (tags) {
                return new ArrayList<>(tags);
            }
        }

        List<Integer> positions() {
            synchronized (positions) {
                return new ArrayList<>(positions);
            }
        }
    }

    static List<Integer> range(int from, int to) {
        List<Integer> l = new ArrayList<>();
        for (int i = from; i < to; i++)
            l.add(i);
        return l;
    }

    static boolean eventually(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean())
                return true;
            Thread.sleep(5);
        }
        return condition.getAsBoolean();
    }
}

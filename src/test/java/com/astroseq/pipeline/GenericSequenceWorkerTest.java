package com.astroseq.pipeline;

import com.astroseq.model.Frame;
import com.astroseq.model.FrameFormat;
import com.astroseq.model.OutputType;
import com.astroseq.model.SequenceResult;
import com.astroseq.model.WriteStatus;
import com.astroseq.pipeline.SyntheticSequences.RecordingHook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.astroseq.pipeline.SyntheticSequences.frame;
import static com.astroseq.pipeline.SyntheticSequences.range;
import static com.astroseq.pipeline.SyntheticSequences.source;
import static com.astroseq.pipeline.SyntheticSequences.tagOf;
import static org.assertj.core.api.Assertions.*;

@Timeout(30)
class GenericSequenceWorkerTest {

    private final GenericSequenceWorker worker = new GenericSequenceWorker();

    private static SequenceArgs args(int frames, ImageHook hook) {
        SequenceArgs args = new SequenceArgs(source(frames));
        args.maxThreads = 4;
        args.imageHook = hook;
        args.description = "test";
        return args;
    }

    private static ImageHook randomDelay(long seed) {
        return (args, outIndex, inIndex, frame, area, threads) -> {
            Thread.sleep(new Random(seed + inIndex).nextInt(8));
            return frame;
        };
    }

    @Test
    void outputIsInIndexOrderWhateverTheProcessingTime() throws Exception {
        RecordingHook out = new RecordingHook();
        SequenceArgs args = args(50, randomDelay(7));
        args.memLimitsHook = (a, forWriter) -> forWriter ? 6 : 4;
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, out));

        SequenceResult result = worker.run(args);

        assertThat(result.success).isTrue();
        assertThat(result.writeStatus).isEqualTo(WriteStatus.OK);
        assertThat(result.selectedFrames).isEqualTo(50);
        assertThat(result.framesWritten()).isEqualTo(50);
        assertThat(out.tags()).isEqualTo(range(0, 50));
        assertThat(out.positions()).isEqualTo(range(0, 50));
    }

    @Test
    void queueOfOneFrameStillCompletes() throws Exception {
        RecordingHook out = new RecordingHook();
        SequenceArgs args = args(20, randomDelay(3));
        args.memLimitsHook = (a, forWriter) -> forWriter ? 1 : 4;
        args.addOutput(new SequenceOutput("seq", OutputType.SER, out));

        SequenceResult result = worker.run(args);

        assertThat(result.success).isTrue();
        assertThat(out.tags()).isEqualTo(range(0, 20));
    }

    @Test
    void failedFramesAreSkippedWhenNotStoppingOnError() throws Exception {
        RecordingHook out = new RecordingHook();
        SequenceArgs args = args(20, (a, outIndex, inIndex, frame, area, threads) -> {
            if (inIndex == 3 || inIndex == 7) throw new IOException("bad frame " + inIndex);
            return frame;
        });
        args.stopOnError = false;
        args.memLimitsHook = (a, forWriter) -> forWriter ? 5 : 3;
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, out));

        SequenceResult result = worker.run(args);

        List<Integer> expected = range(0, 20);
        expected.remove(Integer.valueOf(3));
        expected.remove(Integer.valueOf(7));
        assertThat(result.success).isTrue();
        assertThat(result.failedFrames).isEqualTo(2);
        assertThat(result.framesWritten()).isEqualTo(18);
        assertThat(result.message).contains("2 image(s)");
        assertThat(out.tags()).isEqualTo(expected);
        assertThat(out.positions()).isEqualTo(range(0, 18));
    }

    @Test
    void firstFailureStopsTheRunWhenStoppingOnError() throws Exception {
        RecordingHook out = new RecordingHook();
        AtomicInteger processed = new AtomicInteger();
        SequenceArgs args = args(40, (a, outIndex, inIndex, frame, area, threads) -> {
            processed.incrementAndGet();
            if (inIndex == 5) throw new IOException("bad frame");
            return frame;
        });
        args.parallel = false;
        args.memLimitsHook = (a, forWriter) -> forWriter ? 4 : 1;
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, out));

        SequenceResult result = worker.run(args);

        assertThat(result.success).isFalse();
        assertThat(result.failedFrames).isEqualTo(1);
        assertThat(result.writeStatus).isEqualTo(WriteStatus.INCOMPLETE);
        assertThat(result.message).isEqualTo("stopped on the failure of an image");
        assertThat(processed.get()).isLessThan(40);
        List<Integer> tags = out.tags();
        assertThat(tags).hasSizeLessThanOrEqualTo(5).isEqualTo(range(0, tags.size()));
    }

    @Test
    void hookReturningNoImageCountsAsFailure() throws Exception {
        RecordingHook out = new RecordingHook();
        SequenceArgs args = args(6, (a, outIndex, inIndex, frame, area, threads) -> inIndex == 2 ? null : frame);
        args.stopOnError = false;
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, out));

        SequenceResult result = worker.run(args);

        assertThat(result.failedFrames).isEqualTo(1);
        assertThat(out.tags()).containsExactly(0, 1, 3, 4, 5);
    }

    @Test
    void runIsRefusedWhenNoThreadFitsInMemory() throws Exception {
        AtomicBoolean prepared = new AtomicBoolean();
        RecordingHook out = new RecordingHook();
        SequenceArgs args = args(10, (a, outIndex, inIndex, frame, area, threads) -> frame);
        args.memLimitsHook = (a, forWriter) -> 0;
        args.prepareHook = a -> prepared.set(true);
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, out));

        SequenceResult result = worker.run(args);

        assertThat(result.success).isFalse();
        assertThat(result.message).isEqualTo("not enough memory");
        assertThat(result.writeStatus).isEqualTo(WriteStatus.OK);
        assertThat(result.writtenFrames).isEmpty();
        assertThat(prepared).isFalse();
        assertThat(out.tags()).isEmpty();
    }

    @Test
    void runIsRefusedWhenTheWriteQueueDoesNotFit() throws Exception {
        SequenceArgs args = args(10, (a, outIndex, inIndex, frame, area, threads) -> frame);
        args.memLimitsHook = (a, forWriter) -> forWriter ? 0 : 2;
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, new RecordingHook()));

        SequenceResult result = worker.run(args);

        assertThat(result.success).isFalse();
        assertThat(result.message).isEqualTo("not enough memory for the write queue");
    }

    @Test
    void failedPreparationProcessesNothing() throws Exception {
        AtomicInteger processed = new AtomicInteger();
        SequenceArgs args = args(10, (a, outIndex, inIndex, frame, area, threads) -> {
            processed.incrementAndGet();
            return frame;
        });
        args.prepareHook = a -> {
            throw new IOException("no reference");
        };

        SequenceResult result = worker.run(args);

        assertThat(result.success).isFalse();
        assertThat(result.message).contains("no reference");
        assertThat(result.writeStatus).isEqualTo(WriteStatus.OK);
        assertThat(processed).hasValue(0);
    }

    @Test
    void failedFinalizationFailsTheRun() throws Exception {
        AtomicReference<SequenceResult> seen = new AtomicReference<>();
        RecordingHook out = new RecordingHook();
        SequenceArgs args = args(5, (a, outIndex, inIndex, frame, area, threads) -> frame);
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, out));
        args.finalizeHook = (a, r) -> {
            seen.set(r);
            throw new IOException("cannot close");
        };

        SequenceResult result = worker.run(args);

        assertThat(seen.get().success).isTrue();
        assertThat(seen.get().framesWritten()).isEqualTo(5);
        assertThat(result.success).isFalse();
        assertThat(result.message).startsWith("finalization failed");
        assertThat(out.tags()).hasSize(5);
    }

    @Test
    void onlySelectedFramesAreProcessedAndNumberedContiguously() throws Exception {
        List<int[]> indices = Collections.synchronizedList(new ArrayList<>());
        RecordingHook out = new RecordingHook();
        SequenceArgs args = args(10, (a, outIndex, inIndex, frame, area, threads) -> {
            indices.add(new int[] { outIndex, inIndex });
            return frame;
        });
        args.selection = i -> i % 2 == 0;
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, out));

        SequenceResult result = worker.run(args);

        assertThat(result.selectedFrames).isEqualTo(5);
        assertThat(out.tags()).containsExactly(0, 2, 4, 6, 8);
        assertThat(indices).hasSize(5).allSatisfy(p -> assertThat(p[1]).isEqualTo(2 * p[0]));
    }

    @Test
    void emptySelectionIsRefused() throws Exception {
        SequenceArgs args = args(10, (a, outIndex, inIndex, frame, area, threads) -> frame);
        args.selection = i -> false;

        SequenceResult result = worker.run(args);

        assertThat(result.success).isFalse();
        assertThat(result.selectedFrames).isZero();
    }

    @Test
    void splitOperationFeedsEveryOutputInOrder() throws Exception {
        RecordingHook first = new RecordingHook();
        RecordingHook second = new RecordingHook();
        SequenceArgs args = args(30, null);
        args.splitHook = (a, outIndex, inIndex, frame, area, threads) -> {
            Thread.sleep(new Random(inIndex).nextInt(5));
            return new Frame[] { frame(inIndex), frame(1000 + inIndex) };
        };
        args.memLimitsHook = (a, forWriter) -> forWriter ? 3 : 3;
        args.addOutput(new SequenceOutput("a", OutputType.FITSEQ, first));
        args.addOutput(new SequenceOutput("b", OutputType.FITS_FILES, second));

        SequenceResult result = worker.run(args);

        assertThat(result.success).isTrue();
        assertThat(result.writtenFrames).containsExactly(30, 30);
        assertThat(first.tags()).isEqualTo(range(0, 30));
        assertThat(second.tags()).isEqualTo(range(1000, 1030));
    }

    @Test
    void operationWithoutOutputRunsEveryFrame() throws Exception {
        AtomicInteger sum = new AtomicInteger();
        SequenceArgs args = args(12, (a, outIndex, inIndex, frame, area, threads) -> {
            sum.addAndGet(tagOf(frame));
            return frame;
        });

        SequenceResult result = worker.run(args);

        assertThat(result.success).isTrue();
        assertThat(result.writeStatus).isEqualTo(WriteStatus.OK);
        assertThat(result.writtenFrames).isEmpty();
        assertThat(sum).hasValue(66);
    }

    @Test
    void progressEndsWithReady() throws Exception {
        List<String> texts = Collections.synchronizedList(new ArrayList<>());
        List<Double> fractions = Collections.synchronizedList(new ArrayList<>());
        SequenceArgs args = args(8, (a, outIndex, inIndex, frame, area, threads) -> frame);
        args.progress = (text, fraction) -> {
            texts.add(text);
            fractions.add(fraction);
        };

        worker.run(args);

        assertThat(texts.get(0)).isEqualTo("test");
        assertThat(texts.get(texts.size() - 1)).isEqualTo("Ready.");
        assertThat(fractions.get(fractions.size() - 1)).isEqualTo(1.0);
        assertThat(texts).contains("test: 8/8");
        assertThat(fractions).allSatisfy(f -> assertThat(f).isBetween(0.0, 1.0));
    }

    @Test
    void failingWriteHookEndsWithWriteError() throws Exception {
        SequenceArgs args = args(20, (a, outIndex, inIndex, frame, area, threads) -> frame);
        args.memLimitsHook = (a, forWriter) -> forWriter ? 4 : 2;
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, (w, f, position) -> {
            if (position == 3) throw new IOException("disk full");
        }));

        SequenceResult result = worker.run(args);

        assertThat(result.success).isFalse();
        assertThat(result.writeStatus).isEqualTo(WriteStatus.WRITE_ERROR);
        assertThat(result.framesWritten()).isEqualTo(3);
    }

    @Test
    void unusableResultEndsTheRunInsteadOfBlockingTheQueue() throws Exception {
        SequenceArgs args = args(10, (a, outIndex, inIndex, frame, area, threads) ->
                new Frame(frame.width, frame.height, frame.bitpix, frame.planes) {
                    @Override
                    public FrameFormat format() {
                        throw new IllegalArgumentException("corrupt header");
                    }
                });
        args.memLimitsHook = (a, forWriter) -> forWriter ? 2 : 2;
        args.addOutput(new SequenceOutput("seq", OutputType.FITSEQ, new RecordingHook()));

        SequenceResult result = worker.run(args);

        assertThat(result.success).isFalse();
        assertThat(result.writeStatus).isEqualTo(WriteStatus.WRITE_ERROR);
        assertThat(result.framesWritten()).isZero();
    }

    @Test
    void inconsistentArgumentsAreRejected() {
        SequenceArgs noHook = args(3, null);
        assertThatThrownBy(() -> worker.run(noHook)).isInstanceOf(IllegalArgumentException.class);

        SequenceArgs twoOutputs = args(3, (a, outIndex, inIndex, frame, area, threads) -> frame);
        twoOutputs.addOutput(new SequenceOutput("a", OutputType.FITSEQ, new RecordingHook()));
        twoOutputs.addOutput(new SequenceOutput("b", OutputType.FITSEQ, new RecordingHook()));
        assertThatThrownBy(() -> worker.run(twoOutputs)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void elapsedTimeIsFormattedWithMinutesWhenNeeded() {
        assertThat(GenericSequenceWorker.formatElapsed(62350)).isEqualTo("1 min 2.35 s");
        assertThat(GenericSequenceWorker.formatElapsed(1500)).isEqualTo("1.50 s");
        assertThat(GenericSequenceWorker.formatElapsed(0)).isEqualTo("0.00 s");
    }
}

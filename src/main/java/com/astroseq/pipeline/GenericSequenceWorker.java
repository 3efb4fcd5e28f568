package com.astroseq.pipeline;

import com.astroseq.model.Frame;
import com.astroseq.model.SequenceResult;
import com.astroseq.model.WriteStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an operation over the selected frames of a sequence with a pool of
 * worker threads, and saves the results through one {@link SequenceWriter}
 * per output.
 *
 * Memory slots are taken by the dispatching thread, in ascending frame
 * order, before a frame is handed to a worker. The frame the writer is
 * waiting for therefore always holds a slot, whatever the order in which
 * workers finish.
 */
public class GenericSequenceWorker {

    private static final Logger log = LoggerFactory.getLogger(GenericSequenceWorker.class);

    private static class RunState {
        final AtomicBoolean abort = new AtomicBoolean();
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();
    }

    public SequenceResult run(SequenceArgs args) throws InterruptedException {
        long start = System.currentTimeMillis();
        checkArgs(args);

        List<Integer> selected = new ArrayList<>();
        for (int i = 0; i < args.source.frameCount(); i++) {
            if (args.selection.isIncluded(i))
                selected.add(i);
        }
        int nbFrames = selected.size();
        if (nbFrames == 0) {
            log.warn("{}: no image selected in the sequence", args.description);
            return SequenceResult.refused(0, "no image selected");
        }

        int nbThreads = args.parallel ? Math.max(1, args.maxThreads) : 1;
        int maxQueued = 0;
        if (args.memLimitsHook != null) {
            int limit = args.memLimitsHook.compute(args, false);
            if (limit <= 0)
                return SequenceResult.refused(nbFrames, "not enough memory");
            if (args.parallel)
                nbThreads = limit;
            if (args.hasOutput() && args.parallel) {
                maxQueued = args.memLimitsHook.compute(args, true);
                if (maxQueued <= 0)
                    return SequenceResult.refused(nbFrames, "not enough memory for the write queue");
            }
        }
        nbThreads = Math.min(nbThreads, nbFrames);
        int threadsPerImage = Math.max(1, args.maxThreads / nbThreads);

        if (args.prepareHook != null) {
            try {
                args.prepareHook.prepare(args);
            } catch (Exception e) {
                log.error("{}: preparation failed", args.description, e);
                return SequenceResult.refused(nbFrames, "preparation failed: " + e.getMessage());
            }
        }

        SequenceRunContext context = new SequenceRunContext();
        List<SequenceWriter> writers = new ArrayList<>();
        if (args.hasOutput()) {
            context.memoryGate().setMaxActiveBlocks(maxQueued);
            context.outputs().setNumberOfOutputs(args.outputs.size());
            for (SequenceOutput output : args.outputs) {
                SequenceWriter writer = new SequenceWriter(context, output.name, output.type,
                        args.heterogeneousAllowed, output.writeHook);
                writer.start(nbFrames);
                writers.add(writer);
            }
        }

        log.info("{}: processing {} image(s) with {} thread(s)", args.description, nbFrames, nbThreads);
        args.progress.update(args.description, 0.0);

        RunState state = new RunState();
        boolean interrupted = false;
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService exec = Executors.newFixedThreadPool(nbThreads,
                r -> new Thread(r, "seq-worker-" + threadCounter.incrementAndGet()));
        try {
            for (int out = 0; out < nbFrames; out++) {
                if (state.abort.get())
                    break;
                if (!writers.isEmpty()) {
                    context.memoryGate().waitForMemory();
                    if (state.abort.get()) {
                        context.releaseMemory();
                        break;
                    }
                }
                final int outIndex = out;
                final int inIndex = selected.get(out);
                exec.submit(() -> processFrame(args, context, writers, outIndex, inIndex,
                        threadsPerImage, nbFrames, state));
            }
        } catch (InterruptedException e) {
            log.warn("{}: interrupted, stopping", args.description);
            state.abort.set(true);
            interrupted = true;
            exec.shutdownNow();
        }
        exec.shutdown();
        while (!exec.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS)) {
            log.debug("still waiting for workers");
        }

        boolean aborted = state.abort.get();
        WriteStatus writeStatus = WriteStatus.OK;
        int[] written = new int[writers.size()];
        for (int i = 0; i < writers.size(); i++) {
            SequenceWriter writer = writers.get(i);
            WriteStatus st = writer.stop(aborted);
            written[i] = writer.framesWritten();
            writeStatus = worst(writeStatus, st);
            log.info("{}: output {} has {} image(s) ({} expected)", args.description, writer.name(),
                    written[i], nbFrames - state.failed.get());
        }

        int failed = state.failed.get();
        boolean success = !aborted && writeStatus == WriteStatus.OK;
        String message = null;
        if (aborted)
            message = failed > 0 ? "stopped on the failure of an image" : "aborted";
        else if (writeStatus != WriteStatus.OK)
            message = "sequence writing ended with " + writeStatus;
        else if (failed > 0)
            message = failed + " image(s) could not be processed and were skipped";

        SequenceResult result = new SequenceResult(success, writeStatus, nbFrames, failed, written,
                System.currentTimeMillis() - start, message);
        if (args.finalizeHook != null) {
            try {
                args.finalizeHook.finish(args, result);
            } catch (Exception e) {
                log.error("{}: finalization failed", args.description, e);
                result = new SequenceResult(false, writeStatus, nbFrames, failed, written,
                        System.currentTimeMillis() - start, "finalization failed: " + e.getMessage());
            }
        }

        if (result.success)
            log.info("{} succeeded. Execution time: {}", args.description, formatElapsed(result.elapsedMillis));
        else
            log.error("{} failed ({}). Execution time: {}", args.description, result.message,
                    formatElapsed(result.elapsedMillis));
        args.progress.update("Ready.", 1.0);
        if (interrupted)
            Thread.currentThread().interrupt();
        return result;
    }

    private void processFrame(SequenceArgs args, SequenceRunContext context, List<SequenceWriter> writers,
                              int outIndex, int inIndex, int threads, int nbFrames, RunState state) {
        boolean hasOutput = !writers.isEmpty();
        if (state.abort.get()) {
            if (hasOutput)
                context.releaseMemory();
            return;
        }

        Frame[] results;
        try {
            Frame frame = args.source.read(inIndex);
            if (args.splitHook != null) {
                results = args.splitHook.process(args, outIndex, inIndex, frame, args.area, threads);
            } else {
                results = new Frame[] { args.imageHook.process(args, outIndex, inIndex, frame, args.area, threads) };
            }
            if (hasOutput)
                checkResults(results, writers.size());
        } catch (Exception | OutOfMemoryError e) {
            state.failed.incrementAndGet();
            log.error("{}: image {} ({}) failed", args.description, inIndex, args.source.frameName(inIndex), e);
            if (args.stopOnError) {
                state.abort.set(true);
                if (hasOutput)
                    context.releaseMemory();
            } else if (hasOutput) {
                submit(writers, null, outIndex, context, state);
            }
            reportProgress(args, nbFrames, state);
            return;
        }

        if (hasOutput)
            submit(writers, results, outIndex, context, state);
        reportProgress(args, nbFrames, state);
    }

    // frames == null submits a hole to every output
    private void submit(List<SequenceWriter> writers, Frame[] frames, int outIndex,
                        SequenceRunContext context, RunState state) {
        for (int i = 0; i < writers.size(); i++) {
            try {
                writers.get(i).appendWrite(frames == null ? null : frames[i], outIndex);
            } catch (SequenceWriteException e) {
                log.error("image {} not queued for {}: {}", outIndex, writers.get(i).name(), e.getMessage());
                state.abort.set(true);
                context.releaseMemory();
                return;
            }
        }
    }

    private void reportProgress(SequenceArgs args, int nbFrames, RunState state) {
        int done = state.processed.incrementAndGet();
        args.progress.update(String.format(Locale.US, "%s: %d/%d", args.description, done, nbFrames),
                (double) done / nbFrames);
    }

    private static void checkResults(Frame[] results, int outputs) {
        if (results == null || results.length != outputs)
            throw new IllegalStateException("image hook returned " + (results == null ? "nothing" : results.length + " image(s)")
                    + " for " + outputs + " output(s)");
        for (Frame f : results) {
            if (f == null)
                throw new IllegalStateException("image hook returned a null image");
        }
    }

    private static void checkArgs(SequenceArgs args) {
        if (args.source == null)
            throw new IllegalArgumentException("no input sequence");
        if (args.imageHook == null && args.splitHook == null)
            throw new IllegalArgumentException("no image hook");
        if (args.outputs.size() > 1 && args.splitHook == null)
            throw new IllegalArgumentException("several outputs need a split image hook");
    }

    private static WriteStatus worst(WriteStatus a, WriteStatus b) {
        if (a == WriteStatus.WRITE_ERROR || b == WriteStatus.WRITE_ERROR)
            return WriteStatus.WRITE_ERROR;
        if (a == WriteStatus.INCOMPLETE || b == WriteStatus.INCOMPLETE)
            return WriteStatus.INCOMPLETE;
        return WriteStatus.OK;
    }

    static String formatElapsed(long millis) {
        long minutes = millis / 60000;
        double seconds = (millis % 60000) / 1000.0;
        if (minutes > 0)
            return String.format(Locale.US, "%d min %.2f s", minutes, seconds);
        return String.format(Locale.US, "%.2f s", seconds);
    }
}

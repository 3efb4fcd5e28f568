package com.astroseq.pipeline;

import com.astroseq.model.Frame;
import com.astroseq.model.FrameFormat;
import com.astroseq.model.OutputType;
import com.astroseq.model.WriteStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Saves the frames of a single-file sequence (FITS cube, SER) from one
 * dedicated thread. Containers like these cannot be written by several
 * threads, and not out of order, so processing threads queue their results
 * here and the writer saves them from first index to last.
 *
 * Every index of the sequence must receive a request, either a frame or a
 * hole (null frame) for a frame that could not be produced; otherwise the
 * writer waits forever for the missing one. Requests that arrive early are
 * kept until their turn. Memory is bounded upstream by the
 * {@link MemoryGate}, so requests should not run ahead of the writer by more
 * than the number of admitted slots.
 */
public class SequenceWriter {

    private static final Logger log = LoggerFactory.getLogger(SequenceWriter.class);

    private final SequenceRunContext context;
    private final String name;
    private final OutputType outputType;
    private final boolean heterogeneousAllowed;
    private final WriteImageHook writeHook;

    private final AtomicBoolean failed = new AtomicBoolean();
    private volatile LinkedBlockingDeque<PendingWrite> queue;
    private Thread thread;

    // owned by the writer thread while it runs
    private volatile FrameFormat format;
    private volatile int frameCount;
    private volatile int framesWritten;
    private volatile WriteStatus status = WriteStatus.OK;
    private volatile int discardedTasks;

    public SequenceWriter(SequenceRunContext context, String name, OutputType outputType,
                          boolean heterogeneousAllowed, WriteImageHook writeHook) {
        this.context = context;
        this.name = name;
        this.outputType = outputType;
        this.heterogeneousAllowed = heterogeneousAllowed;
        this.writeHook = writeHook;
    }

    // expectedFrameCount <= 0: unknown, the writer runs until stopped
    public synchronized void start(int expectedFrameCount) {
        if (thread != null)
            throw new IllegalStateException("writer " + name + " is already running");
        failed.set(false);
        format = null;
        frameCount = expectedFrameCount;
        framesWritten = 0;
        status = WriteStatus.OK;
        discardedTasks = 0;
        if (expectedFrameCount > 0)
            log.debug("writer {}: starting with {} expected frames", name, expectedFrameCount);
        queue = new LinkedBlockingDeque<>();
        thread = new Thread(this::writeWorker, "writer-" + name);
        thread.start();
    }

    /**
     * Queues a frame, or a hole if {@code frame} is null, for index
     * {@code index}. Never blocks. The frame belongs to the writer afterwards.
     *
     * @throws SequenceWriteException if the writer has failed or is not
     *         running, or if the request could not be allocated
     */
    public void appendWrite(Frame frame, int index) throws SequenceWriteException {
        if (index < 0)
            throw new IllegalArgumentException("negative frame index " + index);
        if (failed.get())
            throw new SequenceWriteException(SequenceWriteException.Kind.WRITE_ERROR,
                    "writer " + name + " has failed, frame " + index + " refused");
        LinkedBlockingDeque<PendingWrite> q = queue;
        if (q == null)
            throw new SequenceWriteException(SequenceWriteException.Kind.WRITE_ERROR,
                    "writer " + name + " is not running, frame " + index + " refused");
        PendingWrite task;
        try {
            task = new PendingWrite(frame, index);
        } catch (OutOfMemoryError e) {
            throw new SequenceWriteException(SequenceWriteException.Kind.ALLOCATION_FAILURE,
                    "cannot allocate write request for frame " + index, e);
        }
        q.addLast(task);
    }

    /**
     * Stops the writer and waits for its thread. When aborting, the stop
     * request overtakes everything still queued; otherwise the queue is
     * written first. Requests left unwritten are dropped and their memory
     * freed, see {@link #discardedTasks()}.
     */
    public synchronized WriteStatus stop(boolean aborting) throws InterruptedException {
        Thread t = thread;
        if (t == null)
            return status;
        LinkedBlockingDeque<PendingWrite> q = queue;
        if (aborting)
            q.addFirst(PendingWrite.ABORT);
        else
            q.addLast(PendingWrite.ABORT);
        log.debug("writer {} notified, waiting for exit...", name);
        t.join();
        thread = null;
        queue = null;

        // appended after the writer thread emptied its queue
        List<PendingWrite> late = new ArrayList<>();
        for (PendingWrite p : q) {
            if (p != PendingWrite.ABORT)
                late.add(p);
        }
        if (!late.isEmpty()) {
            log.warn("writer {}: {} image(s) queued after the end of writing, discarded", name, late.size());
            late.sort(Comparator.comparingInt(p -> p.index));
            for (PendingWrite p : late)
                freeData(p.index);
            discardedTasks += late.size();
        }
        log.debug("writer {} joined (status: {})", name, status);
        return status;
    }

    private void writeWorker() {
        WriteStatus retval = WriteStatus.OK;
        boolean countKnown = frameCount > 0;
        int currentIndex = 0;
        TreeMap<Integer, PendingWrite> waiting = new TreeMap<>();
        PendingWrite rejected = null;

        do {
            PendingWrite task = waiting.remove(currentIndex);
            if (task != null)
                log.debug("writer: image {} obtained from waiting list", currentIndex);

            while (task == null) {
                log.debug("writer: waiting for message {}", currentIndex);
                PendingWrite received;
                try {
                    received = queue.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    received = PendingWrite.ABORT;
                }
                if (received == PendingWrite.ABORT) {
                    log.debug("writer: abort message");
                    retval = WriteStatus.INCOMPLETE;
                    break;
                }
                if (received.index < currentIndex || waiting.containsKey(received.index)) {
                    if (received.index < currentIndex)
                        log.error("Invalid image index {} requested for write while expecting {}, aborting file creation",
                                received.index, currentIndex);
                    else
                        log.error("Image index {} requested twice for write, aborting file creation", received.index);
                    // its index is already written or waiting, only the slot is extra
                    context.releaseMemory();
                    retval = WriteStatus.WRITE_ERROR;
                    break;
                }
                if (!received.isHole() && !accepts(received.frame)) {
                    retval = WriteStatus.WRITE_ERROR;
                    rejected = received;
                    break;
                }
                if (received.index > currentIndex) {
                    waiting.put(received.index, received);
                    log.debug("writer: image {} stored for later use", received.index);
                } else {
                    log.debug("writer: image {} received", received.index);
                    task = received;
                }
            }
            if (retval != WriteStatus.OK)
                break;

            if (task.isHole()) {
                log.debug("writer: skipping image {}", task.index);
                currentIndex++;
                frameCount--;
                if (!freeData(task.index)) {
                    retval = WriteStatus.WRITE_ERROR;
                    break;
                }
                continue;
            }

            Frame frame = task.frame;
            log.info("writer: Saving image {}, {} layer(s), {}x{} pixels, {} bits",
                    task.index, frame.channels(), frame.width, frame.height, Math.abs(frame.bitpix));
            try {
                writeHook.write(this, frame, framesWritten);
            } catch (Exception e) {
                log.error("writer {}: failed to save image {}", name, task.index, e);
                retval = WriteStatus.WRITE_ERROR;
                rejected = task;
                break;
            }
            framesWritten++;
            currentIndex++;
            if (!freeData(task.index)) {
                retval = WriteStatus.WRITE_ERROR;
                break;
            }
        } while (retval == WriteStatus.OK && (!countKnown || framesWritten < frameCount));

        if (retval == WriteStatus.WRITE_ERROR) {
            failed.set(true);
            log.debug("writer {}: write error, aborting", name);
        }
        if (retval == WriteStatus.INCOMPLETE) {
            if (!waiting.isEmpty()) {
                log.error("Incomplete file creation: {} file(s) remained to be written", waiting.size());
                if (!countKnown)
                    frameCount = framesWritten;
            } else if (!countKnown) {
                frameCount = framesWritten;
                retval = WriteStatus.OK;
            } else {
                log.debug("writer: write aborted, expected {} images, got {}", frameCount, framesWritten);
            }
        }
        if (retval == WriteStatus.OK)
            log.info("Saved {} image(s) in the sequence", framesWritten);

        discardedTasks = dropUnwritten(rejected, waiting, currentIndex);
        log.debug("writer exits with status {}", retval);
        status = retval;
        if (retval != WriteStatus.OK)
            failed.set(true);
    }

    /*
     * Frees the memory of the requests that will not be written, the rejected
     * one included. Each index is notified once and in ascending order, so
     * with several outputs a source frame is freed by the last output only.
     */
    private int dropUnwritten(PendingWrite rejected, TreeMap<Integer, PendingWrite> waiting, int currentIndex) {
        TreeMap<Integer, PendingWrite> unwritten = new TreeMap<>(waiting);
        List<PendingWrite> queued = new ArrayList<>();
        if (rejected != null)
            queued.add(rejected);
        queue.drainTo(queued);
        for (PendingWrite p : queued) {
            if (p == PendingWrite.ABORT)
                continue;
            if (p.index < currentIndex || unwritten.putIfAbsent(p.index, p) != null)
                context.releaseMemory();
        }
        for (int index : unwritten.keySet())
            freeData(index);
        if (!unwritten.isEmpty())
            log.debug("writer {}: {} image(s) dropped without being written", name, unwritten.size());
        return unwritten.size();
    }

    // false if the registry refused the notification; the slot is released directly then
    private boolean freeData(int index) {
        try {
            context.notifyDataFreed(this, index);
            return true;
        } catch (RuntimeException e) {
            log.error("writer {}: cannot account for the memory of image {}", name, index, e);
            context.releaseMemory();
            return false;
        }
    }

    private boolean accepts(Frame frame) {
        FrameFormat incoming;
        try {
            incoming = frame.format();
        } catch (RuntimeException e) {
            log.error("writer {}: image with unusable properties: {}", name, e.getMessage());
            return false;
        }
        FrameFormat current = format;
        if (current == null) {
            format = incoming;
            return true;
        }
        boolean compatible = incoming.sameSampleLayout(current)
                && (!outputType.requiresFixedGeometry(heterogeneousAllowed) || incoming.sameGeometry(current));
        if (!compatible)
            log.error("Cannot add an image with different properties ({}) to an existing sequence ({})",
                    incoming, current);
        return compatible;
    }

    public String name() { return name; }

    public OutputType outputType() { return outputType; }

    public FrameFormat format() { return format; }

    public int framesWritten() { return framesWritten; }

    // declared count less the holes, the written count once an unknown count is settled
    public int frameCount() { return frameCount; }

    public WriteStatus status() { return status; }

    public boolean hasFailed() { return failed.get(); }

    // requests dropped without being written
    public int discardedTasks() { return discardedTasks; }
}

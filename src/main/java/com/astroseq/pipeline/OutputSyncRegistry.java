package com.astroseq.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Latest frame index written by each output of a processing that produces
 * several sequences from one source. The memory slot of a source frame is
 * only given back once every output has saved its version of the frame.
 */
public class OutputSyncRegistry {

    private static final Logger log = LoggerFactory.getLogger(OutputSyncRegistry.class);

    private static class OutputSlot {
        Object output;
        int index = -1;
    }

    private OutputSlot[] slots = new OutputSlot[0];

    // one output, or less, disables tracking
    public synchronized void setNumberOfOutputs(int numberOfOutputs) {
        log.debug("number of outputs: {}", numberOfOutputs);
        if (numberOfOutputs > 1) {
            slots = new OutputSlot[numberOfOutputs];
            for (int i = 0; i < numberOfOutputs; i++)
                slots[i] = new OutputSlot();
        } else {
            slots = new OutputSlot[0];
        }
    }

    public synchronized boolean isTracking() {
        return slots.length > 1;
    }

    public synchronized int numberOfOutputs() {
        return Math.max(1, slots.length);
    }

    public synchronized int registerOrFind(Object output) {
        for (int i = 0; i < slots.length; i++) {
            if (slots[i].output == null) {
                slots[i].output = output;
                slots[i].index = -1;
                return i;
            }
            if (slots[i].output == output)
                return i;
        }
        throw new IllegalStateException("more outputs than the " + slots.length + " declared");
    }

    /**
     * Records that {@code output} has written (or skipped) frame {@code index}.
     *
     * @return true when all outputs have reached {@code index}, so the source
     *         frame's memory slot can be released
     */
    public synchronized boolean recordProgress(Object output, int index) {
        OutputSlot slot = slots[registerOrFind(output)];
        if (slot.index + 1 != index) {
            log.warn("inconsistent index in memory management ({} for expected {})", index, slot.index + 1);
        }
        slot.index = index;
        for (OutputSlot s : slots) {
            if (s.output == null || s.index < index)
                return false;
        }
        log.debug("all outputs notified for index {}", index);
        return true;
    }

    public synchronized int progressOf(Object output) {
        for (OutputSlot s : slots) {
            if (s.output == output)
                return s.index;
        }
        return -1;
    }
}

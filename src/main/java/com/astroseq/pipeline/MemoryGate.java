package com.astroseq.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting gate bounding how many frame buffers may be allocated and waiting
 * for the writer at the same time.
 *
 * Writing is queued to a single thread, so a worker that finished a frame is
 * ready to allocate the next one before the previous result has been saved.
 * Producers call {@link #waitForMemory()} before loading the image they will
 * hand to the writer; the slot comes back when the writer has saved (or
 * skipped) it, or through {@link #releaseMemory()} when the frame never
 * reaches the writer.
 */
public class MemoryGate {

    private static final Logger log = LoggerFactory.getLogger(MemoryGate.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotFreed = lock.newCondition();

    private int activeBlocks;
    private int maxActiveBlocks;

    // <= 0 is unlimited; raising wakes one producer per added slot, lowering evicts nothing
    public void setMaxActiveBlocks(int max) {
        log.info("Number of images allowed in the write queue: {} (zero or less is unlimited)", max);
        lock.lock();
        try {
            int previous = maxActiveBlocks;
            maxActiveBlocks = max;
            if (previous > 0 && max <= 0) {
                slotFreed.signalAll();
            } else if (previous > 0 && max > previous) {
                for (int i = 0; i < max - previous; i++)
                    slotFreed.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    public void waitForMemory() throws InterruptedException {
        lock.lock();
        try {
            while (maxActiveBlocks > 0 && activeBlocks >= maxActiveBlocks) {
                log.debug("waiting for free memory slot ({} active)", activeBlocks);
                slotFreed.await();
            }
            activeBlocks++;
        } finally {
            lock.unlock();
        }
    }

    public void releaseMemory() {
        lock.lock();
        try {
            if (activeBlocks == 0) {
                log.warn("memory slot released while none is active");
                return;
            }
            activeBlocks--;
            slotFreed.signal();
        } finally {
            lock.unlock();
        }
    }

    public int activeCount() {
        lock.lock();
        try {
            return activeBlocks;
        } finally {
            lock.unlock();
        }
    }

    public int maxActiveBlocks() {
        lock.lock();
        try {
            return maxActiveBlocks;
        } finally {
            lock.unlock();
        }
    }

    public int waitingProducers() {
        lock.lock();
        try {
            return lock.getWaitQueueLength(slotFreed);
        } finally {
            lock.unlock();
        }
    }
}

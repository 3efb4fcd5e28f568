package com.astroseq.pipeline;

/**
 * State shared by the workers and writers of one sequence operation. Created
 * when the operation starts and dropped when it ends, so several operations
 * can run side by side.
 */
public class SequenceRunContext {

    private final MemoryGate memoryGate = new MemoryGate();
    private final OutputSyncRegistry outputs = new OutputSyncRegistry();

    public MemoryGate memoryGate() { return memoryGate; }

    public OutputSyncRegistry outputs() { return outputs; }

    // with several outputs, the slot is freed when the slowest one gets there
    public void notifyDataFreed(Object writer, int index) {
        if (outputs.isTracking() && !outputs.recordProgress(writer, index))
            return;
        memoryGate.releaseMemory();
    }

    public void releaseMemory() {
        memoryGate.releaseMemory();
    }
}

package com.astroseq.model;

public class SequenceResult {
    public final boolean success;
    public final WriteStatus writeStatus;  // OK when the run had no output
    public final int selectedFrames;       // frames the run was asked to process
    public final int failedFrames;         // frames whose processing failed
    public final int[] writtenFrames;      // frames actually written, per output
    public final long elapsedMillis;
    public final String message;

    public SequenceResult(boolean success, WriteStatus writeStatus, int selectedFrames, int failedFrames,
                          int[] writtenFrames, long elapsedMillis, String message) {
        this.success = success;
        this.writeStatus = writeStatus;
        this.selectedFrames = selectedFrames;
        this.failedFrames = failedFrames;
        this.writtenFrames = writtenFrames;
        this.elapsedMillis = elapsedMillis;
        this.message = message;
    }

    // run stopped before any writer was started
    public static SequenceResult refused(int selectedFrames, String message) {
        return new SequenceResult(false, WriteStatus.OK, selectedFrames, 0, new int[0], 0, message);
    }

    public int framesWritten() {
        return writtenFrames.length == 0 ? 0 : writtenFrames[0];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(success ? "OK" : "FAILED").append(" (").append(writeStatus).append(")");
        sb.append(", selected ").append(selectedFrames);
        for (int i = 0; i < writtenFrames.length; i++)
            sb.append(", output ").append(i + 1).append(" wrote ").append(writtenFrames[i]);
        if (failedFrames > 0) sb.append(", ").append(failedFrames).append(" failed");
        if (message != null) sb.append(": ").append(message);
        return sb.toString();
    }
}

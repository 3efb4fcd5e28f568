package com.astroseq.pipeline;

/**
 * Refusal of a write request. Producers getting one must stop submitting.
 */
public class SequenceWriteException extends Exception {

    public enum Kind {
        /** The writer has failed or ended, nothing more is accepted. */
        WRITE_ERROR,
        /** The request could not be allocated; the writer itself keeps going. */
        ALLOCATION_FAILURE
    }

    private final Kind kind;

    public SequenceWriteException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SequenceWriteException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

package com.astroseq.model;

public enum WriteStatus {
    OK,
    /** Fatal: format mismatch, index behind the writer, or a failed write. */
    WRITE_ERROR,
    /** Aborted, or fewer frames than declared. */
    INCOMPLETE
}

package com.astroseq.pipeline;

/** Receives progress of a running operation; fraction goes from 0 to 1. */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (text, fraction) -> { };

    void update(String text, double fraction);
}

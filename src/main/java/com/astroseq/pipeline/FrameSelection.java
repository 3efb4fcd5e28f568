package com.astroseq.pipeline;

@FunctionalInterface
public interface FrameSelection {

    FrameSelection ALL = index -> true;

    boolean isIncluded(int index);
}

package com.astroseq.pipeline;

@FunctionalInterface
public interface PrepareHook {
    void prepare(SequenceArgs args) throws Exception;
}

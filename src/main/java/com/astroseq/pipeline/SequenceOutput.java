package com.astroseq.pipeline;

import com.astroseq.model.OutputType;

/** One output sequence of an operation and the hook that saves its frames. */
public class SequenceOutput {
    public final String name;
    public final OutputType type;
    public final WriteImageHook writeHook;

    public SequenceOutput(String name, OutputType type, WriteImageHook writeHook) {
        this.name = name;
        this.type = type;
        this.writeHook = writeHook;
    }
}

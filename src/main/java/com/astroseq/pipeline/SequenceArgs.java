package com.astroseq.pipeline;

import com.astroseq.model.AppConfig;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything a {@link GenericSequenceWorker} needs to run an operation on a
 * sequence: the input, which frames to use, the per-frame work, the outputs
 * and how to behave on failure.
 */
public class SequenceArgs {

    public final FrameSource source;
    public FrameSelection selection = FrameSelection.ALL;

    public ImageHook imageHook;
    public SplitImageHook splitHook;          // instead of imageHook, for several outputs
    public MemoryLimitsHook memLimitsHook;    // null: maxThreads threads, no admission limit
    public PrepareHook prepareHook;
    public FinalizeHook finalizeHook;

    public final List<SequenceOutput> outputs = new ArrayList<>();
    public boolean heterogeneousAllowed;

    public boolean stopOnError = true;
    public boolean parallel = true;
    public int maxThreads;
    public double memoryFactor = 1.0;         // memory needed per frame, in frames of the input format
    public Rectangle area;
    public String description = "Sequence processing";
    public ProgressListener progress = ProgressListener.NONE;
    public Object user;                       // operation specific data, for the hooks

    public SequenceArgs(FrameSource source) {
        this.source = source;
    }

    public static SequenceArgs createDefault(FrameSource source) {
        SequenceArgs args = new SequenceArgs(source);
        args.maxThreads = AppConfig.getMaxThreads();
        args.heterogeneousAllowed = AppConfig.isHeterogeneousFitseqAllowed();
        args.memLimitsHook = MemoryLimits.defaultHook();
        return args;
    }

    public boolean hasOutput() {
        return !outputs.isEmpty();
    }

    public SequenceArgs addOutput(SequenceOutput output) {
        outputs.add(output);
        return this;
    }
}

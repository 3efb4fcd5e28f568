package com.astroseq.pipeline;

import com.astroseq.model.AppConfig;
import com.astroseq.model.FrameFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates how many frames of a sequence fit in memory, to size the worker
 * pool and the number of frames admitted to the write queue.
 */
public final class MemoryLimits {

    private static final Logger log = LoggerFactory.getLogger(MemoryLimits.class);

    public static final long BYTES_IN_A_MB = 1024L * 1024L;

    private MemoryLimits() {
    }

    // free heap scaled by the memory ratio preference
    public static long availableMb() {
        Runtime rt = Runtime.getRuntime();
        long used = rt.totalMemory() - rt.freeMemory();
        long free = rt.maxMemory() - used;
        return (long) (free * AppConfig.getMemoryRatio()) / BYTES_IN_A_MB;
    }

    public static long imageSizeMb(FrameFormat format) {
        long mb = (format.loadedSize() + BYTES_IN_A_MB - 1) / BYTES_IN_A_MB;
        return Math.max(1, mb);
    }

    /**
     * @param factor      memory used while processing one frame, in frames
     * @param queueFactor cap of the writer limit in multiples of the thread
     *                    limit, zero or less for no cap
     * @return the number of threads, or with {@code forWriter} the number of
     *         frames processed or waiting to be written; 0 if not even one fits
     */
    public static int compute(FrameFormat format, double factor, long availableMb, int maxThreads,
                              int queueFactor, boolean forWriter) {
        long perImage = imageSizeMb(format);
        long required = Math.max(perImage, (long) Math.ceil(perImage * factor));
        long threads = Math.min(availableMb / required, Math.max(1, maxThreads));
        if (threads <= 0)
            return 0;
        if (!forWriter)
            return (int) threads;

        // the images held by the threads, plus what fits in what they leave unused
        long limit = threads + (availableMb - required * threads) / perImage;
        if (queueFactor > 0)
            limit = Math.min(limit, (long) Math.max(1, maxThreads) * queueFactor);
        return (int) Math.max(threads, limit);
    }

    public static MemoryLimitsHook defaultHook() {
        return (args, forWriter) -> {
            FrameFormat format = args.source.format();
            long available = availableMb();
            int limit = compute(format, args.memoryFactor, available, args.maxThreads,
                    AppConfig.getWriterQueueFactor(), forWriter);
            if (limit == 0) {
                log.error("{}: not enough memory to do this operation ({} MB required per image, {} MB considered available)",
                        args.description, (long) Math.ceil(imageSizeMb(format) * args.memoryFactor), available);
            } else {
                log.debug("Memory required per image: {} MB, limiting to {} {}",
                        imageSizeMb(format), limit, forWriter ? "images" : "threads");
            }
            return limit;
        };
    }
}

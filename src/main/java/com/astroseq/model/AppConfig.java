package com.astroseq.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_MAX_THREADS = "max_threads";
    private static final String KEY_MEMORY_RATIO = "memory_ratio";
    private static final String KEY_HETEROGENEOUS_FITSEQ = "allow_heterogeneous_fitseq";
    private static final String KEY_QUEUE_FACTOR = "writer_queue_factor";
    private static final String KEY_OUTPUT_PREFIX = "output_prefix";

    // --- THREADS ---
    public static int getMaxThreads() {
        return prefs.getInt(KEY_MAX_THREADS, Runtime.getRuntime().availableProcessors());
    }
    public static void setMaxThreads(int v) { prefs.putInt(KEY_MAX_THREADS, v); }

    // --- MEMORY ---
    // Share of the free heap a sequence operation may count on
    public static double getMemoryRatio() { return prefs.getDouble(KEY_MEMORY_RATIO, 0.9); }
    public static void setMemoryRatio(double v) { prefs.putDouble(KEY_MEMORY_RATIO, v); }

    // Cap of frames admitted to the write queue, in multiples of the thread count
    public static int getWriterQueueFactor() { return prefs.getInt(KEY_QUEUE_FACTOR, 3); }
    public static void setWriterQueueFactor(int v) { prefs.putInt(KEY_QUEUE_FACTOR, v); }

    // --- OUTPUT ---
    public static boolean isHeterogeneousFitseqAllowed() { return prefs.getBoolean(KEY_HETEROGENEOUS_FITSEQ, false); }
    public static void setHeterogeneousFitseqAllowed(boolean v) { prefs.putBoolean(KEY_HETEROGENEOUS_FITSEQ, v); }

    public static String getOutputPrefix() { return prefs.get(KEY_OUTPUT_PREFIX, "r_"); }
    public static void setOutputPrefix(String v) { prefs.put(KEY_OUTPUT_PREFIX, v); }
}

package com.astroseq.service;

import com.astroseq.model.Frame;
import com.astroseq.pipeline.SequenceWriter;
import com.astroseq.pipeline.WriteImageHook;
import java.io.File;
import java.io.IOException;
import java.util.Locale;

/**
 * Saves the frames of an output sequence as numbered FITS files. Numbers
 * follow the write position, so the result has no gap where the input
 * produced holes.
 */
public class FitsSequenceWriteHook implements WriteImageHook {

    private final FitsFrameService fitsService = new FitsFrameService();
    private final File directory;
    private final String prefix;
    private final String history;

    public FitsSequenceWriteHook(File directory, String prefix, String history) {
        this.directory = directory;
        this.prefix = prefix;
        this.history = history;
    }

    @Override
    public void write(SequenceWriter writer, Frame frame, int position) throws Exception {
        if (!directory.isDirectory() && !directory.mkdirs())
            throw new IOException("cannot create " + directory);
        fitsService.write(frame, fileFor(position), history);
    }

    public File fileFor(int position) {
        return new File(directory, String.format(Locale.US, "%s%05d.fit", prefix, position + 1));
    }
}

package com.astroseq.service;

import com.astroseq.model.Frame;
import com.astroseq.model.FrameFormat;
import com.astroseq.pipeline.FrameSource;
import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;

/**
 * Sequence made of the FITS files of a directory, in file name order.
 */
public class FitsDirectorySource implements FrameSource {

    private final FitsFrameService fitsService = new FitsFrameService();
    private final File[] files;
    private FrameFormat format;

    public FitsDirectorySource(File directory) throws IOException {
        File[] found = directory.listFiles((d, name) -> {
            String n = name.toLowerCase(Locale.ROOT);
            return n.endsWith(".fit") || n.endsWith(".fits") || n.endsWith(".fts");
        });
        if (found == null) throw new IOException("cannot list " + directory);
        Arrays.sort(found);
        this.files = found;
    }

    @Override
    public int frameCount() {
        return files.length;
    }

    @Override
    public synchronized FrameFormat format() {
        if (format == null) {
            if (files.length == 0) throw new IllegalStateException("empty sequence");
            try {
                format = fitsService.read(files[0]).format();
            } catch (Exception e) {
                throw new IllegalStateException("cannot read " + files[0].getName(), e);
            }
        }
        return format;
    }

    @Override
    public Frame read(int index) throws Exception {
        return fitsService.read(files[index]);
    }

    @Override
    public String frameName(int index) {
        return files[index].getName();
    }
}

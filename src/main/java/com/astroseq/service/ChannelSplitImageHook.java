package com.astroseq.service;

import com.astroseq.model.Frame;
import com.astroseq.pipeline.SequenceArgs;
import com.astroseq.pipeline.SplitImageHook;
import ij.process.Blitter;
import ij.process.FloatProcessor;
import java.awt.Rectangle;

/**
 * Splits colour frames taken with a dual-band filter into two sequences:
 * the first channel (H-alpha) and the average of the other two (OIII).
 */
public class ChannelSplitImageHook implements SplitImageHook {

    @Override
    public Frame[] process(SequenceArgs args, int outIndex, int inIndex, Frame frame, Rectangle area, int threads) {
        if (frame.channels() != 3)
            throw new IllegalArgumentException("image " + inIndex + " has " + frame.channels() + " channel(s), 3 are needed");

        Frame ha = new Frame(frame.width, frame.height, frame.bitpix, new float[][] { frame.planes[0] });

        FloatProcessor green = new FloatProcessor(frame.width, frame.height, frame.planes[1]);
        FloatProcessor blue = new FloatProcessor(frame.width, frame.height, frame.planes[2]);
        green.copyBits(blue, 0, 0, Blitter.AVERAGE);
        Frame oiii = new Frame(frame.width, frame.height, frame.bitpix, new float[][] { (float[]) green.getPixels() });

        return new Frame[] { ha, oiii };
    }
}

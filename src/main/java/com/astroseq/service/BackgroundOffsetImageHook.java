package com.astroseq.service;

import com.astroseq.model.Frame;
import com.astroseq.pipeline.ImageHook;
import com.astroseq.pipeline.SequenceArgs;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import java.awt.Rectangle;

/**
 * Removes the sky background level of each channel: the mode of the
 * histogram (the mean when the mode is zero) is brought to
 * {@code targetLevel}. Statistics are taken on the selection when there is one.
 */
public class BackgroundOffsetImageHook implements ImageHook {

    // ImageJ works on a float copy of each channel
    public static final double MEMORY_FACTOR = 2.0;

    private final double targetLevel;

    public BackgroundOffsetImageHook(double targetLevel) {
        this.targetLevel = targetLevel;
    }

    @Override
    public Frame process(SequenceArgs args, int outIndex, int inIndex, Frame frame, Rectangle area, int threads) {
        float max = frame.maxValue();
        for (int c = 0; c < frame.channels(); c++) {
            FloatProcessor ip = new FloatProcessor(frame.width, frame.height, frame.planes[c].clone());
            if (area != null) ip.setRoi(area);
            double sky = skyLevel(ip.getStatistics());

            float offset = (float) (targetLevel - sky);
            float[] px = frame.planes[c];
            for (int i = 0; i < px.length; i++) {
                float v = px[i] + offset;
                if (v < 0) v = 0;
                if (v > max) v = max;
                px[i] = v;
            }
        }
        return frame;
    }

    static double skyLevel(ImageStatistics stats) {
        double skyLevel = stats.dmode;
        if (skyLevel == 0) skyLevel = stats.mean;
        return skyLevel;
    }
}

package com.astroseq.service;

import com.astroseq.model.Frame;
import com.astroseq.pipeline.ImageHook;
import com.astroseq.pipeline.SequenceArgs;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import java.awt.Rectangle;

/**
 * Resizes every frame by a constant factor with bilinear interpolation, for
 * stacking on a finer grid.
 */
public class UpscaleImageHook implements ImageHook {

    private final double factor;

    public UpscaleImageHook(double factor) {
        if (factor <= 0) throw new IllegalArgumentException("scale factor must be positive: " + factor);
        this.factor = factor;
    }

    /** Input frame plus the resized one, in input frames. */
    public double memoryFactor() {
        return 1.0 + factor * factor;
    }

    @Override
    public Frame process(SequenceArgs args, int outIndex, int inIndex, Frame frame, Rectangle area, int threads) {
        int newWidth = (int) Math.round(frame.width * factor);
        int newHeight = (int) Math.round(frame.height * factor);
        float max = frame.maxValue();

        float[][] planes = new float[frame.channels()][];
        for (int c = 0; c < frame.channels(); c++) {
            FloatProcessor ip = new FloatProcessor(frame.width, frame.height, frame.planes[c]);
            ip.setInterpolationMethod(ImageProcessor.BILINEAR);
            float[] px = (float[]) ip.resize(newWidth, newHeight).getPixels();
            for (int i = 0; i < px.length; i++) {
                if (px[i] < 0) px[i] = 0;
                else if (px[i] > max) px[i] = max;
            }
            planes[c] = px;
        }
        return new Frame(newWidth, newHeight, frame.bitpix, planes);
    }
}

package com.astroseq.model;

/**
 * One image of a sequence, held as one float plane per channel (row-major).
 * Values keep the range of the original bit depth (0..65535 for 16 bits,
 * 0..255 for 8 bits, normally 0..1 for float data).
 */
public class Frame {
    public final int width;
    public final int height;
    public final int bitpix;
    public final float[][] planes;

    public Frame(int width, int height, int bitpix, float[][] planes) {
        if (bitpix != 8 && bitpix != 16 && bitpix != -32)
            throw new IllegalArgumentException("unsupported BITPIX " + bitpix);
        if (width < 1 || height < 1)
            throw new IllegalArgumentException("invalid geometry " + width + "x" + height);
        if (planes == null || planes.length == 0)
            throw new IllegalArgumentException("a frame needs at least one channel");
        for (float[] p : planes) {
            if (p == null || p.length != width * height)
                throw new IllegalArgumentException("channel size does not match " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.bitpix = bitpix;
        this.planes = planes;
    }

    public static Frame blank(int width, int height, int channels, int bitpix) {
        float[][] planes = new float[channels][width * height];
        return new Frame(width, height, bitpix, planes);
    }

    public int channels() { return planes.length; }

    public FrameFormat format() {
        return new FrameFormat(planes.length, bitpix, width, height);
    }

    public float get(int channel, int x, int y) {
        return planes[channel][y * width + x];
    }

    public void set(int channel, int x, int y, float v) {
        planes[channel][y * width + x] = v;
    }

    // Upper bound of a sample for integer depths
    public float maxValue() {
        if (bitpix == 8) return 255f;
        if (bitpix == 16) return 65535f;
        return Float.MAX_VALUE;
    }
}

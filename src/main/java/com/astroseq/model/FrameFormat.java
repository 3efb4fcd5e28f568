package com.astroseq.model;

import java.util.Objects;

/**
 * Sample layout and geometry shared by the frames of one written sequence.
 * Bit depth follows the FITS BITPIX convention: 8, 16 or -32.
 */
public class FrameFormat {
    public final int channels;
    public final int bitpix;
    public final int width;
    public final int height;

    public FrameFormat(int channels, int bitpix, int width, int height) {
        if (channels < 1) throw new IllegalArgumentException("channels must be >= 1, got " + channels);
        if (bitpix != 8 && bitpix != 16 && bitpix != -32)
            throw new IllegalArgumentException("unsupported BITPIX " + bitpix);
        if (width < 1 || height < 1)
            throw new IllegalArgumentException("invalid geometry " + width + "x" + height);
        this.channels = channels;
        this.bitpix = bitpix;
        this.width = width;
        this.height = height;
    }

    /** Same channel count and bit depth. */
    public boolean sameSampleLayout(FrameFormat other) {
        return other != null && channels == other.channels && bitpix == other.bitpix;
    }

    public boolean sameGeometry(FrameFormat other) {
        return other != null && width == other.width && height == other.height;
    }

    public int bytesPerSample() {
        return Math.abs(bitpix) / 8;
    }

    /** Size of one frame of this format as stored, in bytes. */
    public long storedSize() {
        return (long) width * height * channels * bytesPerSample();
    }

    /** Size of one frame of this format once loaded as float planes, in bytes. */
    public long loadedSize() {
        return (long) width * height * channels * Float.BYTES;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameFormat)) return false;
        FrameFormat f = (FrameFormat) o;
        return sameSampleLayout(f) && sameGeometry(f);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channels, bitpix, width, height);
    }

    @Override
    public String toString() {
        return String.format("%dx%d, %d layer(s), %d bits", width, height, channels, Math.abs(bitpix));
    }
}

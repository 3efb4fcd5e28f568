package com.astroseq.service;

import com.astroseq.model.Frame;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import java.io.File;
import java.io.IOException;

/**
 * Loads and saves single frames as FITS primary images. Integer data is
 * returned with BSCALE/BZERO applied, so 16-bit frames hold 0..65535.
 */
public class FitsFrameService {

    private static final double USHORT_ZERO = 32768.0;

    public Frame read(File f) throws IOException, FitsException {
        try (Fits fits = new Fits(f)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) throw new FitsException("no image in " + f.getName());
            Header header = hdu.getHeader();
            double bscale = header.getDoubleValue("BSCALE", 1.0);
            double bzero = header.getDoubleValue("BZERO", 0.0);
            int bitpix = header.getIntValue("BITPIX", 16);
            Object kernel = hdu.getKernel();

            // 3D kernels are [channel][y][x]
            Object[] planes;
            if (kernel instanceof Object[] && ((Object[]) kernel).length > 0 && ((Object[]) kernel)[0] instanceof Object[]) {
                planes = (Object[]) kernel;
            } else {
                planes = new Object[] { kernel };
            }

            int height = ((Object[]) planes[0]).length;
            int width = rowLength(((Object[]) planes[0])[0]);
            float[][] px = new float[planes.length][];
            for (int c = 0; c < planes.length; c++)
                px[c] = toPlane(planes[c], width, height, bscale, bzero);

            return new Frame(width, height, frameBitpix(bitpix), px);
        }
    }

    public void write(Frame frame, File f, String history) throws IOException, FitsException {
        Object data;
        if (frame.channels() == 1) {
            data = fromPlane(frame.planes[0], frame.width, frame.height, frame.bitpix);
        } else {
            Object[] cube = frame.bitpix == 16 ? new short[frame.channels()][][]
                    : frame.bitpix == 8 ? new byte[frame.channels()][][] : new float[frame.channels()][][];
            for (int c = 0; c < frame.channels(); c++)
                cube[c] = fromPlane(frame.planes[c], frame.width, frame.height, frame.bitpix);
            data = cube;
        }

        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            if (frame.bitpix == 16) {
                hdu.addValue("BZERO", USHORT_ZERO, "offset data range to that of unsigned short");
                hdu.addValue("BSCALE", 1.0, "default scaling factor");
            }
            if (history != null && !history.isEmpty())
                hdu.getHeader().insertHistory(history);
            fits.addHDU(hdu);
            fits.write(f);
        }
    }

    private static int frameBitpix(int fitsBitpix) {
        if (fitsBitpix == 8 || fitsBitpix == 16) return fitsBitpix;
        return -32;
    }

    private static int rowLength(Object row) throws FitsException {
        if (row instanceof short[]) return ((short[]) row).length;
        if (row instanceof float[]) return ((float[]) row).length;
        if (row instanceof byte[]) return ((byte[]) row).length;
        if (row instanceof int[]) return ((int[]) row).length;
        if (row instanceof double[]) return ((double[]) row).length;
        throw new FitsException("unsupported FITS data type " + row.getClass().getSimpleName());
    }

    private static float[] toPlane(Object k, int w, int h, double bscale, double bzero) throws FitsException {
        float[] px = new float[w * h];
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = (float) (s[y][x] * bscale + bzero);
        } else if (k instanceof float[][]) {
            float[][] d = (float[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = (float) (d[y][x] * bscale + bzero);
        } else if (k instanceof byte[][]) {
            byte[][] b = (byte[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = (float) ((b[y][x] & 0xFF) * bscale + bzero);
        } else if (k instanceof int[][]) {
            int[][] i = (int[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = (float) (i[y][x] * bscale + bzero);
        } else if (k instanceof double[][]) {
            double[][] d = (double[][]) k;
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = (float) (d[y][x] * bscale + bzero);
        } else {
            throw new FitsException("unsupported FITS data type " + k.getClass().getSimpleName());
        }
        return px;
    }

    private static Object fromPlane(float[] px, int w, int h, int bitpix) {
        if (bitpix == 16) {
            short[][] s = new short[h][w];
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) s[y][x] = (short) (clamp(px[y * w + x], 65535f) - USHORT_ZERO);
            return s;
        }
        if (bitpix == 8) {
            byte[][] b = new byte[h][w];
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) b[y][x] = (byte) clamp(px[y * w + x], 255f);
            return b;
        }
        float[][] f = new float[h][w];
        for (int y = 0; y < h; y++) System.arraycopy(px, y * w, f[y], 0, w);
        return f;
    }

    private static long clamp(float v, float max) {
        if (v < 0) return 0;
        if (v > max) return (long) max;
        return Math.round(v);
    }
}

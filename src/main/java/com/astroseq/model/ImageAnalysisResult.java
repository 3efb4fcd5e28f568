package com.astroseq.model;

public class ImageAnalysisResult {
    public final int index;            // frame index in the input sequence
    public final int starCount;
    public final double roundness;     // median minor/major axis ratio
    public final double fwhm;          // median, in pixels

    public final double skyBackground; // mode of the background (ADU)
    public final double snr;

    public ImageAnalysisResult(int index, int starCount, double roundness, double fwhm, double skyBackground, double snr) {
        this.index = index;
        this.starCount = starCount;
        this.roundness = roundness;
        this.fwhm = fwhm;
        this.skyBackground = skyBackground;
        this.snr = snr;
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.US, "#%d: %d stars, FWHM %.2f px, roundness %.2f, sky %.1f, SNR %.1f",
                index, starCount, fwhm, roundness, skyBackground, snr);
    }
}

package com.astroseq.service;

import com.astroseq.model.Frame;
import com.astroseq.model.ImageAnalysisResult;
import com.astroseq.pipeline.FrameSelection;
import com.astroseq.pipeline.ImageHook;
import com.astroseq.pipeline.SequenceArgs;
import ij.ImagePlus;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.FloatProcessor;
import ij.process.ImageStatistics;
import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Star detection and quality measurement of the frames of a sequence. Used as
 * the image hook of an operation without output; the results can then
 * select the frames for the next operation.
 */
public class FrameAnalysisService implements ImageHook {

    private static final double GAUSSIAN_CORRECTION_FACTOR = 1.7;
    private static final double DETECTION_SIGMA = 5.0;

    private final Map<Integer, ImageAnalysisResult> results = new ConcurrentHashMap<>();

    @Override
    public Frame process(SequenceArgs args, int outIndex, int inIndex, Frame frame, Rectangle area, int threads) {
        results.put(inIndex, analyze(inIndex, frame, area));
        return frame;
    }

    public ImageAnalysisResult analyze(int index, Frame frame, Rectangle area) {
        // first channel only, enough for quality ranking
        FloatProcessor ip = new FloatProcessor(frame.width, frame.height, frame.planes[0].clone());
        if (area != null) ip.setRoi(area);

        ImageStatistics globalStats = ip.getStatistics();
        double skyLevel = BackgroundOffsetImageHook.skyLevel(globalStats);
        double noise = globalStats.stdDev;

        ip.resetRoi();
        ip.setThreshold(skyLevel + DETECTION_SIGMA * noise, Math.max(globalStats.max, frame.maxValue()), FloatProcessor.NO_LUT_UPDATE);

        int measurements = Measurements.MEAN | Measurements.ELLIPSE | Measurements.AREA;
        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE, measurements, rt, 3, 99999);
        pa.analyze(new ImagePlus("frame " + index, ip));

        int count = rt.getCounter();
        if (count == 0) return new ImageAnalysisResult(index, 0, 0, 0, skyLevel, 0);

        List<Double> fwhmList = new ArrayList<>();
        List<Double> roundnessList = new ArrayList<>();
        double totalSignal = 0;

        for (int i = 0; i < count; i++) {
            double major = rt.getValue("Major", i);
            double minor = rt.getValue("Minor", i);
            double roundness = (major > 0) ? Math.min(1.0, minor / major) : 0.0;

            double flux = rt.getValue("Mean", i) - skyLevel;
            if (flux > 0) totalSignal += flux;

            double blobArea = rt.getValue("Area", i);
            double fwhm = 2 * Math.sqrt(blobArea / Math.PI) / GAUSSIAN_CORRECTION_FACTOR;
            // hot pixels and nebula blobs out
            if (fwhm > 0.8 && fwhm < 20.0 && roundness > 0.4) {
                fwhmList.add(fwhm);
                roundnessList.add(roundness);
            }
        }

        double avgSignal = totalSignal / count;
        double snr = (noise > 0) ? avgSignal / noise : 0;
        return new ImageAnalysisResult(index, count, median(roundnessList), median(fwhmList), skyLevel, snr);
    }

    private static double median(List<Double> values) {
        if (values.isEmpty()) return 0;
        Collections.sort(values);
        int mid = values.size() / 2;
        if (values.size() % 2 == 0) return (values.get(mid - 1) + values.get(mid)) / 2.0;
        return values.get(mid);
    }

    public ImageAnalysisResult result(int index) {
        return results.get(index);
    }

    public Map<Integer, ImageAnalysisResult> results() {
        return Collections.unmodifiableMap(results);
    }

    /** Frames analysed with stars found, a FWHM at most {@code maxFwhm} and a roundness at least {@code minRoundness}. */
    public FrameSelection selection(double maxFwhm, double minRoundness) {
        return index -> {
            ImageAnalysisResult r = results.get(index);
            return r != null && r.starCount > 0 && r.fwhm > 0 && r.fwhm <= maxFwhm && r.roundness >= minRoundness;
        };
    }
}

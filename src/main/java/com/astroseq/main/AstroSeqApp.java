package com.astroseq.main;

import com.astroseq.model.AppConfig;
import com.astroseq.model.ImageAnalysisResult;
import com.astroseq.model.OutputType;
import com.astroseq.model.SequenceResult;
import com.astroseq.pipeline.GenericSequenceWorker;
import com.astroseq.pipeline.SequenceArgs;
import com.astroseq.pipeline.SequenceOutput;
import com.astroseq.service.BackgroundOffsetImageHook;
import com.astroseq.service.ChannelSplitImageHook;
import com.astroseq.service.FitsDirectorySource;
import com.astroseq.service.FitsSequenceWriteHook;
import com.astroseq.service.FrameAnalysisService;
import com.astroseq.service.UpscaleImageHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.File;

public class AstroSeqApp {

    private static final Logger log = LoggerFactory.getLogger(AstroSeqApp.class);

    private static final String USAGE = String.join("\n",
            "usage: AstroSeqApp <operation> <input dir> [output dir] [argument]",
            "  bkg     <in> <out> [level]   remove the sky background, bring it to level (default 0)",
            "  upscale <in> <out> [factor]  resize the frames (default factor 2)",
            "  split   <in> <out>           split dual-band colour frames into Ha and OIII sequences",
            "  analyze <in>                 measure stars and background of each frame");

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println(USAGE);
            System.exit(2);
        }
        SequenceArgs seqArgs;
        try {
            seqArgs = buildArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        SequenceResult result = new GenericSequenceWorker().run(seqArgs);
        if (seqArgs.user instanceof FrameAnalysisService) {
            for (ImageAnalysisResult r : ((FrameAnalysisService) seqArgs.user).results().values())
                System.out.println(r);
        }
        System.out.println(result);
        System.exit(result.success ? 0 : 1);
    }

    static SequenceArgs buildArgs(String[] args) throws Exception {
        String operation = args[0];
        FitsDirectorySource source = new FitsDirectorySource(new File(args[1]));
        SequenceArgs seqArgs = SequenceArgs.createDefault(source);
        seqArgs.progress = (text, fraction) -> log.debug("{} ({}%)", text, Math.round(fraction * 100));

        if (operation.equals("analyze")) {
            FrameAnalysisService analysis = new FrameAnalysisService();
            seqArgs.description = "Image analysis";
            seqArgs.imageHook = analysis;
            seqArgs.stopOnError = false;
            seqArgs.user = analysis;
            return seqArgs;
        }

        if (args.length < 3) throw new IllegalArgumentException("missing output directory");
        File outDir = new File(args[2]);
        String prefix = AppConfig.getOutputPrefix();

        switch (operation) {
            case "bkg": {
                double level = args.length > 3 ? Double.parseDouble(args[3]) : 0.0;
                seqArgs.description = "Background extraction";
                seqArgs.imageHook = new BackgroundOffsetImageHook(level);
                seqArgs.memoryFactor = BackgroundOffsetImageHook.MEMORY_FACTOR;
                seqArgs.stopOnError = false;
                seqArgs.addOutput(new SequenceOutput("bkg", OutputType.FITS_FILES,
                        new FitsSequenceWriteHook(outDir, "bkg_" + prefix, "Background extraction")));
                break;
            }
            case "upscale": {
                double factor = args.length > 3 ? Double.parseDouble(args[3]) : 2.0;
                UpscaleImageHook upscale = new UpscaleImageHook(factor);
                seqArgs.description = "Up-scaling sequence";
                seqArgs.imageHook = upscale;
                seqArgs.memoryFactor = upscale.memoryFactor();
                seqArgs.addOutput(new SequenceOutput("up", OutputType.FITS_FILES,
                        new FitsSequenceWriteHook(outDir, "up_" + prefix, "Up-scaled x" + factor)));
                break;
            }
            case "split": {
                seqArgs.description = "Ha-OIII extraction";
                seqArgs.splitHook = new ChannelSplitImageHook();
                seqArgs.stopOnError = false;
                seqArgs.addOutput(new SequenceOutput("Ha", OutputType.FITS_FILES,
                        new FitsSequenceWriteHook(outDir, "Ha_" + prefix, "Ha extraction")));
                seqArgs.addOutput(new SequenceOutput("OIII", OutputType.FITS_FILES,
                        new FitsSequenceWriteHook(outDir, "OIII_" + prefix, "OIII extraction")));
                break;
            }
            default:
                throw new IllegalArgumentException("unknown operation " + operation);
        }
        return seqArgs;
    }
}

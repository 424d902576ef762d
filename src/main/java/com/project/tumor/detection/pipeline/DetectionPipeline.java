package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.exceptions.DetectionException;
import com.project.tumor.detection.exceptions.ProcessingException;
import com.project.tumor.detection.pipeline.model.IntensityVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs load, preprocessing, segmentation and analysis once per input. The returned
 * {@link PipelineRun} carries the processed slice and mask for rendering, so nothing is computed
 * twice.
 */
@Service
public class DetectionPipeline {
    private static final Logger log = LoggerFactory.getLogger(DetectionPipeline.class);

    private final ImageLoader loader;
    private final Preprocessor preprocessor;
    private final Segmenter segmenter;
    private final Analyzer analyzer;

    public DetectionPipeline(ImageLoader loader, Preprocessor preprocessor, Segmenter segmenter, Analyzer analyzer) {
        this.loader = loader;
        this.preprocessor = preprocessor;
        this.segmenter = segmenter;
        this.analyzer = analyzer;
    }

    /**
     * @throws com.project.tumor.detection.exceptions.DecodeException     if the file cannot be decoded
     * @throws ProcessingException if a processing stage fails
     */
    public PipelineRun run(Path input) {
        IntensityVolume volume = loader.load(input);
        try {
            IntensityVolume processed = preprocessor.process(volume);
            SegmentationOutcome segmentation = segmenter.segment(processed);
            AnalysisReport report = analyzer.analyze(processed, segmentation);
            log.info("Analyzed {}: slice {} of {}, ratio {}, std {}, tumor={}",
                    input.getFileName(), segmentation.sliceIndex(), processed.sliceCount(),
                    String.format("%.4f", report.tumorRatio()), String.format("%.2f", report.stdIntensity()),
                    report.hasTumor());
            return new PipelineRun(processed, segmentation, report);
        } catch (DetectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProcessingException("Processing failed for " + input.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /** Same as {@link #run(Path)} but reports failures as a value instead of throwing. */
    public DetectionOutcome detect(Path input) {
        try {
            return DetectionOutcome.ok(run(input).result());
        } catch (DetectionException e) {
            log.warn("Detection failed for {}: {}", input, e.getMessage());
            return DetectionOutcome.failed(e);
        }
    }
}

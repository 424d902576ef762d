package com.project.tumor.detection.service;

import com.project.tumor.detection.pipeline.AnalysisReport;
import com.project.tumor.detection.pipeline.DetectionPipeline;
import com.project.tumor.detection.pipeline.PipelineRun;
import com.project.tumor.detection.pipeline.VisualizationRenderer;
import com.project.tumor.detection.pipeline.model.DetectionResult;
import com.project.tumor.detection.pipeline.model.VisualizationSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Runs the pipeline once per input and renders its visualizations from the same run.
 */
@Service
public class TumorDetectionService {
    private static final Logger log = LoggerFactory.getLogger(TumorDetectionService.class);

    private final DetectionPipeline pipeline;
    private final VisualizationRenderer renderer;

    public TumorDetectionService(DetectionPipeline pipeline, VisualizationRenderer renderer) {
        this.pipeline = pipeline;
        this.renderer = renderer;
    }

    public record Analysis(DetectionResult result, AnalysisReport report, VisualizationSet visuals) {}

    /**
     * Detection plus the four artifacts under {@code outputDir}.
     *
     * @throws com.project.tumor.detection.exceptions.DetectionException when decoding, processing or
     *         writing an artifact fails
     */
    public Analysis analyze(Path input, Path outputDir, String baseName) {
        long start = System.nanoTime();
        PipelineRun run = pipeline.run(input);
        VisualizationSet visuals = renderer.render(run, outputDir, baseName);
        log.info("Finished {} in {} ms (tumor={})", baseName, (System.nanoTime() - start) / 1_000_000,
                run.report().hasTumor());
        return new Analysis(run.result(), run.report(), visuals);
    }
}

package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.pipeline.model.BinaryMask;
import com.project.tumor.detection.pipeline.model.DetectionResult;
import com.project.tumor.detection.pipeline.model.IntensityVolume;

/**
 * Everything one pass over an input produces. Detection and rendering both read from it.
 */
public record PipelineRun(
        IntensityVolume processed,
        SegmentationOutcome segmentation,
        AnalysisReport report
) {
    public DetectionResult result() {
        return new DetectionResult(report.hasTumor(), processed.shape());
    }

    public int sliceIndex() {
        return segmentation.sliceIndex();
    }

    public BinaryMask mask() {
        return segmentation.mask();
    }

    /** The analysed slice as 8-bit samples. */
    public int[] graySlice() {
        return processed.graySlice(segmentation.sliceIndex());
    }
}

package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.pipeline.model.BinaryMask;
import com.project.tumor.detection.pipeline.model.ConnectedComponent;

import java.util.List;

/**
 * Mask of the slice the segmenter worked on, with the threshold used and the components kept.
 */
public record SegmentationOutcome(
        int sliceIndex,
        BinaryMask mask,
        double threshold,
        List<ConnectedComponent> keptComponents
) {
    public SegmentationOutcome {
        keptComponents = List.copyOf(keptComponents);
    }
}

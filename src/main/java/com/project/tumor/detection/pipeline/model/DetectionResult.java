package com.project.tumor.detection.pipeline.model;

import java.util.List;

public record DetectionResult(boolean hasTumor, List<Integer> imageShape) {
    public DetectionResult {
        imageShape = List.copyOf(imageShape);
    }
}

package com.project.tumor.detection.DTOs;

import java.util.List;

/** What the upload page shows after a successful analysis. */
public record ResultView(
        String originalImage,
        List<String> resultImages,
        boolean hasTumor,
        String tumorRatioPercent,
        String stdIntensity,
        List<Integer> imageShape
) {}

package com.project.tumor.detection.pipeline;

/**
 * Scores behind a detection decision.
 *
 * @param tumorRatio   masked pixels over slice pixels
 * @param stdIntensity population standard deviation of the masked intensities, 0 for an empty mask
 */
public record AnalysisReport(boolean hasTumor, double tumorRatio, double stdIntensity) {}

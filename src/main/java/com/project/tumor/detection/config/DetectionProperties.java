package com.project.tumor.detection.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunable pipeline constants, bound from {@code app.detection.*}.
 * Defaults reproduce the empirically chosen values.
 */
@ConfigurationProperties(prefix = "app.detection")
public class DetectionProperties {

    // Segmentation
    private double percentile = 85.0;
    private double minAreaFraction = 0.001;
    private double maxAreaFraction = 0.05;
    private double centerBandLow = 0.25;
    private double centerBandHigh = 0.80;
    private int openingIterations = 2;
    private double segmentClipLimit = 2.0;

    // Preprocessing
    private double denoiseStrength = 10.0;
    private double preprocessClipLimit = 3.0;
    private int tileGrid = 8;

    // Decision
    private double ratioThreshold = 0.01;
    private double stdThreshold = 20.0;

    public double getPercentile() { return percentile; }
    public void setPercentile(double percentile) { this.percentile = percentile; }

    public double getMinAreaFraction() { return minAreaFraction; }
    public void setMinAreaFraction(double minAreaFraction) { this.minAreaFraction = minAreaFraction; }

    public double getMaxAreaFraction() { return maxAreaFraction; }
    public void setMaxAreaFraction(double maxAreaFraction) { this.maxAreaFraction = maxAreaFraction; }

    public double getCenterBandLow() { return centerBandLow; }
    public void setCenterBandLow(double centerBandLow) { this.centerBandLow = centerBandLow; }

    public double getCenterBandHigh() { return centerBandHigh; }
    public void setCenterBandHigh(double centerBandHigh) { this.centerBandHigh = centerBandHigh; }

    public int getOpeningIterations() { return openingIterations; }
    public void setOpeningIterations(int openingIterations) { this.openingIterations = openingIterations; }

    public double getSegmentClipLimit() { return segmentClipLimit; }
    public void setSegmentClipLimit(double segmentClipLimit) { this.segmentClipLimit = segmentClipLimit; }

    public double getDenoiseStrength() { return denoiseStrength; }
    public void setDenoiseStrength(double denoiseStrength) { this.denoiseStrength = denoiseStrength; }

    public double getPreprocessClipLimit() { return preprocessClipLimit; }
    public void setPreprocessClipLimit(double preprocessClipLimit) { this.preprocessClipLimit = preprocessClipLimit; }

    public int getTileGrid() { return tileGrid; }
    public void setTileGrid(int tileGrid) { this.tileGrid = tileGrid; }

    public double getRatioThreshold() { return ratioThreshold; }
    public void setRatioThreshold(double ratioThreshold) { this.ratioThreshold = ratioThreshold; }

    public double getStdThreshold() { return stdThreshold; }
    public void setStdThreshold(double stdThreshold) { this.stdThreshold = stdThreshold; }
}

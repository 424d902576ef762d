package com.project.tumor.detection.pipeline.model;

/**
 * Labelled foreground region. Centroid is the mean pixel coordinate.
 */
public record ConnectedComponent(int label, int area, double centroidX, double centroidY) {}

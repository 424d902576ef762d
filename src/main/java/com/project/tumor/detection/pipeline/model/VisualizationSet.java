package com.project.tumor.detection.pipeline.model;

import java.nio.file.Path;
import java.util.List;

/**
 * The four rendered artifacts of one run, in display order.
 */
public record VisualizationSet(Path original, Path mask, Path overlay, Path panel) {

    public static final String ORIGINAL_SUFFIX = "_original.png";
    public static final String MASK_SUFFIX = "_mask.png";
    public static final String OVERLAY_SUFFIX = "_overlay.png";
    public static final String PANEL_SUFFIX = "_panel.png";

    public List<Path> all() {
        return List.of(original, mask, overlay, panel);
    }
}

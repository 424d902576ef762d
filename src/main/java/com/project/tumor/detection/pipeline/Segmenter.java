package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.config.DetectionProperties;
import com.project.tumor.detection.exceptions.ProcessingException;
import com.project.tumor.detection.pipeline.imaging.IntensityStatistics;
import com.project.tumor.detection.pipeline.imaging.OpenCvFilters;
import com.project.tumor.detection.pipeline.model.BinaryMask;
import com.project.tumor.detection.pipeline.model.ConnectedComponent;
import com.project.tumor.detection.pipeline.model.IntensityVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the candidate region on the brightest slice of a preprocessed volume.
 * <p>
 * The slice is re-normalized and re-equalized, binarized above a percentile of its own
 * intensities, opened with an elliptical element, and reduced to the 8-connected components
 * whose size and centroid fall inside the configured bounds.
 */
@Component
public class Segmenter {
    private static final Logger log = LoggerFactory.getLogger(Segmenter.class);

    static final int OPENING_KERNEL = 5;

    private final DetectionProperties props;

    public Segmenter(DetectionProperties props) {
        this.props = props;
    }

    public SegmentationOutcome segment(IntensityVolume volume) {
        int w = volume.width();
        int h = volume.height();
        if (w <= 1 || h <= 1) {
            throw new ProcessingException("Image too small to segment: " + w + "x" + h);
        }

        int sliceIndex = selectSlice(volume);
        int[] normalized = OpenCvFilters.normalizeToByteRange(volume.graySlice(sliceIndex), w, h);
        int[] enhanced = OpenCvFilters.clahe(normalized, w, h, props.getSegmentClipLimit(), props.getTileGrid());

        double threshold = IntensityStatistics.percentile(enhanced, props.getPercentile());
        // strictly above the integer cut-off: a flat slice yields no foreground
        boolean[] fg = OpenCvFilters.binarize(enhanced, w, h, threshold);
        log.debug("Slice {}: percentile {} threshold {}", sliceIndex, props.getPercentile(), threshold);

        fg = OpenCvFilters.open(fg, w, h, OPENING_KERNEL, props.getOpeningIterations());

        OpenCvFilters.Labelling labelling = OpenCvFilters.label(fg, w, h);
        List<ConnectedComponent> kept = filterComponents(labelling.components(), w, h);

        Set<Integer> keptLabels = new HashSet<>();
        for (ConnectedComponent c : kept) keptLabels.add(c.label());
        boolean[] mask = new boolean[w * h];
        int[] labels = labelling.labels();
        for (int i = 0; i < labels.length; i++) {
            mask[i] = labels[i] != 0 && keptLabels.contains(labels[i]);
        }

        log.debug("Kept {} of {} components", kept.size(), labelling.components().size());
        return new SegmentationOutcome(sliceIndex, new BinaryMask(w, h, mask), threshold, kept);
    }

    /** Index of the slice with the largest intensity sum; the first one on ties. */
    public int selectSlice(IntensityVolume volume) {
        if (volume.layout() == IntensityVolume.Layout.SINGLE_SLICE) {
            return 0;
        }
        int best = 0;
        double bestSum = volume.sliceSum(0);
        for (int i = 1; i < volume.sliceCount(); i++) {
            double sum = volume.sliceSum(i);
            if (sum > bestSum) {
                bestSum = sum;
                best = i;
            }
        }
        return best;
    }

    /**
     * Keeps components with {@code minArea <= area <= maxArea} whose centroid lies strictly
     * inside the central band on both axes.
     */
    public List<ConnectedComponent> filterComponents(List<ConnectedComponent> components, int w, int h) {
        int total = w * h;
        int minArea = (int) (total * props.getMinAreaFraction());
        int maxArea = (int) (total * props.getMaxAreaFraction());
        double low = props.getCenterBandLow();
        double high = props.getCenterBandHigh();

        List<ConnectedComponent> kept = new ArrayList<>();
        for (ConnectedComponent c : components) {
            boolean sizeOk = c.area() >= minArea && c.area() <= maxArea;
            boolean xOk = c.centroidX() > low * w && c.centroidX() < high * w;
            boolean yOk = c.centroidY() > low * h && c.centroidY() < high * h;
            if (sizeOk && xOk && yOk) {
                kept.add(c);
            } else {
                log.trace("Dropped component {} (area {}, centroid {}, {})",
                        c.label(), c.area(), c.centroidX(), c.centroidY());
            }
        }
        return kept;
    }
}

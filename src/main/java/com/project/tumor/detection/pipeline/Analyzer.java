package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.config.DetectionProperties;
import com.project.tumor.detection.pipeline.model.BinaryMask;
import com.project.tumor.detection.pipeline.model.IntensityVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether the segmented region looks abnormal: it must cover more than
 * {@code ratioThreshold} of the slice and its intensities must vary by more than
 * {@code stdThreshold}.
 * <p>
 * The intensities are read from the same slice the segmenter masked.
 */
@Component
public class Analyzer {
    private static final Logger log = LoggerFactory.getLogger(Analyzer.class);

    private final DetectionProperties props;

    public Analyzer(DetectionProperties props) {
        this.props = props;
    }

    public AnalysisReport analyze(IntensityVolume volume, SegmentationOutcome segmentation) {
        return analyze(volume.slice(segmentation.sliceIndex()), segmentation.mask());
    }

    public AnalysisReport analyze(float[] slice, BinaryMask mask) {
        if (slice.length != mask.width() * mask.height()) {
            throw new IllegalArgumentException("Mask " + mask.width() + "x" + mask.height()
                    + " does not match a slice of " + slice.length + " pixels");
        }
        int count = 0;
        double sum = 0;
        for (int i = 0; i < slice.length; i++) {
            if (mask.isSet(i)) {
                count++;
                sum += slice[i];
            }
        }
        double ratio = (double) count / slice.length;
        double std = 0.0;
        if (count > 0) {
            double mean = sum / count;
            double sq = 0;
            for (int i = 0; i < slice.length; i++) {
                if (mask.isSet(i)) {
                    double d = slice[i] - mean;
                    sq += d * d;
                }
            }
            std = Math.sqrt(sq / count);
        }
        boolean hasTumor = ratio > props.getRatioThreshold() && std > props.getStdThreshold();
        log.debug("Tumor ratio {}, intensity std {} -> {}", ratio, std, hasTumor);
        return new AnalysisReport(hasTumor, ratio, std);
    }
}

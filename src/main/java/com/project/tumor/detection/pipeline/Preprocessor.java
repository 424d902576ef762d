package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.config.DetectionProperties;
import com.project.tumor.detection.pipeline.imaging.OpenCvFilters;
import com.project.tumor.detection.pipeline.model.IntensityVolume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Brings a loaded volume to 8 bits and cleans it up.
 * <ol>
 *   <li>linear min/max rescale over the whole volume,</li>
 *   <li>non-local-means denoising per slice ({@code fastNlMeansDenoising}),</li>
 *   <li>CLAHE per slice.</li>
 * </ol>
 * The order matters: the rescale uses volume-wide statistics, the filters are slice-local.
 */
@Component
public class Preprocessor {
    private static final Logger log = LoggerFactory.getLogger(Preprocessor.class);

    private final DetectionProperties props;

    public Preprocessor(DetectionProperties props) {
        this.props = props;
    }

    public IntensityVolume process(IntensityVolume volume) {
        List<float[]> raw = new ArrayList<>(volume.sliceCount());
        for (int i = 0; i < volume.sliceCount(); i++) {
            raw.add(volume.slice(i));
        }
        int w = volume.width();
        int h = volume.height();
        List<int[]> normalized = OpenCvFilters.normalizeToByteRange(raw, w, h);

        List<int[]> out = new ArrayList<>(normalized.size());
        for (int i = 0; i < normalized.size(); i++) {
            int[] denoised = OpenCvFilters.denoise(normalized.get(i), w, h, props.getDenoiseStrength());
            out.add(OpenCvFilters.clahe(denoised, w, h, props.getPreprocessClipLimit(), props.getTileGrid()));
        }
        log.debug("Preprocessed {} slice(s) of {}x{}", out.size(), w, h);
        return IntensityVolume.ofGraySlices(w, h, out);
    }
}

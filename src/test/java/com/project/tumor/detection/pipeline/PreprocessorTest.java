package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.TestImages;
import com.project.tumor.detection.config.DetectionProperties;
import com.project.tumor.detection.pipeline.model.IntensityVolume;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PreprocessorTest {

    private final Preprocessor preprocessor = new Preprocessor(new DetectionProperties());

    @Test
    void constantSlice_staysConstant() {
        IntensityVolume volume = IntensityVolume.ofGraySlices(64, 64, List.of(TestImages.uniform(64, 64, 128)));

        IntensityVolume out = preprocessor.process(volume);

        int[] px = out.graySlice(0);
        assertThat(px).containsOnly(px[0]);
        assertThat(out.shape()).containsExactly(64, 64);
        assertThat(out.bitDepth()).isEqualTo(8);
    }

    @Test
    void rescale_usesWholeVolume() {
        float[] dark = new float[64 * 64];
        float[] bright = new float[64 * 64];
        java.util.Arrays.fill(bright, 1200f);
        IntensityVolume volume = IntensityVolume.ofSlices(64, 64, 16, List.of(dark, bright));

        IntensityVolume out = preprocessor.process(volume);

        assertThat(out.layout()).isEqualTo(IntensityVolume.Layout.MULTI_SLICE);
        assertThat(out.shape()).containsExactly(64, 64, 2);
        assertThat(out.graySlice(1)).containsOnly(255);
        int darkValue = out.graySlice(0)[0];
        assertThat(out.graySlice(0)).containsOnly(darkValue);
        assertThat(darkValue).isLessThan(255);
    }

    @Test
    void backgroundOfCenteredDisk_becomesFlatFour() {
        IntensityVolume volume = IntensityVolume.ofGraySlices(256, 256, List.of(TestImages.centeredDisk()));

        int[] px = preprocessor.process(volume).graySlice(0);

        assertThat(px[0]).isEqualTo(4);
        assertThat(px[255 * 256 + 255]).isEqualTo(4);
        assertThat(px[128 * 256 + 128]).isGreaterThan(200);
    }
}

package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.TestImages;
import com.project.tumor.detection.config.DetectionProperties;
import com.project.tumor.detection.exceptions.ProcessingException;
import com.project.tumor.detection.pipeline.model.BinaryMask;
import com.project.tumor.detection.pipeline.model.ConnectedComponent;
import com.project.tumor.detection.pipeline.model.IntensityVolume;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SegmenterTest {

    private final DetectionProperties props = new DetectionProperties();
    private final Preprocessor preprocessor = new Preprocessor(props);
    private final Segmenter segmenter = new Segmenter(props);

    private SegmentationOutcome segment(int[] slice) {
        IntensityVolume raw = IntensityVolume.ofGraySlices(TestImages.SIZE, TestImages.SIZE, List.of(slice));
        return segmenter.segment(preprocessor.process(raw));
    }

    @Test
    void uniformSlice_givesEmptyMask() {
        SegmentationOutcome out = segment(TestImages.uniform(TestImages.SIZE, TestImages.SIZE, 128));

        assertThat(out.mask().isEmpty()).isTrue();
        assertThat(out.keptComponents()).isEmpty();
    }

    @Test
    void centeredDisk_isTheOnlyComponentKept() {
        SegmentationOutcome out = segment(TestImages.centeredDisk());

        assertThat(out.keptComponents()).hasSize(1);
        ConnectedComponent disk = out.keptComponents().get(0);
        assertThat(disk.centroidX()).isCloseTo(128.0, within(1.0));
        assertThat(disk.centroidY()).isCloseTo(128.0, within(1.0));

        BinaryMask mask = out.mask();
        assertThat(mask.foregroundCount()).isEqualTo(disk.area());
        assertThat(mask.get(128, 128)).isEqualTo(1);
        assertThat(mask.get(0, 0)).isZero();
        assertThat(mask.get(128, 100)).isZero();
        double ratio = (double) mask.foregroundCount() / (256 * 256);
        assertThat(ratio).isBetween(0.01, 0.05);
    }

    @Test
    void diskNearCorner_isFilteredOut() {
        SegmentationOutcome out = segment(TestImages.cornerDisk());

        BinaryMask mask = out.mask();
        assertThat(mask.get(25, 25)).isZero();
        assertThat(mask.get(20, 30)).isZero();
    }

    @Test
    void keptComponents_respectSizeAndCentroidBounds() {
        for (int[] slice : List.of(TestImages.centeredDisk(), TestImages.cornerDisk())) {
            SegmentationOutcome out = segment(slice);
            assertThat(out.keptComponents()).allSatisfy(c -> {
                assertThat(c.area()).isBetween(65, 3276);
                assertThat(c.centroidX()).isStrictlyBetween(64.0, 204.8);
                assertThat(c.centroidY()).isStrictlyBetween(64.0, 204.8);
            });
            assertThat(out.mask().toBytes()).containsOnly((byte) 0, (byte) 1);
        }
    }

    @Test
    void filterComponents_boundsAreInclusiveForAreaAndStrictForCentroid() {
        // 100x100: area must be within [10, 500], centroid strictly inside (25, 80)
        List<ConnectedComponent> kept = segmenter.filterComponents(List.of(
                new ConnectedComponent(1, 10, 50, 50),
                new ConnectedComponent(2, 500, 50, 50),
                new ConnectedComponent(3, 9, 50, 50),
                new ConnectedComponent(4, 501, 50, 50),
                new ConnectedComponent(5, 100, 25, 50),
                new ConnectedComponent(6, 100, 50, 80),
                new ConnectedComponent(7, 100, 25.01, 79.99)
        ), 100, 100);

        assertThat(kept).extracting(ConnectedComponent::label).containsExactly(1, 2, 7);
    }

    @Test
    void selectSlice_picksLargestSum_firstOnTies() {
        float[] low = new float[16];
        float[] high = new float[16];
        java.util.Arrays.fill(low, 1f);
        java.util.Arrays.fill(high, 5f);
        IntensityVolume volume = IntensityVolume.ofSlices(4, 4, 8, List.of(low, high, high.clone()));

        assertThat(segmenter.selectSlice(volume)).isEqualTo(1);
    }

    @Test
    void tooSmallImage_isAProcessingError() {
        IntensityVolume volume = IntensityVolume.ofGraySlices(1, 5, List.of(new int[5]));
        assertThatThrownBy(() -> segmenter.segment(volume)).isInstanceOf(ProcessingException.class);
    }
}

package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.config.DetectionProperties;
import com.project.tumor.detection.pipeline.model.BinaryMask;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AnalyzerTest {

    private final Analyzer analyzer = new Analyzer(new DetectionProperties());

    @Test
    void emptyMask_hasZeroStdAndNoTumor() {
        AnalysisReport report = analyzer.analyze(new float[100], BinaryMask.empty(10, 10));

        assertThat(report.hasTumor()).isFalse();
        assertThat(report.tumorRatio()).isZero();
        assertThat(report.stdIntensity()).isZero();
    }

    @Test
    void largeVariedRegion_isATumor() {
        // 4 of 100 pixels, values 100 and 160 -> std 30
        float[] slice = new float[100];
        boolean[] bits = new boolean[100];
        for (int i = 0; i < 4; i++) {
            bits[i] = true;
            slice[i] = i % 2 == 0 ? 100 : 160;
        }

        AnalysisReport report = analyzer.analyze(slice, new BinaryMask(10, 10, bits));

        assertThat(report.tumorRatio()).isEqualTo(0.04);
        assertThat(report.stdIntensity()).isCloseTo(30.0, within(1e-9));
        assertThat(report.hasTumor()).isTrue();
    }

    @Test
    void flatRegion_isNotATumor() {
        float[] slice = new float[100];
        boolean[] bits = new boolean[100];
        for (int i = 0; i < 10; i++) {
            bits[i] = true;
            slice[i] = 200;
        }
        assertThat(analyzer.analyze(slice, new BinaryMask(10, 10, bits)).hasTumor()).isFalse();
    }

    @Test
    void thresholdsAreStrict() {
        // exactly 1% coverage, std 30
        float[] slice = new float[200];
        boolean[] bits = new boolean[200];
        bits[0] = bits[1] = true;
        slice[0] = 100;
        slice[1] = 160;
        assertThat(analyzer.analyze(slice, new BinaryMask(20, 10, bits)).hasTumor()).isFalse();

        // 2% coverage, std exactly 20
        float[] slice2 = new float[100];
        boolean[] bits2 = new boolean[100];
        bits2[0] = bits2[1] = true;
        slice2[0] = 100;
        slice2[1] = 140;
        assertThat(analyzer.analyze(slice2, new BinaryMask(10, 10, bits2)).hasTumor()).isFalse();
    }

    @Test
    void mismatchedMask_isRejected() {
        assertThatThrownBy(() -> analyzer.analyze(new float[10], BinaryMask.empty(4, 4)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

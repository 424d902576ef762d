package com.project.tumor.detection.pipeline.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered stack of same-shaped 2-D slices. Samples are kept as floats so that a freshly loaded
 * DICOM volume keeps its original range; preprocessed volumes hold integral values in [0, 255].
 * <p>
 * Instances are immutable: slices are copied in and copied out.
 */
public final class IntensityVolume {

    public enum Layout { SINGLE_SLICE, MULTI_SLICE }

    private final int width;
    private final int height;
    private final int bitDepth;
    private final List<float[]> slices;

    private IntensityVolume(int width, int height, int bitDepth, List<float[]> slices) {
        this.width = width;
        this.height = height;
        this.bitDepth = bitDepth;
        this.slices = slices;
    }

    public static IntensityVolume ofSlice(int width, int height, int bitDepth, float[] samples) {
        return ofSlices(width, height, bitDepth, List.of(samples));
    }

    public static IntensityVolume ofSlices(int width, int height, int bitDepth, List<float[]> samples) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Invalid slice size " + width + "x" + height);
        }
        if (samples == null || samples.isEmpty()) {
            throw new IllegalArgumentException("A volume needs at least one slice");
        }
        List<float[]> copies = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            float[] s = samples.get(i);
            if (s.length != width * height) {
                throw new IllegalArgumentException("Slice " + i + " has " + s.length
                        + " samples, expected " + (width * height));
            }
            copies.add(s.clone());
        }
        return new IntensityVolume(width, height, bitDepth, Collections.unmodifiableList(copies));
    }

    /** Builds an 8-bit volume from unsigned byte-range int samples. */
    public static IntensityVolume ofGraySlices(int width, int height, List<int[]> gray) {
        List<float[]> converted = new ArrayList<>(gray.size());
        for (int[] g : gray) {
            float[] f = new float[g.length];
            for (int i = 0; i < g.length; i++) f[i] = g[i];
            converted.add(f);
        }
        return ofSlices(width, height, 8, converted);
    }

    public int width() { return width; }

    public int height() { return height; }

    public int bitDepth() { return bitDepth; }

    public int sliceCount() { return slices.size(); }

    public Layout layout() {
        return slices.size() == 1 ? Layout.SINGLE_SLICE : Layout.MULTI_SLICE;
    }

    public float[] slice(int index) {
        return slices.get(index).clone();
    }

    /** Slice samples rounded and clamped to the 8-bit range. */
    public int[] graySlice(int index) {
        float[] s = slices.get(index);
        int[] out = new int[s.length];
        for (int i = 0; i < s.length; i++) {
            int v = (int) Math.rint(s[i]);
            out[i] = v < 0 ? 0 : Math.min(255, v);
        }
        return out;
    }

    public float sample(int slice, int x, int y) {
        return slices.get(slice)[y * width + x];
    }

    public double sliceSum(int index) {
        double sum = 0;
        for (float v : slices.get(index)) sum += v;
        return sum;
    }

    /** Dimensions in x, y[, z] order. */
    public List<Integer> shape() {
        if (layout() == Layout.SINGLE_SLICE) {
            return List.of(width, height);
        }
        return List.of(width, height, slices.size());
    }

    @Override
    public String toString() {
        return "IntensityVolume[" + width + "x" + height + "x" + slices.size() + ", " + bitDepth + "bit]";
    }
}

package com.project.tumor.detection.pipeline.imaging;

import com.project.tumor.detection.pipeline.model.ConnectedComponent;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.opencv.photo.Photo;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenCV filters used by the pipeline, on row-major 8-bit slices ({@code int[]} in 0..255)
 * and binary masks ({@code boolean[]}). Every method throws {@link IllegalStateException} when
 * the OpenCV natives cannot be loaded.
 */
public final class OpenCvFilters {

    public record Labelling(int[] labels, List<ConnectedComponent> components) {}

    private OpenCvFilters() {}

    /**
     * Min/max rescale of all slices together to 0..255 ({@code NORM_MINMAX}). A zero-range input
     * becomes all zeros.
     */
    public static List<int[]> normalizeToByteRange(List<float[]> slices, int width, int height) {
        OpenCvSupport.require();
        Mat stacked = new Mat(height * slices.size(), width, CvType.CV_32FC1);
        for (int s = 0; s < slices.size(); s++) {
            stacked.put(s * height, 0, slices.get(s));
        }
        Mat scaled = new Mat();
        Core.normalize(stacked, scaled, 0, 255, Core.NORM_MINMAX, CvType.CV_8U);

        List<int[]> out = new ArrayList<>(slices.size());
        for (int s = 0; s < slices.size(); s++) {
            Mat slice = scaled.rowRange(s * height, (s + 1) * height);
            out.add(OpenCvSupport.toGray(slice));
        }
        stacked.release();
        scaled.release();
        return out;
    }

    public static int[] normalizeToByteRange(int[] gray, int width, int height) {
        float[] f = new float[gray.length];
        for (int i = 0; i < gray.length; i++) f[i] = gray[i];
        return normalizeToByteRange(List.of(f), width, height).get(0);
    }

    /** {@code fastNlMeansDenoising} with a 7x7 template and a 21x21 search window. */
    public static int[] denoise(int[] gray, int width, int height, double strength) {
        if (strength <= 0) {
            return gray.clone();
        }
        Mat src = OpenCvSupport.grayMat(gray, width, height);
        Mat dst = new Mat();
        Photo.fastNlMeansDenoising(src, dst, (float) strength, 7, 21);
        int[] out = OpenCvSupport.toGray(dst);
        src.release();
        dst.release();
        return out;
    }

    public static int[] clahe(int[] gray, int width, int height, double clipLimit, int tileGrid) {
        Mat src = OpenCvSupport.grayMat(gray, width, height);
        Mat dst = new Mat();
        CLAHE clahe = Imgproc.createCLAHE(clipLimit, new Size(tileGrid, tileGrid));
        clahe.apply(src, dst);
        int[] out = OpenCvSupport.toGray(dst);
        src.release();
        dst.release();
        return out;
    }

    /** {@code THRESH_BINARY}: on 8-bit input a pixel is set when it exceeds {@code floor(threshold)}. */
    public static boolean[] binarize(int[] gray, int width, int height, double threshold) {
        Mat src = OpenCvSupport.grayMat(gray, width, height);
        Mat dst = new Mat();
        Imgproc.threshold(src, dst, threshold, 255, Imgproc.THRESH_BINARY);
        boolean[] out = OpenCvSupport.toBooleans(dst);
        src.release();
        dst.release();
        return out;
    }

    /** Opening with a {@code size x size} elliptical element, repeated {@code iterations} times. */
    public static boolean[] open(boolean[] mask, int width, int height, int size, int iterations) {
        Mat src = OpenCvSupport.binaryMat(mask, width, height);
        Mat dst = new Mat();
        Mat kernel = Imgproc.getStructuringElement(Imgproc.MORPH_ELLIPSE, new Size(size, size));
        Imgproc.morphologyEx(src, dst, Imgproc.MORPH_OPEN, kernel, new Point(-1, -1), iterations);
        boolean[] out = OpenCvSupport.toBooleans(dst);
        src.release();
        dst.release();
        kernel.release();
        return out;
    }

    /** 8-connected components with area and centroid; label 0 is the background and is not listed. */
    public static Labelling label(boolean[] mask, int width, int height) {
        Mat src = OpenCvSupport.binaryMat(mask, width, height);
        Mat labels = new Mat();
        Mat stats = new Mat();
        Mat centroids = new Mat();
        int n = Imgproc.connectedComponentsWithStats(src, labels, stats, centroids, 8, CvType.CV_32S);

        List<ConnectedComponent> components = new ArrayList<>(Math.max(n - 1, 0));
        for (int i = 1; i < n; i++) {
            int area = (int) stats.get(i, Imgproc.CC_STAT_AREA)[0];
            components.add(new ConnectedComponent(i, area, centroids.get(i, 0)[0], centroids.get(i, 1)[0]));
        }
        int[] ids = new int[width * height];
        labels.get(0, 0, ids);

        src.release();
        labels.release();
        stats.release();
        centroids.release();
        return new Labelling(ids, components);
    }
}

package com.project.tumor.detection.pipeline.imaging;

/**
 * Histogram percentiles of 8-bit slices.
 */
public final class IntensityStatistics {

    private IntensityStatistics() {}

    /**
     * Percentile of 8-bit samples using linear interpolation between the two closest ranks.
     *
     * @param q percentile in [0, 100]
     */
    public static double percentile(int[] gray, double q) {
        if (gray.length == 0) {
            throw new IllegalArgumentException("Percentile of an empty sample");
        }
        int[] hist = histogram(gray);
        double pos = (q / 100.0) * (gray.length - 1);
        long lowRank = (long) Math.floor(pos);
        long highRank = Math.min(lowRank + 1, gray.length - 1);
        int low = valueAtRank(hist, lowRank);
        int high = valueAtRank(hist, highRank);
        return low + (high - low) * (pos - lowRank);
    }

    public static int[] histogram(int[] gray) {
        int[] hist = new int[256];
        for (int v : gray) hist[v & 0xFF]++;
        return hist;
    }

    private static int valueAtRank(int[] hist, long rank) {
        long seen = 0;
        for (int v = 0; v < hist.length; v++) {
            seen += hist[v];
            if (seen > rank) return v;
        }
        return hist.length - 1;
    }
}

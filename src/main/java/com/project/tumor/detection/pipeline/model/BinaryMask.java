package com.project.tumor.detection.pipeline.model;

/**
 * Region-of-interest mask for a single slice. Values are 0 or 1.
 */
public final class BinaryMask {
    private final int width;
    private final int height;
    private final boolean[] bits;

    public BinaryMask(int width, int height, boolean[] bits) {
        if (bits.length != width * height) {
            throw new IllegalArgumentException("Mask has " + bits.length + " cells, expected " + (width * height));
        }
        this.width = width;
        this.height = height;
        this.bits = bits.clone();
    }

    public static BinaryMask empty(int width, int height) {
        return new BinaryMask(width, height, new boolean[width * height]);
    }

    public int width() { return width; }

    public int height() { return height; }

    public int get(int x, int y) {
        return bits[y * width + x] ? 1 : 0;
    }

    public boolean isSet(int index) {
        return bits[index];
    }

    public int foregroundCount() {
        int n = 0;
        for (boolean b : bits) if (b) n++;
        return n;
    }

    public boolean isEmpty() {
        return foregroundCount() == 0;
    }

    /** Mask as 0/1 bytes, row-major. */
    public byte[] toBytes() {
        byte[] out = new byte[bits.length];
        for (int i = 0; i < bits.length; i++) out[i] = (byte) (bits[i] ? 1 : 0);
        return out;
    }
}

package com.project.tumor.detection.pipeline.imaging;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Loads the OpenCV natives bundled by openpnp once per JVM and converts between
 * {@link Mat} and {@link BufferedImage}.
 */
public final class OpenCvSupport {
    private static final Logger log = LoggerFactory.getLogger(OpenCvSupport.class);

    private static volatile Boolean available;

    private OpenCvSupport() {}

    public static boolean isAvailable() {
        Boolean a = available;
        if (a == null) {
            synchronized (OpenCvSupport.class) {
                a = available;
                if (a == null) {
                    a = load();
                    available = a;
                }
            }
        }
        return a;
    }

    /** @throws IllegalStateException when the native library could not be loaded */
    public static void require() {
        if (!isAvailable()) {
            throw new IllegalStateException("OpenCV native library is not available on this platform");
        }
    }

    private static boolean load() {
        try {
            // loadShared() patches java.library.path reflectively, which JDK 12+ rejects
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
            return true;
        } catch (Throwable e) {
            log.error("Failed to load OpenCV", e);
            return false;
        }
    }

    public static Mat toMat(BufferedImage image) {
        BufferedImage bgr = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        Graphics2D graphics = bgr.createGraphics();
        graphics.drawImage(image, 0, 0, null);
        graphics.dispose();
        byte[] pixels = ((DataBufferByte) bgr.getRaster().getDataBuffer()).getData();
        Mat mat = new Mat(image.getHeight(), image.getWidth(), CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    /** Converts an 8-bit 3-channel BGR or 1-channel gray {@link Mat}. */
    public static BufferedImage toBufferedImage(Mat mat) {
        int type = mat.channels() == 1 ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR;
        BufferedImage image = new BufferedImage(mat.cols(), mat.rows(), type);
        byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        mat.get(0, 0, target);
        return image;
    }

    /** Single-channel 8-bit {@link Mat} from row-major samples in 0..255. */
    public static Mat grayMat(int[] gray, int width, int height) {
        require();
        byte[] data = new byte[width * height];
        for (int i = 0; i < data.length; i++) data[i] = (byte) gray[i];
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    /** 0/255 {@link Mat} of a binary mask. */
    public static Mat binaryMat(boolean[] mask, int width, int height) {
        require();
        byte[] data = new byte[width * height];
        for (int i = 0; i < data.length; i++) data[i] = (byte) (mask[i] ? 255 : 0);
        Mat mat = new Mat(height, width, CvType.CV_8UC1);
        mat.put(0, 0, data);
        return mat;
    }

    public static boolean[] toBooleans(Mat binary) {
        byte[] data = new byte[binary.rows() * binary.cols()];
        binary.get(0, 0, data);
        boolean[] out = new boolean[data.length];
        for (int i = 0; i < data.length; i++) out[i] = data[i] != 0;
        return out;
    }

    /** Row-major 8-bit samples of a single-channel {@link Mat}. */
    public static int[] toGray(Mat gray) {
        byte[] data = new byte[gray.rows() * gray.cols()];
        gray.get(0, 0, data);
        int[] out = new int[data.length];
        for (int i = 0; i < data.length; i++) out[i] = data[i] & 0xFF;
        return out;
    }
}

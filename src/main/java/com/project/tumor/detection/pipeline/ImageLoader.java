package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.exceptions.DecodeException;
import com.project.tumor.detection.pipeline.imaging.OpenCvSupport;
import com.project.tumor.detection.pipeline.model.IntensityVolume;
import ij.IJ;
import ij.ImageStack;
import ij.measure.Calibration;
import ij.plugin.DICOM;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import javax.imageio.ImageIO;

/**
 * Decodes an input file into an {@link IntensityVolume}, choosing the decoder by extension.
 * DICOM files keep every frame and their original sample range; raster images become a
 * single 8-bit grayscale slice. Nothing is resized or cropped.
 */
@Component
public class ImageLoader {
    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    static final Set<String> DICOM_EXTENSIONS = Set.of("dcm", "dicom");
    static final Set<String> IMAGEIO_EXTENSIONS = Set.of("png", "jpg", "jpeg", "bmp", "gif", "tif", "tiff");
    static final Set<String> OPENCV_EXTENSIONS = Set.of("webp", "jp2", "pgm", "ppm", "pbm");

    public IntensityVolume load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new DecodeException("Input file does not exist: " + path);
        }
        String ext = extensionOf(path);
        IntensityVolume volume;
        if (DICOM_EXTENSIONS.contains(ext)) {
            volume = readDicom(path);
        } else if (IMAGEIO_EXTENSIONS.contains(ext)) {
            volume = readRaster(path);
        } else if (OPENCV_EXTENSIONS.contains(ext)) {
            volume = readWithOpenCv(path);
        } else {
            throw new DecodeException("Unsupported image format: ." + ext);
        }
        log.debug("Loaded {} as {}", path.getFileName(), volume);
        return volume;
    }

    public static boolean isSupported(String extension) {
        String ext = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
        return DICOM_EXTENSIONS.contains(ext) || IMAGEIO_EXTENSIONS.contains(ext) || OPENCV_EXTENSIONS.contains(ext);
    }

    static String extensionOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private IntensityVolume readDicom(Path path) {
        DICOM dicom;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            dicom = new DICOM(in);
            // keep decoder errors out of dialogs
            IJ.redirectErrorMessages();
            dicom.run(path.getFileName().toString());
        } catch (IOException | RuntimeException e) {
            throw new DecodeException("Cannot read DICOM file " + path.getFileName(), e);
        }
        if (dicom.getWidth() == 0 || dicom.getStackSize() == 0) {
            throw new DecodeException("Not a readable DICOM image: " + path.getFileName());
        }

        int w = dicom.getWidth();
        int h = dicom.getHeight();
        Calibration cal = dicom.getCalibration();
        ImageStack stack = dicom.getStack();
        List<float[]> slices = new ArrayList<>(stack.getSize());
        for (int s = 1; s <= stack.getSize(); s++) {
            ImageProcessor ip = stack.getProcessor(s);
            if (ip instanceof ColorProcessor) {
                ip = ip.convertToByteProcessor();
            }
            float[] samples = new float[w * h];
            for (int i = 0; i < samples.length; i++) {
                samples[i] = (float) cal.getCValue(ip.getf(i));
            }
            slices.add(samples);
        }
        log.info("DICOM {}: {}x{}, {} frame(s), {} bit", path.getFileName(), w, h, slices.size(), dicom.getBitDepth());
        return IntensityVolume.ofSlices(w, h, dicom.getBitDepth(), slices);
    }

    private IntensityVolume readRaster(Path path) {
        BufferedImage image;
        try {
            image = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new DecodeException("Cannot decode image " + path.getFileName(), e);
        }
        if (image == null) {
            throw new DecodeException("File is not a valid image or is corrupted: " + path.getFileName());
        }
        int w = image.getWidth();
        int h = image.getHeight();
        Raster raster = image.getRaster();
        boolean rawGray = raster.getNumBands() == 1 && !(image.getColorModel() instanceof IndexColorModel);

        float[] samples = new float[w * h];
        int bitDepth = 8;
        if (rawGray) {
            // raw samples, getRGB would apply a gamma conversion to linear gray
            bitDepth = raster.getSampleModel().getSampleSize(0);
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    samples[y * w + x] = raster.getSample(x, y, 0);
                }
            }
        } else {
            int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
            for (int i = 0; i < argb.length; i++) {
                int p = argb[i];
                int r = (p >> 16) & 0xFF, g = (p >> 8) & 0xFF, b = p & 0xFF;
                samples[i] = (float) Math.rint(0.299 * r + 0.587 * g + 0.114 * b);
            }
        }
        return IntensityVolume.ofSlice(w, h, bitDepth, samples);
    }

    private IntensityVolume readWithOpenCv(Path path) {
        if (!OpenCvSupport.isAvailable()) {
            throw new DecodeException("Decoding ." + extensionOf(path) + " files requires OpenCV, which is not available");
        }
        Mat gray = Imgcodecs.imread(path.toAbsolutePath().toString(), Imgcodecs.IMREAD_GRAYSCALE);
        if (gray.empty()) {
            throw new DecodeException("File is not a valid image or is corrupted: " + path.getFileName());
        }
        int[] values = OpenCvSupport.toGray(gray);
        int w = gray.cols();
        int h = gray.rows();
        gray.release();
        return IntensityVolume.ofGraySlices(w, h, List.of(values));
    }
}

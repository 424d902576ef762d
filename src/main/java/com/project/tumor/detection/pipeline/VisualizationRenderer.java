package com.project.tumor.detection.pipeline;

import com.project.tumor.detection.exceptions.ArtifactWriteException;
import com.project.tumor.detection.pipeline.imaging.OpenCvSupport;
import com.project.tumor.detection.pipeline.model.BinaryMask;
import com.project.tumor.detection.pipeline.model.VisualizationSet;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Writes the four inspection images of a run: the processed slice in color, the mask,
 * the slice with the masked pixels painted red, and a titled side-by-side panel of the three.
 */
@Component
public class VisualizationRenderer {
    private static final Logger log = LoggerFactory.getLogger(VisualizationRenderer.class);

    static final int HIGHLIGHT_RGB = 0xFF0000;
    static final int PANEL_CELL = 400;
    static final int TITLE_BAND = 48;
    static final String[] PANEL_TITLES = {"MRI", "Mask", "MRI with mask"};

    private final DetectionPipeline pipeline;

    public VisualizationRenderer(DetectionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /** Runs the pipeline on {@code input} and renders the result. */
    public VisualizationSet render(Path input, Path outputDir, String baseName) {
        return render(pipeline.run(input), outputDir, baseName);
    }

    public VisualizationSet render(PipelineRun run, Path outputDir, String baseName) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ArtifactWriteException("output directory", e.getMessage(), e);
        }

        int w = run.processed().width();
        int h = run.processed().height();
        int[] gray = run.graySlice();
        BinaryMask mask = run.mask();

        BufferedImage original = originalImage(gray, w, h);
        BufferedImage maskImage = maskImage(mask);
        BufferedImage overlay = overlayImage(original, mask);

        Path originalPath = write(original, outputDir.resolve(baseName + VisualizationSet.ORIGINAL_SUFFIX), "original");
        Path maskPath = write(maskImage, outputDir.resolve(baseName + VisualizationSet.MASK_SUFFIX), "mask");
        Path overlayPath = write(overlay, outputDir.resolve(baseName + VisualizationSet.OVERLAY_SUFFIX), "overlay");

        BufferedImage panel;
        try {
            panel = panelImage(List.of(original, maskImage, overlay));
        } catch (RuntimeException e) {
            throw new ArtifactWriteException("panel", e.getMessage(), e);
        }
        Path panelPath = write(panel, outputDir.resolve(baseName + VisualizationSet.PANEL_SUFFIX), "panel");

        log.debug("Rendered visualizations for {} into {}", baseName, outputDir);
        return new VisualizationSet(originalPath, maskPath, overlayPath, panelPath);
    }

    static BufferedImage originalImage(int[] gray, int w, int h) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_3BYTE_BGR);
        for (int i = 0; i < gray.length; i++) {
            int g = gray[i];
            img.setRGB(i % w, i / w, (g << 16) | (g << 8) | g);
        }
        return img;
    }

    static BufferedImage maskImage(BinaryMask mask) {
        BufferedImage img = new BufferedImage(mask.width(), mask.height(), BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = img.getRaster();
        for (int y = 0; y < mask.height(); y++) {
            for (int x = 0; x < mask.width(); x++) {
                raster.setSample(x, y, 0, mask.get(x, y) == 1 ? 255 : 0);
            }
        }
        return img;
    }

    static BufferedImage overlayImage(BufferedImage original, BinaryMask mask) {
        BufferedImage img = new BufferedImage(original.getWidth(), original.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        img.setData(original.getRaster());
        for (int y = 0; y < mask.height(); y++) {
            for (int x = 0; x < mask.width(); x++) {
                if (mask.get(x, y) == 1) {
                    img.setRGB(x, y, HIGHLIGHT_RGB);
                }
            }
        }
        return img;
    }

    /** Three titled cells side by side on a white background, no axes. */
    static BufferedImage panelImage(List<BufferedImage> images) {
        OpenCvSupport.require();
        List<Mat> cells = new ArrayList<>();
        for (int i = 0; i < images.size(); i++) {
            cells.add(panelCell(OpenCvSupport.toMat(images.get(i)), PANEL_TITLES[i]));
        }
        Mat panel = new Mat();
        Core.hconcat(cells, panel);
        BufferedImage out = OpenCvSupport.toBufferedImage(panel);
        panel.release();
        for (Mat m : cells) m.release();
        return out;
    }

    private static Mat panelCell(Mat image, String title) {
        Mat cell = new Mat(PANEL_CELL + TITLE_BAND, PANEL_CELL, CvType.CV_8UC3, new Scalar(255, 255, 255));

        double scale = Math.min((double) PANEL_CELL / image.cols(), (double) PANEL_CELL / image.rows());
        int sw = Math.max(1, (int) Math.round(image.cols() * scale));
        int sh = Math.max(1, (int) Math.round(image.rows() * scale));
        Mat scaled = new Mat();
        Imgproc.resize(image, scaled, new Size(sw, sh), 0, 0, Imgproc.INTER_NEAREST);
        Rect roi = new Rect((PANEL_CELL - sw) / 2, TITLE_BAND + (PANEL_CELL - sh) / 2, sw, sh);
        scaled.copyTo(cell.submat(roi));

        int[] baseline = new int[1];
        Size text = Imgproc.getTextSize(title, Imgproc.FONT_HERSHEY_SIMPLEX, 0.8, 2, baseline);
        Point origin = new Point((PANEL_CELL - text.width) / 2, (TITLE_BAND + text.height) / 2);
        Imgproc.putText(cell, title, origin, Imgproc.FONT_HERSHEY_SIMPLEX, 0.8, new Scalar(0, 0, 0), 2);

        scaled.release();
        image.release();
        return cell;
    }

    private static Path write(BufferedImage image, Path target, String artifact) {
        try {
            if (!ImageIO.write(image, "png", target.toFile())) {
                throw new ArtifactWriteException(artifact, "no PNG writer available", null);
            }
        } catch (IOException e) {
            throw new ArtifactWriteException(artifact, e.getMessage(), e);
        }
        return target;
    }
}

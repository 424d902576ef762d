package com.project.tumor.detection.service;

import com.project.tumor.detection.exceptions.ArtifactWriteException;
import com.project.tumor.detection.pipeline.model.DetectionResult;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds the downloadable report: title, verdict and the rendered images, one after the other,
 * continuing on a new page whenever the next image does not fit.
 */
@Service
public class PdfReportService {
    private static final Logger log = LoggerFactory.getLogger(PdfReportService.class);

    static final String TITLE = "Resultado del análisis de tumor cerebral";
    static final float MARGIN = 72f;
    static final float MAX_IMAGE_HEIGHT = 300f;
    static final float GAP = 18f;

    private static final PDFont TITLE_FONT = PDType1Font.HELVETICA_BOLD;
    private static final PDFont BODY_FONT = PDType1Font.HELVETICA;

    public byte[] render(DetectionResult result, List<Path> images) {
        try (PDDocument doc = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDRectangle size = PDRectangle.LETTER;
            PDPage page = new PDPage(size);
            doc.addPage(page);
            PDPageContentStream cs = new PDPageContentStream(doc, page);
            float y = size.getHeight() - MARGIN;

            y = text(cs, TITLE_FONT, 16, TITLE, y);
            y = text(cs, BODY_FONT, 12, verdictLine(result), y - 6);
            y = text(cs, BODY_FONT, 10, "Dimensiones: " + result.imageShape(), y - 2);
            y -= GAP;

            float maxWidth = size.getWidth() - 2 * MARGIN;
            for (Path imagePath : images) {
                PDImageXObject image = PDImageXObject.createFromFileByExtension(imagePath.toFile(), doc);
                float scale = Math.min(maxWidth / image.getWidth(), MAX_IMAGE_HEIGHT / image.getHeight());
                float w = image.getWidth() * scale;
                float h = image.getHeight() * scale;
                if (y - h < MARGIN) {
                    cs.close();
                    page = new PDPage(size);
                    doc.addPage(page);
                    cs = new PDPageContentStream(doc, page);
                    y = size.getHeight() - MARGIN;
                }
                cs.drawImage(image, MARGIN, y - h, w, h);
                y -= h + GAP;
            }
            cs.close();

            doc.save(out);
            log.debug("PDF report with {} image(s) on {} page(s)", images.size(), doc.getNumberOfPages());
            return out.toByteArray();
        } catch (IOException e) {
            throw new ArtifactWriteException("PDF report", e.getMessage(), e);
        }
    }

    static String verdictLine(DetectionResult result) {
        return "¿Hay tumor?: " + (result.hasTumor() ? "Sí" : "No");
    }

    private static float text(PDPageContentStream cs, PDFont font, float fontSize, String text, float y)
            throws IOException {
        float lineY = y - fontSize;
        cs.beginText();
        cs.setFont(font, fontSize);
        cs.newLineAtOffset(MARGIN, lineY);
        cs.showText(text);
        cs.endText();
        return lineY - fontSize * 0.4f;
    }
}

package com.project.tumor.detection.controller;

import com.project.tumor.detection.DTOs.AnalysisResponse;
import com.project.tumor.detection.DTOs.ErrorResponse;
import com.project.tumor.detection.config.StorageProperties;
import com.project.tumor.detection.service.PdfReportService;
import com.project.tumor.detection.service.StorageService;
import com.project.tumor.detection.service.TumorDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * Machine-facing endpoints: JSON verdict for automation clients and a PDF report.
 * Failures are mapped by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
public class AnalysisApiController {
    private static final Logger log = LoggerFactory.getLogger(AnalysisApiController.class);

    static final String REPORT_FILENAME = "reporte_tumor.pdf";

    private final TumorDetectionService detectionService;
    private final StorageService storageService;
    private final StorageProperties storageProperties;
    private final PdfReportService pdfReportService;

    public AnalysisApiController(TumorDetectionService detectionService, StorageService storageService,
                                 StorageProperties storageProperties, PdfReportService pdfReportService) {
        this.detectionService = detectionService;
        this.storageService = storageService;
        this.storageProperties = storageProperties;
        this.pdfReportService = pdfReportService;
    }

    @PostMapping(value = "/analyze", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> analyze(@RequestParam(name = "file", required = false) MultipartFile file) {
        ResponseEntity<ErrorResponse> rejected = validate(file);
        if (rejected != null) return rejected;

        var stored = storageService.store(file);
        var analysis = detectionService.analyze(stored.path(), storageService.resultsDir(), stored.baseName());

        String marked = ServletUriComponentsBuilder.fromCurrentContextPath()
                .path("/" + storageService.resultWebPath(analysis.visuals().original()))
                .toUriString();
        log.info("API analysis of {}: tumor={}", stored.filename(), analysis.result().hasTumor());
        return ResponseEntity.ok(AnalysisResponse.processed(analysis.result().hasTumor(), marked));
    }

    @PostMapping(value = "/pdf-report", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> pdfReport(@RequestParam(name = "file", required = false) MultipartFile file) {
        ResponseEntity<ErrorResponse> rejected = validate(file);
        if (rejected != null) return rejected;

        var stored = storageService.store(file);
        var analysis = detectionService.analyze(stored.path(), storageService.resultsDir(), stored.baseName());
        byte[] pdf = pdfReportService.render(analysis.result(), analysis.visuals().all());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_PDF);
        headers.setContentDisposition(ContentDisposition.attachment().filename(REPORT_FILENAME).build());
        log.info("PDF report for {} ({} bytes)", stored.filename(), pdf.length);
        return ResponseEntity.ok().headers(headers).body(pdf);
    }

    private ResponseEntity<ErrorResponse> validate(MultipartFile file) {
        if (file == null) {
            return ResponseEntity.badRequest().body(ErrorResponse.rejected("No se encontró archivo"));
        }
        String name = file.getOriginalFilename();
        if (name == null || name.isBlank()) {
            return ResponseEntity.badRequest().body(ErrorResponse.rejected("Nombre de archivo vacío"));
        }
        if (file.isEmpty() || !storageProperties.isAllowed(StringUtils.getFilenameExtension(name))) {
            log.warn("Rejected upload {}", name);
            return ResponseEntity.badRequest().body(ErrorResponse.rejected("Archivo no válido"));
        }
        return null;
    }
}

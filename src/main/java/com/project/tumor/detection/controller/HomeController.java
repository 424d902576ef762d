package com.project.tumor.detection.controller;

import com.project.tumor.detection.DTOs.ResultView;
import com.project.tumor.detection.config.StorageProperties;
import com.project.tumor.detection.service.StorageService;
import com.project.tumor.detection.service.TumorDetectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Upload form and result page. Thin controller: storage and analysis live in the services.
 */
@Controller
public class HomeController {
    private static final Logger log = LoggerFactory.getLogger(HomeController.class);

    private final TumorDetectionService detectionService;
    private final StorageService storageService;
    private final StorageProperties storageProperties;

    public HomeController(TumorDetectionService detectionService, StorageService storageService,
                          StorageProperties storageProperties) {
        this.detectionService = detectionService;
        this.storageService = storageService;
        this.storageProperties = storageProperties;
    }

    @GetMapping("/")
    public String index(Model model) {
        log.debug("Serving home page");
        model.addAttribute("allowedExtensions", String.join(", ", storageProperties.getAllowedExtensions()));
        return "index";
    }

    @PostMapping(value = "/", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public String upload(@RequestParam(name = "file", required = false) MultipartFile file, Model model) {
        model.addAttribute("allowedExtensions", String.join(", ", storageProperties.getAllowedExtensions()));
        if (file == null || file.isEmpty()) {
            model.addAttribute("error", "Seleccione un archivo para analizar.");
            return "index";
        }

        var stored = storageService.store(file);
        log.info("Processing upload {} ({} KB)", stored.filename(), file.getSize() / 1024);

        var analysis = detectionService.analyze(stored.path(), storageService.resultsDir(), stored.baseName());

        List<String> resultImages = new ArrayList<>();
        analysis.visuals().all().forEach(p -> resultImages.add("/" + storageService.resultWebPath(p)));

        model.addAttribute("result", new ResultView(
                "/" + stored.relativeWebPath(),
                resultImages,
                analysis.result().hasTumor(),
                String.format("%.2f", analysis.report().tumorRatio() * 100.0),
                String.format("%.2f", analysis.report().stdIntensity()),
                analysis.result().imageShape()
        ));
        return "index";
    }
}

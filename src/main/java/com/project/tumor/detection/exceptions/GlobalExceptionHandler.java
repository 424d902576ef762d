package com.project.tumor.detection.exceptions;

import com.project.tumor.detection.config.StorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Error handling for the HTML pages: every failure is shown on the upload form.
 */
@ControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private final StorageProperties storageProperties;

    public GlobalExceptionHandler(StorageProperties storageProperties) {
        this.storageProperties = storageProperties;
    }

    @ExceptionHandler(StorageException.class)
    public String handleStorage(StorageException ex, Model model) {
        log.warn("Upload rejected: {}", ex.getMessage());
        addAllowedExtensions(model);
        model.addAttribute("error", ex.getMessage());
        return "index";
    }

    @ExceptionHandler(DetectionException.class)
    public String handleDetection(DetectionException ex, Model model) {
        log.warn("Analysis failed ({}): {}", ex.kind(), ex.getMessage());
        addAllowedExtensions(model);
        model.addAttribute("error", ex.getMessage());
        model.addAttribute("errorKind", ex.kind().name());
        return "index";
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public String handleMaxUploadSizeExceeded(MaxUploadSizeExceededException ex, Model model) {
        log.warn("File upload size exceeded: {}", ex.getMessage());
        addAllowedExtensions(model);
        model.addAttribute("error", "El archivo es demasiado grande. Tamaño máximo: 10MB");
        return "index";
    }

    @ExceptionHandler(Exception.class)
    public String handleUnknownException(Exception ex, Model model) {
        log.error("Unhandled error occurred", ex);
        addAllowedExtensions(model);
        model.addAttribute("error", "Ocurrió un error inesperado. Inténtelo de nuevo.");
        return "index";
    }

    // the handler gets a fresh model, so the form hint has to be added again
    private void addAllowedExtensions(Model model) {
        model.addAttribute("allowedExtensions", String.join(", ", storageProperties.getAllowedExtensions()));
    }
}

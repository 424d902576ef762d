package com.project.tumor.detection.exceptions;

import com.project.tumor.detection.DTOs.ErrorResponse;
import com.project.tumor.detection.controller.AnalysisApiController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * JSON error bodies for the API. A failed analysis answers 422 with its category so that
 * clients can tell it apart from a negative result.
 */
@RestControllerAdvice(assignableTypes = AnalysisApiController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException ex) {
        log.warn("Upload rejected: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.rejected(ex.getMessage()));
    }

    @ExceptionHandler(DetectionException.class)
    public ResponseEntity<ErrorResponse> handleDetection(DetectionException ex) {
        log.warn("Analysis failed ({}): {}", ex.kind(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(ErrorResponse.failed(ex.kind().name(), ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex) {
        log.error("Unhandled API error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.failed("INTERNAL", "Unexpected error"));
    }
}

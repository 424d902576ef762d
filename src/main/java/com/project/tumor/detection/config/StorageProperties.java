package com.project.tumor.detection.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Upload and result folders plus the accepted file extensions, bound from {@code app.storage.*}.
 */
@ConfigurationProperties(prefix = "app.storage")
public class StorageProperties {

    private String uploadDir = "uploads";
    private String resultsDir = "results";
    private List<String> allowedExtensions = new ArrayList<>(
            List.of("png", "jpg", "jpeg", "bmp", "tif", "tiff", "dcm", "dicom"));

    public StorageProperties() {}

    public StorageProperties(String uploadDir, String resultsDir) {
        this.uploadDir = uploadDir;
        this.resultsDir = resultsDir;
    }

    public String getUploadDir() { return uploadDir; }
    public void setUploadDir(String uploadDir) { this.uploadDir = uploadDir; }

    public String getResultsDir() { return resultsDir; }
    public void setResultsDir(String resultsDir) { this.resultsDir = resultsDir; }

    public List<String> getAllowedExtensions() { return allowedExtensions; }
    public void setAllowedExtensions(List<String> allowedExtensions) { this.allowedExtensions = allowedExtensions; }

    public boolean isAllowed(String extension) {
        if (extension == null) return false;
        String ext = extension.toLowerCase(Locale.ROOT);
        for (String a : allowedExtensions) {
            if (a.equalsIgnoreCase(ext)) return true;
        }
        return false;
    }
}

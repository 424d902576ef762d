package com.project.tumor.detection.service;

import com.project.tumor.detection.config.StorageProperties;
import com.project.tumor.detection.exceptions.StorageException;
import com.project.tumor.detection.pipeline.ImageLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

@Service
public class StorageService {
    private static final Logger log = LoggerFactory.getLogger(StorageService.class);
    private static final DateTimeFormatter TOKEN = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final StorageProperties properties;
    private final Path uploadDir;
    private final Path resultsDir;

    public StorageService(StorageProperties properties) {
        this.properties = properties;
        this.uploadDir = Paths.get(properties.getUploadDir()).toAbsolutePath().normalize();
        this.resultsDir = Paths.get(properties.getResultsDir()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.uploadDir);
            Files.createDirectories(this.resultsDir);
            log.info("Using upload directory: {}, results directory: {}", this.uploadDir, this.resultsDir);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directories under " + uploadDir + " / " + resultsDir, e);
        }
        for (String ext : properties.getAllowedExtensions()) {
            if (!ImageLoader.isSupported(ext)) {
                log.warn("Allowed extension .{} has no decoder; such uploads will fail to decode", ext);
            }
        }
    }

    public record StoredFile(Path path, String filename, String relativeWebPath) {
        /** File name without its extension, used to name the result images. */
        public String baseName() {
            int dot = filename.lastIndexOf('.');
            return dot < 0 ? filename : filename.substring(0, dot);
        }
    }

    public StoredFile store(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new StorageException("Empty upload");
        }
        String original = file.getOriginalFilename();
        if (original == null || original.isBlank()) {
            throw new StorageException("Empty file name");
        }
        String ext = StringUtils.getFilenameExtension(original);
        if (!properties.isAllowed(ext)) {
            throw new StorageException("File type not allowed: " + original
                    + " (allowed: " + String.join(", ", properties.getAllowedExtensions()) + ")");
        }
        String filename = TOKEN.format(LocalDateTime.now()) + "_" + sanitize(original);
        Path target = uploadDir.resolve(filename);
        try (InputStream in = file.getInputStream()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Stored upload {} as {}", original, filename);
            return new StoredFile(target, filename, "uploads/" + filename);
        } catch (IOException e) {
            throw new StorageException("Failed to store file", e);
        }
    }

    /** Keeps letters, digits, dot, dash and underscore; drops any directory part. */
    static String sanitize(String name) {
        String clean = StringUtils.getFilename(StringUtils.cleanPath(name));
        if (clean == null) {
            clean = "upload";
        }
        clean = clean.replaceAll("[^a-zA-Z0-9._-]", "_");
        while (clean.startsWith(".")) {
            clean = clean.substring(1);
        }
        return clean.isEmpty() ? "upload" : clean;
    }

    public Path resultsDir() {
        return resultsDir;
    }

    public String resultWebPath(Path result) {
        return "results/" + result.getFileName();
    }
}

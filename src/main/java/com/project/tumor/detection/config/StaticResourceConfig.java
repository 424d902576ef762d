package com.project.tumor.detection.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Explicit resource handlers for /uploads/** and /results/** pointing at the configured folders,
 * so the URLs resolve independently of the working directory.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    private final StorageProperties storage;

    public StaticResourceConfig(StorageProperties storage) {
        this.storage = storage;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**")
                .addResourceLocations(location(storage.getUploadDir()));
        registry.addResourceHandler("/results/**")
                .addResourceLocations(location(storage.getResultsDir()));
    }

    private static String location(String dir) {
        Path abs = Paths.get(dir).toAbsolutePath().normalize();
        return "file:" + abs + "/";
    }
}

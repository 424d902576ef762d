package com.project.tumor.detection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the Spring Boot application. Only bootstraps the app; the detection pipeline
 * lives under {@code pipeline} and the web layer under {@code controller}.
 *
 * @ConfigurationPropertiesScan picks up the storage and detection settings from the config package.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Application {
    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }
}

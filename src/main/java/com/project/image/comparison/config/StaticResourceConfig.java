package com.project.image.comparison.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Serves /uploads/** and /outputs/** from the configured folders, independent
 * of the working directory.
 */
@Configuration
public class StaticResourceConfig implements WebMvcConfigurer {

    @Value("${app.upload.dir:uploads}")
    private String uploadDir;

    @Value("${app.output.dir:output}")
    private String outputDir;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/uploads/**").addResourceLocations(location(uploadDir));
        registry.addResourceHandler("/outputs/**").addResourceLocations(location(outputDir));
    }

    private static String location(String dir) {
        Path abs = Paths.get(dir).toAbsolutePath().normalize();
        return "file:" + abs + "/";
    }
}

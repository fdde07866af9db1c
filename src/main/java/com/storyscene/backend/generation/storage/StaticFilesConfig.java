package com.storyscene.backend.generation.storage;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Paths;

/**
 * Serves the local blob directory under {@code /files/**} so stored image URLs resolve in dev.
 */
@Configuration
public class StaticFilesConfig implements WebMvcConfigurer {

    private final String location;

    public StaticFilesConfig(@Value("${app.storage.local.base-dir:./data}") String baseDir) {
        String uri = Paths.get(baseDir).toAbsolutePath().normalize().toUri().toString();
        this.location = uri.endsWith("/") ? uri : uri + "/";
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        registry.addResourceHandler("/files/**").addResourceLocations(location);
    }
}

package com.mediaflow.mediaflow_backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.file.Path;

/** Serves files written by the file-system media storage under {@code /media/**}. */
@Configuration
@EnableConfigurationProperties(MediaflowProperties.class)
@RequiredArgsConstructor
public class MediaResourceConfig implements WebMvcConfigurer {

    private final MediaflowProperties properties;

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = Path.of(properties.getStorage().getRoot()).toAbsolutePath().normalize().toUri().toString();
        // toUri() only adds the slash for directories that already exist
        if (!location.endsWith("/")) location += "/";
        registry.addResourceHandler("/media/**").addResourceLocations(location);
    }
}

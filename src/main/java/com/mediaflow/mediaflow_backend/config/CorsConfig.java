package com.mediaflow.mediaflow_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Browser access for the dashboard. Provider webhooks are server-to-server and get no CORS mapping;
 * generated media is readable from any origin.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    @Value("${app.cors.allowed-origins:http://localhost:3000}")
    private String allowedOrigins;

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        String[] origins = allowedOrigins.split("\\s*,\\s*");
        registry.addMapping("/api/execute/**")
                .allowedOriginPatterns(origins)
                .allowedMethods("GET", "POST")
                .allowCredentials(true);
        registry.addMapping("/api/provider-credentials/**")
                .allowedOriginPatterns(origins)
                .allowedMethods("GET", "PUT", "PATCH", "DELETE")
                .allowCredentials(true);
        registry.addMapping("/media/**")
                .allowedOrigins("*")
                .allowedMethods("GET", "HEAD");
    }
}

package com.mediaflow.mediaflow_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MediaflowBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MediaflowBackendApplication.class, args);
    }
}

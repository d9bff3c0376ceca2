package com.bmsedge.sticklist.service;

import com.bmsedge.sticklist.config.StickListProperties;
import com.bmsedge.sticklist.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Supplies the default stick list template when a request brings none.
 */
@Service
public class TemplateStore {

    private static final Logger logger = LoggerFactory.getLogger(TemplateStore.class);

    @Autowired
    private StickListProperties properties;

    public byte[] loadDefaultTemplate() throws IOException {
        String location = properties.getTemplatePath();

        Path path = Paths.get(location);
        if (Files.isRegularFile(path)) {
            logger.info("Using template file {}", path.toAbsolutePath());
            return Files.readAllBytes(path);
        }

        ClassPathResource resource = new ClassPathResource(location);
        if (resource.exists()) {
            logger.info("Using classpath template {}", location);
            try (InputStream input = resource.getInputStream()) {
                return input.readAllBytes();
            }
        }

        throw new ResourceNotFoundException("Missing template file: " + location
                + ". Put the template there or upload one with the request.");
    }

    public boolean hasDefaultTemplate() {
        String location = properties.getTemplatePath();
        return Files.isRegularFile(Paths.get(location)) || new ClassPathResource(location).exists();
    }
}

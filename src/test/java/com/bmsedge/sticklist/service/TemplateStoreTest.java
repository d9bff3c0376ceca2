package com.bmsedge.sticklist.service;

import com.bmsedge.sticklist.config.StickListProperties;
import com.bmsedge.sticklist.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.MockitoAnnotations;
import org.mockito.Spy;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class TemplateStoreTest {

    @Spy
    private StickListProperties properties = new StickListProperties();

    @InjectMocks
    private TemplateStore templateStore;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    @DisplayName("Should load the template from the filesystem")
    void testLoadFromFilesystem() throws Exception {
        Path template = Files.write(tempDir.resolve("Renee(B).xlsx"), new byte[]{4, 2});
        properties.setTemplatePath(template.toString());

        assertTrue(templateStore.hasDefaultTemplate());
        assertArrayEquals(new byte[]{4, 2}, templateStore.loadDefaultTemplate());
    }

    @Test
    @DisplayName("Should report a missing template")
    void testMissingTemplate() {
        properties.setTemplatePath(tempDir.resolve("missing.xlsx").toString());

        assertFalse(templateStore.hasDefaultTemplate());
        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class,
                () -> templateStore.loadDefaultTemplate());
        assertTrue(e.getMessage().startsWith("Missing template file:"));
    }
}

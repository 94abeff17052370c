package com.example.mediareconcile.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.mediareconcile.common.config.AppLibraryProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LibraryLayoutInitializerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldCreateMissingFormatDirectoriesOnce() throws Exception {
        Path root = tempDir.resolve("media");
        Files.createDirectories(root.resolve("kpop/video"));
        Map<String, String> categories = new LinkedHashMap<>();
        categories.put("kpop", "K-Pop");
        categories.put("jpop", "J-Pop");
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setRoot(root.toString());
        properties.setCategories(categories);
        LibraryLayoutInitializer initializer = new LibraryLayoutInitializer(properties);

        assertEquals(5, initializer.createLayout());
        assertEquals(0, initializer.createLayout());
        assertTrue(Files.isDirectory(root.resolve("jpop/flac")));
        assertTrue(Files.isDirectory(root.resolve("kpop/mp3")));
    }
}

package com.example.mediareconcile.application.service;

import com.example.mediareconcile.common.config.AppLibraryProperties;
import com.example.mediareconcile.domain.model.FormatKind;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Creates the {@code <root>/<category>/<format>} skeleton so new downloads have somewhere to land.
 */
@Component
public class LibraryLayoutInitializer {

    private static final Logger log = LoggerFactory.getLogger(LibraryLayoutInitializer.class);

    private final AppLibraryProperties properties;

    public LibraryLayoutInitializer(AppLibraryProperties properties) {
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.isCreateOnStartup()) {
            return;
        }
        int created = createLayout();
        log.info("LIBRARY_LAYOUT_READY root={} createdDirs={}", properties.rootPath(), created);
    }

    /**
     * @return number of directories that did not exist before
     */
    public int createLayout() {
        Path root = properties.rootPath();
        int created = 0;
        for (String categoryKey : properties.categoryVocabulary().keySet()) {
            for (FormatKind kind : FormatKind.values()) {
                Path dir = root.resolve(categoryKey).resolve(properties.directoryName(kind));
                if (Files.isDirectory(dir)) {
                    continue;
                }
                try {
                    Files.createDirectories(dir);
                    created++;
                } catch (IOException e) {
                    log.warn("LIBRARY_LAYOUT_CREATE_FAILED dir={} reason={}", dir, e.getMessage());
                }
            }
        }
        return created;
    }
}

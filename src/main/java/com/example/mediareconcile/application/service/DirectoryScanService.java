package com.example.mediareconcile.application.service;

import com.example.mediareconcile.common.config.AppLibraryProperties;
import com.example.mediareconcile.common.exception.BusinessException;
import com.example.mediareconcile.domain.model.CategoryScan;
import com.example.mediareconcile.domain.model.FormatKind;
import com.example.mediareconcile.domain.model.LibraryScanResult;
import com.example.mediareconcile.domain.model.MediaFile;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Walks {@code <root>/<category>/<format>/<file>}. Missing category or format directories are
 * empty slots, never errors. Directories inside a format slot are not descended into.
 */
@Service
public class DirectoryScanService {

    private static final Logger log = LoggerFactory.getLogger(DirectoryScanService.class);

    private final AppLibraryProperties properties;
    private final MetadataExtractionService metadataExtractionService;
    private final MeterRegistry meterRegistry;

    public DirectoryScanService(AppLibraryProperties properties,
                                MetadataExtractionService metadataExtractionService,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.properties = properties;
        this.metadataExtractionService = metadataExtractionService;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public LibraryScanResult scanLibrary() {
        long startedAtNanos = System.nanoTime();
        Path root = properties.rootPath();
        LibraryScanResult result = new LibraryScanResult();
        result.setRoot(root.toString());

        for (Map.Entry<String, String> category : properties.categoryVocabulary().entrySet()) {
            if (!Files.isDirectory(root.resolve(category.getKey()))) {
                continue;
            }
            CategoryScan scan = scanCategory(category.getKey());
            result.getCategories().put(category.getKey(), scan);
            result.setTotalFiles(result.getTotalFiles() + scan.totalCount());
        }

        long costNanos = System.nanoTime() - startedAtNanos;
        log.info("LIBRARY_SCAN_FINISH root={} categories={} totalFiles={} costMs={}",
                root, result.getCategories().size(), result.getTotalFiles(),
                TimeUnit.NANOSECONDS.toMillis(costNanos));
        incrementCounter("media.scan.files", result.getTotalFiles());
        recordDuration("media.scan.latency", costNanos);
        return result;
    }

    /**
     * Scans one category with tag extraction. A known category without a directory yields an empty scan.
     */
    public CategoryScan scanCategory(String categoryKey) {
        requireKnownCategory(categoryKey);
        CategoryScan scan = new CategoryScan();
        scan.setCategoryKey(categoryKey);
        scan.setDisplayName(properties.displayName(categoryKey));

        for (FormatKind kind : FormatKind.values()) {
            List<MediaFile> files = new ArrayList<>();
            for (Path path : listFormatDirectory(categoryKey, kind, true)) {
                files.add(toMediaFile(path, kind));
            }
            scan.getFiles().put(kind, files);
        }
        log.debug("CATEGORY_SCAN category={} compressed={} lossless={} video={} balanced={}",
                categoryKey, scan.count(FormatKind.COMPRESSED_AUDIO), scan.count(FormatKind.LOSSLESS_AUDIO),
                scan.count(FormatKind.VIDEO), scan.isBalanced());
        return scan;
    }

    /**
     * Regular files directly under one format directory, in name order.
     *
     * @param applyAllowList when false every regular file is returned regardless of extension
     */
    public List<Path> listFormatDirectory(String categoryKey, FormatKind kind, boolean applyAllowList) {
        requireKnownCategory(categoryKey);
        Path root = properties.rootPath();
        Path formatDir = root.resolve(categoryKey).resolve(properties.directoryName(kind));
        if (!Files.isDirectory(formatDir)) {
            return new ArrayList<>();
        }
        Set<String> allowed = properties.allowedExtensions(kind);
        try (Stream<Path> entries = Files.list(formatDir)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> !applyAllowList || allowed.contains(extensionOf(path)))
                    .filter(path -> insideLibrary(root, path))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("FORMAT_DIR_LIST_FAILED dir={} reason={}", formatDir, e.getMessage());
            return new ArrayList<>();
        }
    }

    private MediaFile toMediaFile(Path path, FormatKind kind) {
        MediaFile file = new MediaFile();
        file.setName(path.getFileName().toString());
        file.setPath(path.toAbsolutePath().toString());
        file.setSizeBytes(sizeOf(path));
        file.setFormatKind(kind);
        file.setTags(metadataExtractionService.extract(path, kind));
        return file;
    }

    /**
     * Real-path containment check. Covers a linked file as well as a linked category or format
     * directory, since either one moves the file's real path out of the root.
     */
    private boolean insideLibrary(Path root, Path path) {
        if (properties.isFollowExternalLinks()) {
            return true;
        }
        try {
            boolean inside = path.toRealPath().startsWith(root.toRealPath());
            if (!inside) {
                log.debug("SCAN_SKIP_EXTERNAL_PATH path={}", path);
            }
            return inside;
        } catch (IOException e) {
            log.debug("SCAN_SKIP_UNRESOLVED_PATH path={} reason={}", path, e.getMessage());
            return false;
        }
    }

    private void requireKnownCategory(String categoryKey) {
        if (!properties.isKnownCategory(categoryKey)) {
            throw BusinessException.unknownCategory(categoryKey);
        }
    }

    private static String extensionOf(Path path) {
        return AppLibraryProperties.normalizeExtension(IdentityNormalizer.extensionOf(path.getFileName().toString()));
    }

    private static long sizeOf(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            // Removed between listing and stat.
            log.debug("FILE_SIZE_FAILED path={} reason={}", path, e.getMessage());
            return 0L;
        }
    }

    private void incrementCounter(String name, double amount) {
        if (meterRegistry == null || amount <= 0) {
            return;
        }
        try {
            meterRegistry.counter(name).increment(amount);
        } catch (Exception ex) {
            log.debug("Scan metric counter failed, name={}", name, ex);
        }
    }

    private void recordDuration(String name, long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(name).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Scan metric timer failed, name={}", name, ex);
        }
    }
}

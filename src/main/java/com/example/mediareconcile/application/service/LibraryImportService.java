package com.example.mediareconcile.application.service;

import com.example.mediareconcile.common.config.AppLibraryProperties;
import com.example.mediareconcile.common.exception.BusinessException;
import com.example.mediareconcile.domain.model.CopyItem;
import com.example.mediareconcile.domain.model.CopyReport;
import com.example.mediareconcile.domain.model.FormatKind;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Copies external files into a category, routing each into its format directory by extension.
 * Existing destinations are reported as duplicates and never overwritten.
 */
@Service
public class LibraryImportService {

    private static final Logger log = LoggerFactory.getLogger(LibraryImportService.class);

    static final String ERROR_NOT_FOUND = "File does not exist";
    static final String ERROR_UNSUPPORTED = "Unsupported file format";

    private final AppLibraryProperties properties;
    private final MetadataExtractionService metadataExtractionService;
    private final MeterRegistry meterRegistry;

    public LibraryImportService(AppLibraryProperties properties,
                                MetadataExtractionService metadataExtractionService,
                                ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.properties = properties;
        this.metadataExtractionService = metadataExtractionService;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public CopyReport copyFiles(List<String> sourcePaths, String targetCategory) {
        if (!properties.isKnownCategory(targetCategory)) {
            throw BusinessException.unknownCategory(targetCategory);
        }
        if (sourcePaths == null || sourcePaths.isEmpty()) {
            throw new BusinessException("400", "No source files given");
        }
        Path categoryDir = properties.rootPath().resolve(targetCategory);
        CopyReport report = new CopyReport();
        for (String sourcePath : sourcePaths) {
            report.incrementTotalProcessed();
            copyOne(sourcePath, categoryDir, report);
        }
        log.info("LIBRARY_COPY_FINISH category={} total={} success={} duplicates={} failed={}",
                targetCategory, report.getTotalProcessed(), report.getSuccess().size(),
                report.getDuplicates().size(), report.getFailed().size());
        return report;
    }

    private void copyOne(String sourcePath, Path categoryDir, CopyReport report) {
        if (sourcePath == null || sourcePath.trim().isEmpty()) {
            fail(report, sourcePath, ERROR_NOT_FOUND);
            return;
        }
        Path source;
        try {
            source = Paths.get(sourcePath);
        } catch (InvalidPathException e) {
            fail(report, sourcePath, ERROR_NOT_FOUND);
            return;
        }
        if (!Files.exists(source)) {
            fail(report, sourcePath, ERROR_NOT_FOUND);
            return;
        }
        String fileName = source.getFileName() == null ? "" : source.getFileName().toString();
        FormatKind kind = properties.routeByExtension(IdentityNormalizer.extensionOf(fileName));
        if (kind == null || !Files.isRegularFile(source)) {
            fail(report, sourcePath, ERROR_UNSUPPORTED);
            return;
        }

        Path target = categoryDir.resolve(properties.directoryName(kind)).resolve(fileName);
        if (Files.exists(target)) {
            duplicate(report, sourcePath, target);
            return;
        }
        try {
            Files.createDirectories(target.getParent());
            // Without REPLACE_EXISTING a concurrent writer surfaces as FileAlreadyExistsException.
            Files.copy(source, target, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (FileAlreadyExistsException e) {
            duplicate(report, sourcePath, target);
            return;
        } catch (IOException e) {
            log.warn("LIBRARY_COPY_FAILED source={} target={} reason={}", sourcePath, target, e.getMessage());
            fail(report, sourcePath, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            return;
        }
        report.getSuccess().add(CopyItem.success(sourcePath, target.toString(),
                metadataExtractionService.extract(target, kind)));
        recordOutcome("success");
    }

    private void duplicate(CopyReport report, String sourcePath, Path target) {
        log.debug("LIBRARY_COPY_DUPLICATE source={} target={}", sourcePath, target);
        report.getDuplicates().add(CopyItem.duplicate(sourcePath, target.toString()));
        recordOutcome("duplicate");
    }

    private void fail(CopyReport report, String sourcePath, String error) {
        report.getFailed().add(CopyItem.failed(sourcePath, error));
        recordOutcome("failed");
    }

    private void recordOutcome(String outcome) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter("media.copy.result", "outcome", outcome).increment();
        } catch (Exception ex) {
            log.debug("Copy metric counter failed, outcome={}", outcome, ex);
        }
    }
}

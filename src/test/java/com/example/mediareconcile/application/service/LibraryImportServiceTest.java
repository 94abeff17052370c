package com.example.mediareconcile.application.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import com.example.mediareconcile.common.config.AppLibraryProperties;
import com.example.mediareconcile.common.exception.BusinessException;
import com.example.mediareconcile.domain.model.CopyItem;
import com.example.mediareconcile.domain.model.CopyReport;
import com.example.mediareconcile.infrastructure.parser.AudioMetadataParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class LibraryImportServiceTest {

    @TempDir
    Path tempDir;

    private Path root;
    private Path downloads;
    private SimpleMeterRegistry meterRegistry;
    private LibraryImportService libraryImportService;

    @BeforeEach
    void setUp() throws IOException {
        root = tempDir.resolve("media");
        downloads = Files.createDirectories(tempDir.resolve("downloads"));
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setRoot(root.toString());
        meterRegistry = new SimpleMeterRegistry();
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", meterRegistry);
        libraryImportService = new LibraryImportService(
                properties,
                new MetadataExtractionService(mock(AudioMetadataParser.class)),
                beanFactory.getBeanProvider(MeterRegistry.class));
    }

    @Test
    void existingTargetShouldBeReportedAsDuplicateAndLeftUntouched() throws IOException {
        Path source = write(downloads.resolve("Dynamite.mp3"), "new bytes");
        Path existing = write(root.resolve("kpop/mp3/Dynamite.mp3"), "original bytes");

        CopyReport report = libraryImportService.copyFiles(Collections.singletonList(source.toString()), "kpop");

        assertEquals(1, report.getDuplicates().size());
        assertTrue(report.getSuccess().isEmpty());
        assertEquals(existing.toString(), report.getDuplicates().get(0).getTarget());
        assertArrayEquals("original bytes".getBytes(StandardCharsets.UTF_8), Files.readAllBytes(existing));
        assertTrue(Files.exists(source));
        assertEquals(1.0D, meterRegistry.find("media.copy.result").tag("outcome", "duplicate").counter().count());
    }

    @Test
    void filesShouldBeRoutedByExtension() throws IOException {
        Path mp3 = write(downloads.resolve("a.mp3"), "1");
        Path flac = write(downloads.resolve("b.FLAC"), "2");
        Path wav = write(downloads.resolve("c.wav"), "3");
        Path mkv = write(downloads.resolve("d.mkv"), "4");

        CopyReport report = libraryImportService.copyFiles(
                Arrays.asList(mp3.toString(), flac.toString(), wav.toString(), mkv.toString()), "jpop");

        assertEquals(4, report.getSuccess().size());
        assertEquals(4, report.getTotalProcessed());
        assertTrue(Files.exists(root.resolve("jpop/mp3/a.mp3")));
        assertTrue(Files.exists(root.resolve("jpop/flac/b.FLAC")));
        assertTrue(Files.exists(root.resolve("jpop/mp3/c.wav")));
        assertTrue(Files.exists(root.resolve("jpop/video/d.mkv")));
        CopyItem first = report.getSuccess().get(0);
        assertEquals("a", first.getTags().getTitle());
        assertEquals("MP3", first.getTags().getFormat());
    }

    @Test
    void badItemsShouldFailIndividuallyWithoutAbortingBatch() throws IOException {
        Path text = write(downloads.resolve("notes.txt"), "x");
        Path good = write(downloads.resolve("song.m4a"), "y");
        String missing = downloads.resolve("ghost.mp3").toString();

        CopyReport report = libraryImportService.copyFiles(
                Arrays.asList(text.toString(), missing, good.toString(), ""), "english");

        assertEquals(4, report.getTotalProcessed());
        assertEquals(1, report.getSuccess().size());
        assertEquals(3, report.getFailed().size());
        assertEquals(LibraryImportService.ERROR_UNSUPPORTED, report.getFailed().get(0).getError());
        assertEquals(LibraryImportService.ERROR_NOT_FOUND, report.getFailed().get(1).getError());
        assertEquals(LibraryImportService.ERROR_NOT_FOUND, report.getFailed().get(2).getError());
    }

    @Test
    void sameFileTwiceInOneBatchShouldCopyOnceThenReportDuplicate() throws IOException {
        Path source = write(downloads.resolve("clip.webm"), "v");

        CopyReport report = libraryImportService.copyFiles(Arrays.asList(source.toString(), source.toString()), "cpop");

        assertEquals(1, report.getSuccess().size());
        assertEquals(1, report.getDuplicates().size());
    }

    @Test
    void unknownCategoryShouldBeRejectedBeforeCopying() throws IOException {
        Path source = write(downloads.resolve("a.mp3"), "1");

        assertThrows(BusinessException.class,
                () -> libraryImportService.copyFiles(Collections.singletonList(source.toString()), "metal"));
        assertTrue(Files.notExists(root));
    }

    private static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }
}

package com.example.mediareconcile.application.service;

import com.example.mediareconcile.domain.model.FormatKind;
import com.example.mediareconcile.domain.model.TagRecord;
import com.example.mediareconcile.infrastructure.parser.AudioMetadataParser;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Reads tags for a library file. Never throws: a file whose tags cannot be read gets a record
 * derived from its filename, so every file still yields an identity.
 */
@Service
public class MetadataExtractionService {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractionService.class);

    static final String UNKNOWN = "Unknown";

    private final AudioMetadataParser audioMetadataParser;

    public MetadataExtractionService(AudioMetadataParser audioMetadataParser) {
        this.audioMetadataParser = audioMetadataParser;
    }

    public TagRecord extract(Path file, FormatKind formatKind) {
        TagRecord parsed;
        try {
            parsed = audioMetadataParser.parse(file.toFile(), formatKind);
        } catch (Exception e) {
            log.warn("METADATA_EXTRACT_FAILED path={} kind={} reason={}", file, formatKind, e.getMessage());
            log.debug("Metadata extraction stack for {}", file, e);
            return fallback(file);
        }
        if (parsed == null) {
            return fallback(file);
        }
        return applyFallback(parsed, file);
    }

    /**
     * The degraded record used when no tag could be read at all.
     */
    public TagRecord fallback(Path file) {
        String fileName = fileNameOf(file);
        TagRecord record = new TagRecord();
        record.setTitle(IdentityNormalizer.stemOf(fileName));
        record.setArtist(UNKNOWN);
        record.setAlbum(UNKNOWN);
        record.setDurationSec(0);
        record.setBitrate(0);
        record.setFormat(formatOf(fileName));
        record.setExtracted(false);
        return record;
    }

    private TagRecord applyFallback(TagRecord parsed, Path file) {
        String fileName = fileNameOf(file);
        if (!StringUtils.hasText(parsed.getTitle())) {
            parsed.setTitle(IdentityNormalizer.stemOf(fileName));
        } else {
            parsed.setTitle(parsed.getTitle().trim());
        }
        if (!StringUtils.hasText(parsed.getArtist())) {
            parsed.setArtist(UNKNOWN);
        } else {
            parsed.setArtist(parsed.getArtist().trim());
        }
        if (!StringUtils.hasText(parsed.getAlbum())) {
            parsed.setAlbum(UNKNOWN);
        } else {
            parsed.setAlbum(parsed.getAlbum().trim());
        }
        parsed.setDurationSec(Math.max(0, parsed.getDurationSec()));
        parsed.setBitrate(Math.max(0, parsed.getBitrate()));
        parsed.setFormat(formatOf(fileName));
        parsed.setExtracted(true);
        return parsed;
    }

    private static String fileNameOf(Path file) {
        Path name = file.getFileName();
        return name == null ? file.toString() : name.toString();
    }

    private static String formatOf(String fileName) {
        return IdentityNormalizer.extensionOf(fileName).toUpperCase(Locale.ROOT);
    }
}

package com.example.mediareconcile.application.service;

import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds the comparison keys used to correlate one track across format directories and catalogs.
 * All methods are pure and idempotent.
 */
@Component
public class IdentityNormalizer {

    private static final Pattern NON_WORD_PATTERN =
            Pattern.compile("[^\\p{L}\\p{N}\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE_PATTERN =
            Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Key for completeness grouping, derived from a file stem (name without extension).
     */
    public String normalizeFilename(String stem) {
        return normalize(stem);
    }

    /**
     * Key for catalog matching, shaped as {@code "title - artist"} before normalization.
     */
    public String normalizeTrack(String title, String artist) {
        return normalize(nullToEmpty(title) + " - " + nullToEmpty(artist));
    }

    public String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.toLowerCase(Locale.ROOT);
        normalized = NON_WORD_PATTERN.matcher(normalized).replaceAll("");
        normalized = WHITESPACE_PATTERN.matcher(normalized).replaceAll(" ");
        return normalized.trim();
    }

    public static String stemOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(0, dotIndex) : fileName;
    }

    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(dotIndex + 1) : "";
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}

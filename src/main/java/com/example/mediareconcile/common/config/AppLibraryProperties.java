package com.example.mediareconcile.common.config;

import com.example.mediareconcile.domain.model.FormatKind;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.library")
public class AppLibraryProperties {

    private String root = "./media";

    /**
     * Category key to display name, in presentation order. Replaces the built-in five when set.
     */
    private Map<String, String> categories = new LinkedHashMap<>();

    private String compressedDir = "mp3";

    private String losslessDir = "flac";

    private String videoDir = "video";

    private List<String> audioExtensions = new ArrayList<>(Arrays.asList("mp3", "flac", "wav", "m4a", "aac"));

    private List<String> videoExtensions = new ArrayList<>(Arrays.asList("mp4", "mkv", "avi", "webm", "mov"));

    /**
     * Audio extensions routed to the lossless directory on import. Other audio goes to the compressed directory.
     */
    private List<String> losslessExtensions = new ArrayList<>(Arrays.asList("flac"));

    /**
     * Whether symbolic links resolving outside the library root are listed during a scan.
     */
    private boolean followExternalLinks = false;

    /**
     * Whether the category/format directory skeleton is created at startup.
     */
    private boolean createOnStartup = true;

    public Path rootPath() {
        return Paths.get(root).toAbsolutePath().normalize();
    }

    /**
     * Configured categories, or the built-in vocabulary when none are bound.
     */
    public Map<String, String> categoryVocabulary() {
        if (categories == null || categories.isEmpty()) {
            return defaultCategories();
        }
        return categories;
    }

    public boolean isKnownCategory(String categoryKey) {
        return categoryKey != null && categoryVocabulary().containsKey(categoryKey);
    }

    public String displayName(String categoryKey) {
        String name = categoryVocabulary().get(categoryKey);
        return name == null ? categoryKey : name;
    }

    public String directoryName(FormatKind kind) {
        switch (kind) {
            case COMPRESSED_AUDIO:
                return compressedDir;
            case LOSSLESS_AUDIO:
                return losslessDir;
            default:
                return videoDir;
        }
    }

    public Set<String> allowedExtensions(FormatKind kind) {
        return kind.isAudio() ? normalize(audioExtensions) : normalize(videoExtensions);
    }

    /**
     * Target format directory for an imported file, or {@code null} when the extension is not supported.
     */
    public FormatKind routeByExtension(String extension) {
        String ext = normalizeExtension(extension);
        if (ext.isEmpty()) {
            return null;
        }
        if (normalize(audioExtensions).contains(ext)) {
            return normalize(losslessExtensions).contains(ext) ? FormatKind.LOSSLESS_AUDIO : FormatKind.COMPRESSED_AUDIO;
        }
        if (normalize(videoExtensions).contains(ext)) {
            return FormatKind.VIDEO;
        }
        return null;
    }

    public static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        return extension.trim().toLowerCase(Locale.ROOT).replaceFirst("^\\.", "");
    }

    private static Set<String> normalize(List<String> extensions) {
        return extensions.stream()
                .filter(item -> item != null && !item.trim().isEmpty())
                .map(AppLibraryProperties::normalizeExtension)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static Map<String, String> defaultCategories() {
        Map<String, String> categories = new LinkedHashMap<>();
        categories.put("kpop", "K-Pop");
        categories.put("jpop", "J-Pop");
        categories.put("english", "English");
        categories.put("cpop", "C-Pop");
        categories.put("custom", "Custom");
        return categories;
    }
}

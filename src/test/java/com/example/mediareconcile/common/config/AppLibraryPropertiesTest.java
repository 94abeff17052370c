package com.example.mediareconcile.common.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.mediareconcile.domain.model.FormatKind;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

class AppLibraryPropertiesTest {

    @Test
    void configuredCategoriesShouldReplaceBuiltInVocabulary() {
        Map<String, String> source = new HashMap<>();
        source.put("app.library.categories.rock", "Rock");
        source.put("app.library.categories.jazz", "Jazz");

        AppLibraryProperties properties = bind(source);

        assertEquals(2, properties.categoryVocabulary().size());
        assertTrue(properties.isKnownCategory("rock"));
        assertTrue(properties.isKnownCategory("jazz"));
        assertFalse(properties.isKnownCategory("kpop"));
        assertEquals("Jazz", properties.displayName("jazz"));
    }

    @Test
    void unboundCategoriesShouldFallBackToBuiltInFive() {
        Map<String, String> source = new HashMap<>();
        source.put("app.library.root", "/srv/media");

        AppLibraryProperties properties = bind(source);

        assertEquals(Arrays.asList("kpop", "jpop", "english", "cpop", "custom"),
                new ArrayList<>(properties.categoryVocabulary().keySet()));
        assertEquals("K-Pop", properties.displayName("kpop"));
    }

    @Test
    void importRoutingShouldFollowConfiguredExtensions() {
        Map<String, String> source = new HashMap<>();
        source.put("app.library.lossless-extensions", "flac,wav");

        AppLibraryProperties properties = bind(source);

        assertEquals(FormatKind.LOSSLESS_AUDIO, properties.routeByExtension(".WAV"));
        assertEquals(FormatKind.COMPRESSED_AUDIO, properties.routeByExtension("m4a"));
        assertEquals(FormatKind.VIDEO, properties.routeByExtension("mkv"));
        assertNull(properties.routeByExtension("txt"));
    }

    private static AppLibraryProperties bind(Map<String, String> source) {
        Binder binder = new Binder(new MapConfigurationPropertySource(source));
        return binder.bindOrCreate("app.library", Bindable.ofInstance(new AppLibraryProperties()));
    }
}

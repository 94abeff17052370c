package com.example.mediareconcile.api.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.mediareconcile.api.request.MatchCatalogRequest;
import com.example.mediareconcile.api.response.ApiResponse;
import com.example.mediareconcile.api.response.MediaDirectoryResponse;
import com.example.mediareconcile.application.service.CatalogMatchService;
import com.example.mediareconcile.application.service.CompletenessService;
import com.example.mediareconcile.application.service.DirectoryScanService;
import com.example.mediareconcile.application.service.LibraryImportService;
import com.example.mediareconcile.common.config.AppLibraryProperties;
import com.example.mediareconcile.domain.model.CatalogTrack;
import com.example.mediareconcile.domain.model.MatchResult;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class LibraryControllerTest {

    private CatalogMatchService catalogMatchService;
    private MockEnvironment environment;
    private LibraryController controller;

    @BeforeEach
    void setUp() {
        catalogMatchService = mock(CatalogMatchService.class);
        environment = new MockEnvironment();
        AppLibraryProperties properties = new AppLibraryProperties();
        properties.setRoot("/srv/media");
        controller = new LibraryController(
                mock(DirectoryScanService.class),
                mock(CompletenessService.class),
                catalogMatchService,
                mock(LibraryImportService.class),
                properties,
                environment);
    }

    @Test
    void inlineTracksShouldBypassCatalogClient() {
        List<CatalogTrack> tracks = Collections.singletonList(
                new CatalogTrack("1", "Dynamite", Collections.singletonList("BTS"), null, null));
        MatchResult expected = new MatchResult();
        when(catalogMatchService.match("kpop", tracks)).thenReturn(expected);
        MatchCatalogRequest request = new MatchCatalogRequest();
        request.setCategoryKey("kpop");
        request.setCatalogPlaylistId("ignored");
        request.setTracks(tracks);

        ApiResponse<MatchResult> response = controller.match(request);

        assertEquals(ApiResponse.SUCCESS_CODE, response.getCode());
        assertSame(expected, response.getData());
        verify(catalogMatchService, never()).matchWithCatalogPlaylist(anyString(), anyString());
    }

    @Test
    void playlistIdShouldDelegateToCatalogFetch() {
        MatchResult expected = new MatchResult();
        when(catalogMatchService.matchWithCatalogPlaylist("kpop", "pl-7")).thenReturn(expected);
        MatchCatalogRequest request = new MatchCatalogRequest();
        request.setCategoryKey("kpop");
        request.setCatalogPlaylistId("pl-7");

        assertSame(expected, controller.match(request).getData());
    }

    @Test
    void configShouldReportExternalDirectory() {
        MediaDirectoryResponse internal = controller.config().getData();
        assertFalse(internal.isExternalConfigured());
        assertEquals(5, internal.getCategories().size());

        environment.setProperty("EXTERNAL_MEDIA_DIR", "/mnt/nas/media");
        MediaDirectoryResponse external = controller.config().getData();

        assertTrue(external.isExternalConfigured());
        assertEquals("/mnt/nas/media", external.getExternalPath());
    }
}

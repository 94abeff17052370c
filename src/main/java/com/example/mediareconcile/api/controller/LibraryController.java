package com.example.mediareconcile.api.controller;

import com.example.mediareconcile.api.request.CopyFilesRequest;
import com.example.mediareconcile.api.request.MatchCatalogRequest;
import com.example.mediareconcile.api.response.ApiResponse;
import com.example.mediareconcile.api.response.MediaDirectoryResponse;
import com.example.mediareconcile.application.service.CatalogMatchService;
import com.example.mediareconcile.application.service.CompletenessService;
import com.example.mediareconcile.application.service.DirectoryScanService;
import com.example.mediareconcile.application.service.LibraryImportService;
import com.example.mediareconcile.common.config.AppLibraryProperties;
import com.example.mediareconcile.domain.model.CompletenessReport;
import com.example.mediareconcile.domain.model.CopyReport;
import com.example.mediareconcile.domain.model.LibraryScanResult;
import com.example.mediareconcile.domain.model.MatchResult;
import java.util.LinkedHashMap;
import javax.validation.Valid;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library")
public class LibraryController {

    static final String EXTERNAL_MEDIA_DIR = "EXTERNAL_MEDIA_DIR";

    private final DirectoryScanService directoryScanService;
    private final CompletenessService completenessService;
    private final CatalogMatchService catalogMatchService;
    private final LibraryImportService libraryImportService;
    private final AppLibraryProperties libraryProperties;
    private final Environment environment;

    public LibraryController(DirectoryScanService directoryScanService,
                             CompletenessService completenessService,
                             CatalogMatchService catalogMatchService,
                             LibraryImportService libraryImportService,
                             AppLibraryProperties libraryProperties,
                             Environment environment) {
        this.directoryScanService = directoryScanService;
        this.completenessService = completenessService;
        this.catalogMatchService = catalogMatchService;
        this.libraryImportService = libraryImportService;
        this.libraryProperties = libraryProperties;
        this.environment = environment;
    }

    @GetMapping("/scan")
    public ApiResponse<LibraryScanResult> scan() {
        return ApiResponse.success(directoryScanService.scanLibrary());
    }

    @GetMapping("/categories/{key}/missing")
    public ApiResponse<CompletenessReport> missingFormats(@PathVariable("key") String categoryKey) {
        return ApiResponse.success(completenessService.findMissingFormats(categoryKey));
    }

    @PostMapping("/copy")
    public ApiResponse<CopyReport> copy(@Valid @RequestBody CopyFilesRequest request) {
        return ApiResponse.success(libraryImportService.copyFiles(request.getSourcePaths(), request.getTargetCategory()));
    }

    @PostMapping("/match")
    public ApiResponse<MatchResult> match(@Valid @RequestBody MatchCatalogRequest request) {
        if (request.getTracks() != null) {
            return ApiResponse.success(catalogMatchService.match(request.getCategoryKey(), request.getTracks()));
        }
        return ApiResponse.success(catalogMatchService.matchWithCatalogPlaylist(
                request.getCategoryKey(), request.getCatalogPlaylistId()));
    }

    @GetMapping("/config")
    public ApiResponse<MediaDirectoryResponse> config() {
        String externalPath = environment.getProperty(EXTERNAL_MEDIA_DIR);
        MediaDirectoryResponse response = new MediaDirectoryResponse();
        response.setMediaDirectory(libraryProperties.rootPath().toString());
        response.setExternalConfigured(StringUtils.hasText(externalPath));
        response.setExternalPath(externalPath);
        response.setCategories(new LinkedHashMap<>(libraryProperties.categoryVocabulary()));
        return ApiResponse.success(response);
    }
}

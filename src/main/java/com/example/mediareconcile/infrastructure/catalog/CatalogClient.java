package com.example.mediareconcile.infrastructure.catalog;

import com.example.mediareconcile.domain.model.CatalogFetchResult;

/**
 * Remote track catalog, e.g. a streaming-service playlist. Implementations own authentication
 * and report its state through {@link CatalogFetchResult.Status} instead of throwing.
 */
public interface CatalogClient {

    CatalogFetchResult fetchPlaylistTracks(String catalogPlaylistId);
}

package com.example.mediareconcile.infrastructure.catalog;

import com.example.mediareconcile.domain.model.CatalogFetchResult;

/**
 * Used when no catalog integration is deployed.
 */
public class UnconfiguredCatalogClient implements CatalogClient {

    @Override
    public CatalogFetchResult fetchPlaylistTracks(String catalogPlaylistId) {
        return CatalogFetchResult.unconfigured("Catalog service is not configured");
    }
}

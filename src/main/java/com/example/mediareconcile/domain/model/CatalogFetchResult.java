package com.example.mediareconcile.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a catalog lookup. Only {@link Status#SUCCESS} carries tracks.
 */
@Data
@NoArgsConstructor
public class CatalogFetchResult {

    public enum Status {
        SUCCESS,
        UNAUTHENTICATED,
        UNCONFIGURED,
        TRANSIENT_ERROR
    }

    private Status status;

    private List<CatalogTrack> tracks = new ArrayList<>();

    private String message;

    public CatalogFetchResult(Status status, List<CatalogTrack> tracks, String message) {
        this.status = status;
        this.tracks = tracks == null ? new ArrayList<>() : tracks;
        this.message = message;
    }

    public static CatalogFetchResult success(List<CatalogTrack> tracks) {
        return new CatalogFetchResult(Status.SUCCESS, tracks, null);
    }

    public static CatalogFetchResult unauthenticated(String message) {
        return new CatalogFetchResult(Status.UNAUTHENTICATED, null, message);
    }

    public static CatalogFetchResult unconfigured(String message) {
        return new CatalogFetchResult(Status.UNCONFIGURED, null, message);
    }

    public static CatalogFetchResult transientError(String message) {
        return new CatalogFetchResult(Status.TRANSIENT_ERROR, null, message);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }
}

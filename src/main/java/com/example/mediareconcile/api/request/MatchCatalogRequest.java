package com.example.mediareconcile.api.request;

import com.example.mediareconcile.domain.model.CatalogTrack;
import java.util.List;
import javax.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class MatchCatalogRequest {

    @NotBlank
    private String categoryKey;

    /**
     * Playlist to fetch from the catalog service. Ignored when {@link #tracks} is supplied.
     */
    private String catalogPlaylistId;

    private List<CatalogTrack> tracks;
}

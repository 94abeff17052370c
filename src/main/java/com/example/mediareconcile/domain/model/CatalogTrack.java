package com.example.mediareconcile.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogTrack {

    private String id;

    private String title;

    private List<String> artists = new ArrayList<>();

    private String album;

    private Long durationMs;
}

package com.example.mediareconcile.domain.model;

import lombok.Data;

@Data
public class MediaFile {

    private String name;

    private String path;

    private long sizeBytes;

    private FormatKind formatKind;

    private TagRecord tags;
}

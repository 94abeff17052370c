package com.example.mediareconcile.domain.model;

import lombok.Data;

@Data
public class TagRecord {

    private String title;

    private String artist;

    private String album;

    private int durationSec;

    private int bitrate;

    /**
     * Upper-case file extension without the leading dot, e.g. {@code MP3}.
     */
    private String format;

    /**
     * False when the record was built from the filename because tag reading failed.
     */
    private boolean extracted;
}

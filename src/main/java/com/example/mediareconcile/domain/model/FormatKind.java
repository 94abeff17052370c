package com.example.mediareconcile.domain.model;

/**
 * The three parallel representations kept for every track of a category.
 */
public enum FormatKind {

    COMPRESSED_AUDIO(true),

    LOSSLESS_AUDIO(true),

    VIDEO(false);

    private final boolean audio;

    FormatKind(boolean audio) {
        this.audio = audio;
    }

    public boolean isAudio() {
        return audio;
    }
}

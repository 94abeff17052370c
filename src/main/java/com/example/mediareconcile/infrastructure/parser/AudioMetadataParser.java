package com.example.mediareconcile.infrastructure.parser;

import com.example.mediareconcile.domain.model.FormatKind;
import com.example.mediareconcile.domain.model.TagRecord;
import java.io.File;

public interface AudioMetadataParser {

    /**
     * Reads the tag block of a media file. Blank tag fields come back as {@code null}.
     */
    TagRecord parse(File mediaFile, FormatKind formatKind) throws Exception;
}

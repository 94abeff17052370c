package com.example.mediareconcile.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class CompletenessReport {

    private String categoryKey;

    private List<String> missingCompressedAudio = new ArrayList<>();

    private List<String> missingLosslessAudio = new ArrayList<>();

    private List<String> missingVideo = new ArrayList<>();

    private List<String> complete = new ArrayList<>();

    private List<CompletenessRecord> records = new ArrayList<>();

    private List<IdentityCollision> collisions = new ArrayList<>();

    public List<String> missing(FormatKind kind) {
        switch (kind) {
            case COMPRESSED_AUDIO:
                return missingCompressedAudio;
            case LOSSLESS_AUDIO:
                return missingLosslessAudio;
            default:
                return missingVideo;
        }
    }
}

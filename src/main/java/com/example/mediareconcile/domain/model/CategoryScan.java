package com.example.mediareconcile.domain.model;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class CategoryScan {

    private String categoryKey;

    private String displayName;

    private Map<FormatKind, List<MediaFile>> files = new EnumMap<>(FormatKind.class);

    public List<MediaFile> filesOf(FormatKind kind) {
        List<MediaFile> list = files.get(kind);
        return list == null ? new ArrayList<>() : list;
    }

    public int count(FormatKind kind) {
        return filesOf(kind).size();
    }

    public int totalCount() {
        int total = 0;
        for (FormatKind kind : FormatKind.values()) {
            total += count(kind);
        }
        return total;
    }

    /**
     * True when every format directory holds the same number of files.
     */
    public boolean isBalanced() {
        return count(FormatKind.COMPRESSED_AUDIO) == count(FormatKind.LOSSLESS_AUDIO)
                && count(FormatKind.LOSSLESS_AUDIO) == count(FormatKind.VIDEO);
    }

    public List<MediaFile> allFiles() {
        List<MediaFile> all = new ArrayList<>();
        for (FormatKind kind : FormatKind.values()) {
            all.addAll(filesOf(kind));
        }
        return all;
    }
}

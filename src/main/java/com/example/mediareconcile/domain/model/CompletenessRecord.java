package com.example.mediareconcile.domain.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import lombok.Data;

@Data
public class CompletenessRecord {

    private String identity;

    private String displayName;

    private Map<FormatKind, String> paths = new EnumMap<>(FormatKind.class);

    public Set<FormatKind> getPresentFormats() {
        return paths.isEmpty() ? EnumSet.noneOf(FormatKind.class) : EnumSet.copyOf(paths.keySet());
    }

    public boolean isComplete() {
        return paths.size() == FormatKind.values().length;
    }
}

package com.example.mediareconcile.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

@Data
public class LibraryScanResult {

    private String root;

    private Map<String, CategoryScan> categories = new LinkedHashMap<>();

    private int totalFiles;
}

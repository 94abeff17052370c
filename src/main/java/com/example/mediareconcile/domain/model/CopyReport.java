package com.example.mediareconcile.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class CopyReport {

    private List<CopyItem> success = new ArrayList<>();

    private List<CopyItem> failed = new ArrayList<>();

    private List<CopyItem> duplicates = new ArrayList<>();

    private int totalProcessed;

    public void incrementTotalProcessed() {
        totalProcessed++;
    }
}

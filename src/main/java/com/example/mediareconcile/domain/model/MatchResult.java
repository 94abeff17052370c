package com.example.mediareconcile.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class MatchResult {

    private List<String> matched = new ArrayList<>();

    private List<String> localOnly = new ArrayList<>();

    private List<String> catalogOnly = new ArrayList<>();

    private Map<String, FuzzyMatch> fuzzyMatches = new LinkedHashMap<>();
}

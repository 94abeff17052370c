package com.example.mediareconcile.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class FuzzyMatch {

    /**
     * Catalog identity closest to the local identity.
     */
    private String match;

    private double score;
}

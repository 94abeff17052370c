package com.example.mediareconcile.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two files of one format that normalize to the same identity. The later file replaced the earlier one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdentityCollision {

    private String categoryKey;

    private String identity;

    private FormatKind formatKind;

    private String keptPath;

    private String discardedPath;
}

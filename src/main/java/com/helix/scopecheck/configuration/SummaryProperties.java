package com.helix.scopecheck.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Pre-filter caps of the diff summarizer and the repository map, applied before token budgeting.
 */
@Data
public class SummaryProperties {

    @Min(0)
    private int maxExcerpts = 8;

    @Min(80)
    private int maxHunkChars = 1200;

    /**
     * Files listed in the repository map; 0 leaves the map out.
     */
    @Min(0)
    private int repoMapMaxFiles = 200;
}

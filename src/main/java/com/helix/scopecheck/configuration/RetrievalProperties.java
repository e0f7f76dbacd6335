package com.helix.scopecheck.configuration;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Hybrid retrieval settings. Weights are relative; they are normalized to sum to 1.
 */
@Data
public class RetrievalProperties {

    @DecimalMin("0.0")
    private double vectorWeight = 1.0;

    @DecimalMin("0.0")
    private double graphWeight = 1.0;

    @DecimalMin("0.0")
    private double relationalWeight = 1.0;

    /**
     * Maximum hop count for graph traversal from nodes matching the change.
     */
    @Min(1)
    private int maxHops = 2;

    /**
     * Maximum chunks read from the relational surface.
     */
    @Min(1)
    private int relationalLimit = 10;

    /**
     * Upper bound for each retrieval source call.
     */
    @Min(1)
    private int timeoutSeconds = 20;
}

package com.purchasingpower.contextgraph.configuration;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class BatchProperties {

    /**
     * Records compressed concurrently per chunk.
     */
    @Min(1)
    @Max(16)
    private int chunkSize = 3;

    @Min(1)
    private int poolSize = 4;

    @Min(0)
    private int queueCapacity = 100;

    @Min(1)
    private int targetTokensPerContext = 5000;
}

package com.prowl.kgindex.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class IngestionProperties {

    /**
     * Threads used to embed and extract chunks of one document in parallel.
     */
    @Min(1)
    private int poolSize = 4;

    @Min(0)
    private int queueCapacity = 200;
}

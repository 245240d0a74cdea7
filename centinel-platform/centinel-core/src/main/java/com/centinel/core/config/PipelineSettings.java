package com.centinel.core.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Execution settings of the audit pipeline.
 *
 * @param workers   number of sources processed in parallel, {@code 1} is sequential
 * @param storeRoot directory of the file-system snapshot store
 */
public record PipelineSettings(
        @JsonProperty("workers") int workers,
        @JsonProperty("store_root") String storeRoot
) {

    public static final int DEFAULT_WORKERS = 4;
    public static final String DEFAULT_STORE_ROOT = "data/centinel";

    public static PipelineSettings defaults() {
        return new PipelineSettings(DEFAULT_WORKERS, DEFAULT_STORE_ROOT);
    }

    @JsonCreator
    static PipelineSettings fromJson(@JsonProperty("workers") Integer workers,
                                     @JsonProperty("store_root") String storeRoot) {
        return new PipelineSettings(
                workers != null ? workers : DEFAULT_WORKERS,
                storeRoot != null ? storeRoot : DEFAULT_STORE_ROOT);
    }

    public void validate() {
        if (workers < 1) {
            throw new ConfigurationException("pipeline.workers must be at least 1: " + workers);
        }
        if (storeRoot == null || storeRoot.isBlank()) {
            throw new ConfigurationException("pipeline.store_root cannot be blank");
        }
    }
}

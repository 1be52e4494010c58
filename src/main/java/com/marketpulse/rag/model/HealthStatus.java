package com.marketpulse.rag.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthStatus(
    String status,
    @JsonProperty("documents_count") int documentCount,
    @JsonProperty("index_size") int indexSize,
    @JsonProperty("embedding_model_ready") boolean embeddingModelReady,
    int dimension,
    boolean consistent,
    @JsonProperty("persistence_error") String persistenceError
) {
    public static final String HEALTHY = "healthy";
    public static final String UNHEALTHY = "unhealthy";
    public static final String INITIALIZING = "initializing";

    @JsonIgnore
    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}

package com.marketpulse.rag.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.OffsetDateTime;

public record IndexStats(
    @JsonProperty("index_size") int indexSize,
    @JsonProperty("documents_count") int documentCount,
    @JsonProperty("embedding_model") String embeddingModel,
    @JsonProperty("index_dimension") int indexDimension,
    @JsonProperty("cache_size") long cacheSize,
    @JsonProperty("cache_hits") long cacheHits,
    @JsonProperty("cache_misses") long cacheMisses,
    @JsonProperty("last_updated") OffsetDateTime lastUpdated
) {}

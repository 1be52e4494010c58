package com.marketpulse.rag.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.marketpulse.rag.model.AddDocumentsResult;

public record AddDocumentsResponse(
    @JsonProperty("added_count") int addedCount,
    @JsonProperty("skipped_count") int skippedCount,
    @JsonProperty("failed_count") int failedCount,
    String source,
    @JsonProperty("total_documents") int totalDocuments
) {
    public static AddDocumentsResponse from(AddDocumentsResult result) {
        return new AddDocumentsResponse(
            result.addedCount(),
            result.skippedCount(),
            result.failedCount(),
            result.source(),
            result.totalDocuments()
        );
    }
}

package com.marketpulse.rag.model;

/**
 * Outcome of one ingestion batch.
 *
 * @param addedCount documents appended to the index
 * @param skippedCount inputs dropped for blank content
 * @param failedCount inputs dropped because their embedding could not be computed
 * @param source the batch default source
 * @param totalDocuments document count after the batch
 */
public record AddDocumentsResult(
    int addedCount,
    int skippedCount,
    int failedCount,
    String source,
    int totalDocuments
) {}

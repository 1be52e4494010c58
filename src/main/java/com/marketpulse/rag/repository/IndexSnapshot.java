package com.marketpulse.rag.repository;

import com.marketpulse.rag.model.Document;

import java.util.List;

public record IndexSnapshot(
    int dimension,
    List<float[]> vectors,
    List<Document> documents
) {
    public IndexSnapshot {
        if (vectors.size() != documents.size()) {
            throw new IllegalArgumentException(String.format(
                "Snapshot holds %d vectors but %d documents", vectors.size(), documents.size()));
        }
        vectors = List.copyOf(vectors);
        documents = List.copyOf(documents);
    }

    public int size() {
        return documents.size();
    }
}

package com.marketpulse.rag.service;

public interface EmbeddingService {

    /**
     * Computes the raw (not normalized) embedding of {@code text}.
     *
     * @throws com.marketpulse.rag.exception.EmbeddingException when the provider fails
     */
    float[] embed(String text);

    int dimension();

    String modelName();

    /**
     * False while the most recent call to the provider failed.
     */
    boolean isReady();
}

package com.marketpulse.rag.service;

import com.marketpulse.rag.config.RetrievalProperties;
import com.marketpulse.rag.exception.EmbeddingException;
import com.marketpulse.rag.infra.RateLimiter;
import dev.langchain4j.exception.RetriableException;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;
    private final String modelName;
    private final int dimension;
    private final int maxInputChars;
    private final AtomicBoolean ready = new AtomicBoolean(true);

    public EmbeddingServiceImpl(
        EmbeddingModel embeddingModel,
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        RetrievalProperties properties
    ) {
        this.embeddingModel = embeddingModel;
        this.embeddingLimiter = embeddingLimiter;
        this.modelName = properties.embedding().modelName();
        this.dimension = properties.embedding().dimension();
        this.maxInputChars = properties.embedding().maxInputChars();
    }

    @Override
    @Retryable(
        retryFor = RetriableException.class,
        notRecoverable = {EmbeddingException.class, IllegalArgumentException.class},
        maxAttemptsExpression = "${app.rag.embedding.max-attempts:3}",
        backoff = @Backoff(
            delayExpression = "${app.rag.embedding.retry-delay-ms:500}",
            multiplier = 2.0
        )
    )
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text to embed cannot be empty");
        }

        String input = text;
        if (input.length() > maxInputChars) {
            input = input.substring(0, maxInputChars);
            log.warn("Text of {} chars was truncated to {} chars for embedding", text.length(), maxInputChars);
        }

        float[] vector;
        try {
            String request = input;
            int estimatedTokens = Math.max(1, request.length() / 4);
            vector = embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens,
                () -> embeddingModel.embed(request).content().vector());
        } catch (RetriableException e) {
            ready.set(false);
            log.warn("Transient embedding failure from {}: {}", modelName, e.getMessage());
            throw e;
        } catch (Exception e) {
            ready.set(false);
            log.error("Failed to generate embedding with {}", modelName, e);
            throw new EmbeddingException("Error during text vectorization", e);
        }

        if (vector == null || vector.length == 0) {
            ready.set(false);
            throw new EmbeddingException("Embedding model returned an empty vector");
        }
        if (vector.length != dimension) {
            ready.set(false);
            throw new EmbeddingException(String.format(
                "Embedding model %s returned %d dimensions, expected %d", modelName, vector.length, dimension));
        }

        ready.set(true);
        return vector;
    }

    @Recover
    public float[] recover(RetriableException e, String text) {
        log.error("Embedding provider {} still failing after retries: {}", modelName, e.getMessage());
        throw new EmbeddingException("Embedding provider unavailable", e);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    @Override
    public boolean isReady() {
        return ready.get();
    }
}

package com.marketpulse.rag.exception;

/**
 * The embedding provider could not produce a usable vector. Callers may retry.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}

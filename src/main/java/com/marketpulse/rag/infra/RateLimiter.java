package com.marketpulse.rag.infra;

import java.util.function.Supplier;

public interface RateLimiter {

    /**
     * Blocks until one request and {@code tokens} tokens are available for {@code key}.
     */
    void acquire(String key, int tokens);

    default <T> T execute(String key, int tokens, Supplier<T> task) {
        acquire(key, tokens);
        return task.get();
    }
}

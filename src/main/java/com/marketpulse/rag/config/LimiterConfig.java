package com.marketpulse.rag.config;

import com.marketpulse.rag.infra.InMemoryDualRateLimiter;
import com.marketpulse.rag.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(RetrievalProperties properties) {
        return new InMemoryDualRateLimiter(
            properties.embedding().requestsPerMinute(),
            properties.embedding().tokensPerMinute()
        );
    }
}

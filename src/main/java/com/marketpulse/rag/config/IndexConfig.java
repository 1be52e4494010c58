package com.marketpulse.rag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.rag.repository.FileSnapshotRepository;
import com.marketpulse.rag.repository.SnapshotRepository;
import com.marketpulse.rag.service.EmbeddingCache;
import com.marketpulse.rag.service.EmbeddingService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IndexConfig {

    @Bean
    public SnapshotRepository snapshotRepository(RetrievalProperties properties, ObjectMapper objectMapper) {
        return new FileSnapshotRepository(properties.indexDir(), objectMapper);
    }

    @Bean
    public EmbeddingCache embeddingCache(RetrievalProperties properties, EmbeddingService embeddingService) {
        return new EmbeddingCache(
            embeddingService,
            properties.cache().maxEntries(),
            properties.cache().directory()
        );
    }
}

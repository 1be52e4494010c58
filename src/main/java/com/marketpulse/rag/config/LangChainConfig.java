package com.marketpulse.rag.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Selects the embedding model with {@code app.rag.embedding.provider}: the
 * in-process all-MiniLM-L6-v2 model ({@code local}, default) or Gemini.
 */
@Slf4j
@Configuration
public class LangChainConfig {

    @Bean
    @ConditionalOnProperty(name = "app.rag.embedding.provider", havingValue = "local", matchIfMissing = true)
    public EmbeddingModel localEmbeddingModel() {
        log.info("Using in-process all-MiniLM-L6-v2 embedding model");
        return new AllMiniLmL6V2EmbeddingModel();
    }

    @Bean
    @ConditionalOnProperty(name = "app.rag.embedding.provider", havingValue = "gemini")
    public EmbeddingModel geminiEmbeddingModel(RetrievalProperties properties) {
        RetrievalProperties.Embedding embedding = properties.embedding();
        if (embedding.apiKey() == null || embedding.apiKey().isBlank()) {
            throw new IllegalStateException("app.rag.embedding.api-key is required for the gemini provider");
        }
        log.info("Using Gemini embedding model {} with {} dimensions", embedding.modelName(), embedding.dimension());
        return GoogleAiEmbeddingModel.builder()
            .apiKey(embedding.apiKey())
            .modelName(embedding.modelName())
            .outputDimensionality(embedding.dimension())
            .timeout(Duration.ofSeconds(60))
            .maxRetries(2)
            .build();
    }
}

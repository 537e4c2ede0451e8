package com.nevis.codeindex.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.googleai.GoogleAiEmbeddingModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key}")
    private String apiKey;

    @Value("${app.gemini.embedding-model:gemini-embedding-001}")
    private String modelName;

    @Value("${app.gemini.timeout:PT60S}")
    private Duration timeout;

    @Bean
    public EmbeddingModel embeddingModel(IndexingProperties properties) {
        // retries are owned by the embedding service
        return GoogleAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .outputDimensionality(properties.embedding().dimension())
            .timeout(timeout)
            .maxRetries(1)
            .build();
    }
}

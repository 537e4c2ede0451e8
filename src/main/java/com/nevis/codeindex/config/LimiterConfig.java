package com.nevis.codeindex.config;

import com.nevis.codeindex.infra.EmbeddingConcurrencyGate;
import com.nevis.codeindex.infra.InMemoryDualRateLimiter;
import com.nevis.codeindex.infra.RateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("embeddingLimiter")
    public RateLimiter embeddingLimiter(IndexingProperties properties) {
        return new InMemoryDualRateLimiter(
            properties.embedding().requestsPerMinute(),
            properties.embedding().tokensPerMinute());
    }

    @Bean
    public EmbeddingConcurrencyGate embeddingConcurrencyGate(IndexingProperties properties) {
        return new EmbeddingConcurrencyGate(properties.embedding().maxConcurrency());
    }
}

package com.nevis.codeindex.service;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.exception.EmbeddingException;
import com.nevis.codeindex.exception.TransientProviderException;
import com.nevis.codeindex.infra.EmbeddingConcurrencyGate;
import com.nevis.codeindex.infra.RateLimiter;
import com.nevis.codeindex.infra.SecretScrubber;
import com.nevis.codeindex.infra.TransientErrors;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.parsing.TokenEstimator;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

@Service
@Slf4j
public class EmbeddingServiceImpl implements EmbeddingService {

    public static final String EMBEDDING_LIMIT = "embedding_limit";

    private static final int MAX_QUERY_CHARS = 2_000;

    private final EmbeddingModel embeddingModel;
    private final RateLimiter embeddingLimiter;
    private final EmbeddingConcurrencyGate concurrencyGate;
    private final RetryTemplate retryTemplate;
    private final int dimension;
    private final int maxAttempts;

    public EmbeddingServiceImpl(
        @Qualifier("embeddingLimiter") RateLimiter embeddingLimiter,
        EmbeddingConcurrencyGate concurrencyGate,
        EmbeddingModel embeddingModel,
        IndexingProperties properties
    ) {
        this.embeddingLimiter = embeddingLimiter;
        this.concurrencyGate = concurrencyGate;
        this.embeddingModel = embeddingModel;
        this.dimension = properties.embedding().dimension();
        this.maxAttempts = properties.embedding().maxAttempts();
        this.retryTemplate = RetryTemplate.builder()
            .maxAttempts(maxAttempts)
            .exponentialBackoff(
                properties.embedding().initialBackoff().toMillis(),
                2.0,
                properties.embedding().maxBackoff().toMillis())
            .retryOn(TransientErrors.TYPES)
            .traversingCauses()
            .withListener(new RetryListener() {
                @Override
                public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback, Throwable throwable) {
                    log.warn("Embedding call failed (attempt {}/{}): {}",
                        context.getRetryCount(), maxAttempts, SecretScrubber.scrub(throwable.getMessage()));
                }
            })
            .build();
    }

    @Override
    public List<float[]> embedBatch(List<ChunkNode> chunks) {
        if (chunks.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = chunks.stream().map(chunk -> TextSegment.from(chunk.embeddingText())).toList();
        int estimatedTokens = segments.stream().mapToInt(segment -> TokenEstimator.estimate(segment.text())).sum();

        List<Embedding> embeddings = call(estimatedTokens, () -> embeddingModel.embedAll(segments));
        if (embeddings.size() != chunks.size()) {
            throw new EmbeddingException("Provider returned " + embeddings.size() + " vectors for " + chunks.size() + " chunks");
        }
        return embeddings.stream().map(this::validated).toList();
    }

    @Override
    public float[] embedQuery(String inputQuery) {
        if (inputQuery == null || inputQuery.isBlank()) {
            throw new IllegalArgumentException("Query cannot be empty");
        }

        String query = inputQuery.trim();
        if (query.length() > MAX_QUERY_CHARS) {
            query = query.substring(0, MAX_QUERY_CHARS);
            log.warn("Query was truncated to {} characters for embedding", MAX_QUERY_CHARS);
        }

        log.debug("Generating embedding for query: '{}'", query);
        TextSegment segment = TextSegment.from(query);
        Embedding embedding = call(TokenEstimator.estimate(query), () -> embeddingModel.embed(segment));
        return validated(embedding);
    }

    private <T> T call(int estimatedTokens, Supplier<Response<T>> providerCall) {
        try {
            return retryTemplate.execute(context -> concurrencyGate.execute(() ->
                embeddingLimiter.execute(EMBEDDING_LIMIT, estimatedTokens, () -> unwrap(providerCall.get()))));
        } catch (EmbeddingException e) {
            throw e;
        } catch (RuntimeException e) {
            String message = SecretScrubber.scrub(e.getMessage());
            if (TransientErrors.isTransient(e)) {
                throw new TransientProviderException("Embedding provider failed after " + maxAttempts + " attempts: " + message, e);
            }
            throw new EmbeddingException("Embedding provider rejected the request: " + message, e);
        }
    }

    private static <T> T unwrap(Response<T> response) {
        if (response == null || response.content() == null) {
            throw new EmbeddingException("Embedding provider returned no content");
        }
        return response.content();
    }

    private float[] validated(Embedding embedding) {
        float[] vector = embedding.vector();
        if (vector == null || vector.length != dimension) {
            throw new EmbeddingException("Expected a " + dimension + "-dimensional vector but got "
                + (vector == null ? "none" : vector.length));
        }
        return vector;
    }
}

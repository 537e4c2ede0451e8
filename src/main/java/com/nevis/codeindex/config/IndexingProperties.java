package com.nevis.codeindex.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.indexing")
public record IndexingProperties(
	@NotBlank String workspaceDir,
	@NotNull @Min(1) Long maxFileSizeBytes,
	@NotNull @Min(1) Long maxDocumentSizeBytes,
	@Valid @NotNull Chunking chunking,
	@Valid @NotNull Embedding embedding,
	@Valid @NotNull Task task,
	@Valid @NotNull DataModel dataModel
) {

	public record Chunking(
		@NotNull @Min(16) Integer maxTokens,
		@NotNull @Min(0) Integer overlapLines,
		@NotNull @Min(1) Integer moduleFallbackMaxChars
	) {}

	public record Embedding(
		@NotNull @Min(1) @Max(256) Integer batchSize,
		@NotNull @Min(1) Integer maxBatchTokens,
		@NotNull @Min(1) Integer maxConcurrency,
		@NotNull @Min(1) Integer maxAttempts,
		@NotNull Duration initialBackoff,
		@NotNull Duration maxBackoff,
		@NotNull @Min(1) Integer dimension,
		@NotNull @Min(1) Integer requestsPerMinute,
		@NotNull @Min(1) Integer tokensPerMinute,
		boolean strict
	) {}

	public record Task(
		@NotNull @Min(1) Integer maxAttempts,
		@NotNull Duration initialBackoff,
		@NotNull Duration maxBackoff,
		@NotNull Duration staleAfter
	) {}

	public record DataModel(
		@NotNull List<String> baseClasses,
		@NotNull List<String> annotations
	) {}
}

package com.scholary.wordclip.embedding;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the embedding service.
 *
 * <p>{@code dimension} must match what the model produces; the semantic index rejects anything
 * else.
 */
@ConfigurationProperties(prefix = "embedding")
@Validated
public record EmbeddingProperties(
    @NotBlank String baseUrl,
    @NotBlank String model,
    @Positive int dimension,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long backoffMillis) {}

package com.scholary.wordclip.asr;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ASR client.
 *
 * <p>These control how we connect to the recognition server and handle timeouts and retries.
 * Timeouts are in seconds, the backoff base in milliseconds.
 */
@ConfigurationProperties(prefix = "asr")
@Validated
public record AsrProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @Positive long backoffMillis,
    String language) {}

package com.scholary.wordclip.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the HTTP embedder behind the in-memory memo.
 *
 * <p>Everything else depends on {@link Embedder} only.
 */
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {

  @Bean
  public CachingEmbedder embedder(
      EmbeddingProperties properties,
      ObjectMapper objectMapper,
      @Value("${wordclip.cache.embedding-max-size:10000}") long maxSize,
      @Value("${wordclip.cache.embedding-ttl-minutes:60}") long ttlMinutes) {
    return new CachingEmbedder(
        new HttpEmbedder(properties, objectMapper), maxSize, Duration.ofMinutes(ttlMinutes));
  }
}

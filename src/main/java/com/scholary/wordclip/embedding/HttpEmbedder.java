package com.scholary.wordclip.embedding;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for an OpenAI-compatible embeddings endpoint ({@code POST {baseUrl}/v1/embeddings}).
 *
 * <p>One request carries a whole batch. Vectors are returned in input order, using the {@code
 * index} field of the response rather than trusting the array order. Network failures and non-200
 * responses are retried with exponential backoff.
 */
public class HttpEmbedder implements Embedder {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpEmbedder.class);

  private final HttpClient httpClient;
  private final EmbeddingProperties properties;
  private final ObjectMapper objectMapper;

  public HttpEmbedder(EmbeddingProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized embedding client: baseUrl={}, model={}",
        properties.baseUrl(),
        properties.model());
  }

  @Override
  public float[] embed(String text) {
    return batchEmbed(List.of(text)).get(0);
  }

  @Override
  public List<float[]> batchEmbed(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }

    int attempt = 0;
    IOException lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptEmbed(texts);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new EmbeddingException("Embedding interrupted", e);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * properties.backoffMillis());
          LOGGER.warn(
              "Embedding attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new EmbeddingException("Embedding interrupted", ie);
          }
        }
      }
    }

    throw new EmbeddingException(
        String.format("Embedding failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private List<float[]> attemptEmbed(List<String> texts) throws IOException, InterruptedException {
    byte[] body = objectMapper.writeValueAsBytes(new EmbeddingRequest(properties.model(), texts));

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v1/embeddings"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .build();

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format(
              "Embedding service returned status %d: %s", response.statusCode(), response.body()));
    }

    EmbeddingResponse parsed = objectMapper.readValue(response.body(), EmbeddingResponse.class);
    if (parsed.data() == null || parsed.data().size() != texts.size()) {
      throw new EmbeddingException(
          String.format(
              "Embedding service returned %d vectors for %d texts",
              parsed.data() == null ? 0 : parsed.data().size(),
              texts.size()));
    }

    List<EmbeddingData> ordered = new ArrayList<>(parsed.data());
    ordered.sort(Comparator.comparingInt(EmbeddingData::index));

    LOGGER.debug("Embedded {} texts", texts.size());
    return ordered.stream().map(EmbeddingData::embedding).toList();
  }

  record EmbeddingRequest(String model, List<String> input) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record EmbeddingResponse(List<EmbeddingData> data) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record EmbeddingData(int index, float[] embedding) {}
}

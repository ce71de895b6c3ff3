package com.scholary.wordclip.asr;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a whisper.cpp style inference server.
 *
 * <p>Uploads a WAV file as multipart/form-data to {@code {baseUrl}/inference} and asks for the
 * verbose JSON format, which carries segments and per-token data. Transient failures are retried
 * with exponential backoff and jitter.
 */
@Component
public class WhisperClient implements AsrService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final AsrProperties properties;
  private final ObjectMapper objectMapper;

  public WhisperClient(AsrProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized ASR client: baseUrl={}", properties.baseUrl());
  }

  /**
   * Transcribe an audio file.
   *
   * @param audioFile the WAV file to transcribe
   * @param model the model size
   * @return the parsed transcription
   * @throws AsrException if the file is unreadable or transcription fails after retries
   */
  @Override
  public AsrTranscription transcribe(Path audioFile, ModelName model) {
    if (!Files.isReadable(audioFile)) {
      throw new AsrException("Audio file is not readable: " + audioFile);
    }
    LOGGER.info("Transcribing: file={}, model={}", audioFile.getFileName(), model.id());

    int attempt = 0;
    IOException lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return attemptTranscribe(audioFile, model);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new AsrException("Transcription interrupted", e);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs =
              (long)
                  (Math.pow(2, attempt) * properties.backoffMillis()
                      + Math.random() * properties.backoffMillis());
          LOGGER.warn(
              "Transcription attempt {} failed, retrying in {}ms: {}",
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AsrException("Transcription interrupted", ie);
          }
        }
      }
    }

    throw new AsrException(
        String.format("Transcription failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private AsrTranscription attemptTranscribe(Path audioFile, ModelName model)
      throws IOException, InterruptedException {

    String boundary = UUID.randomUUID().toString();
    BodyPublisher body = buildMultipartBody(audioFile, formFields(model), boundary);

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/inference"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(body)
            .build();

    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

    if (response.statusCode() != 200) {
      throw new IOException(
          String.format("ASR server returned status %d: %s", response.statusCode(), response.body()));
    }

    AsrTranscription transcription = objectMapper.readValue(response.body(), AsrTranscription.class);

    LOGGER.info(
        "Transcription successful: {} segments, language={}",
        transcription.segments().size(),
        transcription.language());

    return transcription;
  }

  private Map<String, String> formFields(ModelName model) {
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("model", model.id());
    fields.put("response_format", "verbose_json");
    fields.put("token_timestamps", "true");
    if (properties.language() != null && !properties.language().isBlank()) {
      fields.put("language", properties.language());
    }
    return fields;
  }

  /**
   * Build a multipart/form-data body: the file part followed by one part per form field.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="talk_track_1.wav"
   * Content-Type: audio/wav
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * base
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(
      Path audioFile, Map<String, String> fields, String boundary) throws IOException {

    ByteArrayOutputStream out = new ByteArrayOutputStream();

    String fileHeader =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + audioFile.getFileName()
            + "\"\r\n"
            + "Content-Type: audio/wav\r\n\r\n";
    out.write(fileHeader.getBytes(StandardCharsets.UTF_8));
    out.write(Files.readAllBytes(audioFile));
    out.write("\r\n".getBytes(StandardCharsets.UTF_8));

    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> field : fields.entrySet()) {
      sb.append("--").append(boundary).append("\r\n");
      sb.append("Content-Disposition: form-data; name=\"")
          .append(field.getKey())
          .append("\"\r\n\r\n");
      sb.append(field.getValue()).append("\r\n");
    }
    sb.append("--").append(boundary).append("--\r\n");
    out.write(sb.toString().getBytes(StandardCharsets.UTF_8));

    return BodyPublishers.ofByteArray(out.toByteArray());
  }
}

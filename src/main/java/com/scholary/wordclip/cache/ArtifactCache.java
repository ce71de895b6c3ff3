package com.scholary.wordclip.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.wordclip.clip.Clip;
import com.scholary.wordclip.transcript.TimestampedUnit;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * On-disk store for the intermediate artifacts of a run.
 *
 * <p>Layout under the root:
 *
 * <pre>
 * models/whisper-{model}.bin
 * audio/{inputId}_track_{n}.wav
 * transcriptions/{inputId}.json     JSON array of {start, end, text}
 * clips/{inputId}_clips.json        JSON array of {start, end, keyword}
 * </pre>
 *
 * <p>JSON artifacts are written to a temporary file next to the target and moved into place, so a
 * crash never leaves a half-written transcript behind. There is no locking between processes.
 */
@Component
public class ArtifactCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(ArtifactCache.class);

  private static final TypeReference<List<TimestampedUnit>> UNITS = new TypeReference<>() {};
  private static final TypeReference<List<Clip>> CLIPS = new TypeReference<>() {};

  private final Path root;
  private final Path modelsDir;
  private final Path audioDir;
  private final Path transcriptionsDir;
  private final Path clipsDir;
  private final ObjectMapper objectMapper;

  public ArtifactCache(
      @Value("${wordclip.cache.root:${user.home}/.cache/wordclip}") String root,
      ObjectMapper objectMapper) {
    this.root = Paths.get(root);
    this.modelsDir = this.root.resolve("models");
    this.audioDir = this.root.resolve("audio");
    this.transcriptionsDir = this.root.resolve("transcriptions");
    this.clipsDir = this.root.resolve("clips");
    this.objectMapper = objectMapper;
  }

  /** Create the cache directories if missing. */
  public void init() {
    try {
      for (Path dir : List.of(modelsDir, audioDir, transcriptionsDir, clipsDir)) {
        Files.createDirectories(dir);
      }
    } catch (IOException e) {
      throw new CacheIoException("Failed to create cache directories under " + root, e);
    }
    LOGGER.debug("Cache directories ready under {}", root);
  }

  public Path root() {
    return root;
  }

  public Path modelPath(String modelName) {
    return modelsDir.resolve("whisper-" + modelName + ".bin");
  }

  public Path audioPath(String inputId, int track) {
    return audioDir.resolve(inputId + "_track_" + track + ".wav");
  }

  public Path transcriptPath(String inputId) {
    return transcriptionsDir.resolve(inputId + ".json");
  }

  public Path clipsPath(String inputId) {
    return clipsDir.resolve(inputId + "_clips.json");
  }

  public void saveTranscript(String inputId, List<TimestampedUnit> units) {
    write(transcriptPath(inputId), units);
    LOGGER.info("Saved transcript: {} units to {}", units.size(), transcriptPath(inputId));
  }

  /**
   * @throws ArtifactNotFoundException if no transcript is cached for the input
   * @throws CorruptArtifactException if the file cannot be parsed into valid units
   */
  public List<TimestampedUnit> loadTranscript(String inputId) {
    return read(transcriptPath(inputId), UNITS);
  }

  public void saveClips(String inputId, List<Clip> clips) {
    write(clipsPath(inputId), clips);
    LOGGER.info("Saved clip list: {} clips to {}", clips.size(), clipsPath(inputId));
  }

  /**
   * @throws ArtifactNotFoundException if no clip list is cached for the input
   * @throws CorruptArtifactException if the file cannot be parsed into valid clips
   */
  public List<Clip> loadClips(String inputId) {
    return read(clipsPath(inputId), CLIPS);
  }

  /**
   * Remove the extracted audio, transcript and clip list of one input. Models are kept.
   *
   * @return the number of files deleted
   */
  public int cleanupFor(String inputId) {
    int deleted = 0;
    try {
      if (Files.isDirectory(audioDir)) {
        Pattern trackAudio = Pattern.compile(Pattern.quote(inputId) + "_track_\\d+\\.wav");
        try (Stream<Path> files = Files.list(audioDir)) {
          for (Path file :
              files
                  .filter(f -> trackAudio.matcher(f.getFileName().toString()).matches())
                  .toList()) {
            Files.deleteIfExists(file);
            deleted++;
          }
        }
      }
      if (Files.deleteIfExists(transcriptPath(inputId))) {
        deleted++;
      }
      if (Files.deleteIfExists(clipsPath(inputId))) {
        deleted++;
      }
    } catch (IOException e) {
      throw new CacheIoException("Failed to clean up cached artifacts of " + inputId, e);
    }
    LOGGER.info("Cleaned up {} cached files for {}", deleted, inputId);
    return deleted;
  }

  /** Delete the whole cache root, models included. */
  public void cleanupAll() {
    if (!Files.exists(root)) {
      return;
    }
    try (Stream<Path> paths = Files.walk(root)) {
      for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
        Files.deleteIfExists(path);
      }
    } catch (IOException e) {
      throw new CacheIoException("Failed to delete cache root " + root, e);
    }
    LOGGER.info("Deleted cache root {}", root);
  }

  private void write(Path target, Object value) {
    Path tmp = null;
    try {
      Files.createDirectories(target.getParent());
      tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), value);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new CacheIoException("Failed to write " + target, e);
    }
  }

  private <T> List<T> read(Path file, TypeReference<List<T>> type) {
    if (!Files.isRegularFile(file)) {
      throw new ArtifactNotFoundException(file);
    }
    List<T> values;
    try {
      values = objectMapper.readValue(file.toFile(), type);
    } catch (JsonProcessingException e) {
      throw new CorruptArtifactException(file, e);
    } catch (IOException e) {
      throw new CacheIoException("Failed to read " + file, e);
    }
    if (values == null) {
      throw new CorruptArtifactException(file, "null document");
    }
    if (values.contains(null)) {
      throw new CorruptArtifactException(file, "null entry");
    }
    return List.copyOf(values);
  }

  private static void deleteQuietly(Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temporary file {}", tmp, e);
    }
  }
}

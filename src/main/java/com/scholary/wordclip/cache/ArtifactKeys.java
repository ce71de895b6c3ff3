package com.scholary.wordclip.cache;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Derives the cache key ("input id") of a media file. */
@Component
public class ArtifactKeys {

  private static final int HASH_PREFIX_LENGTH = 12;

  private final KeyStrategy strategy;

  public ArtifactKeys(@Value("${wordclip.cache.key-strategy:FILE_STEM}") KeyStrategy strategy) {
    this.strategy = strategy;
  }

  /**
   * @throws CacheIoException if {@link KeyStrategy#CONTENT_HASH} is used and the file cannot be
   *     read
   */
  public String inputId(Path input) {
    String stem = stem(input);
    if (strategy == KeyStrategy.FILE_STEM) {
      return stem;
    }
    return stem + "-" + sha256(input).substring(0, HASH_PREFIX_LENGTH);
  }

  /** File name without its last extension; dot files keep their name. */
  public static String stem(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  /** Last extension without the dot, or an empty string. */
  public static String extension(Path file) {
    String name = file.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(dot + 1) : "";
  }

  private static String sha256(Path file) {
    MessageDigest digest;
    try {
      digest = MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }

    byte[] buffer = new byte[64 * 1024];
    try (InputStream in = Files.newInputStream(file)) {
      int read;
      while ((read = in.read(buffer)) != -1) {
        digest.update(buffer, 0, read);
      }
    } catch (IOException e) {
      throw new CacheIoException("Failed to hash input file " + file, e);
    }
    return HexFormat.of().formatHex(digest.digest());
  }
}

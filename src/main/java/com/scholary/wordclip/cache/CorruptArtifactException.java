package com.scholary.wordclip.cache;

import com.scholary.wordclip.exception.WordclipException;
import java.nio.file.Path;

/**
 * Thrown when a cached artifact exists but cannot be parsed into valid records.
 *
 * <p>Only the load that hit it fails; the file is left in place for inspection.
 */
public class CorruptArtifactException extends WordclipException {

  public CorruptArtifactException(Path path, Throwable cause) {
    super("Corrupt cached artifact: " + path, cause);
  }

  public CorruptArtifactException(Path path, String reason) {
    super("Corrupt cached artifact: " + path + " (" + reason + ")");
  }
}

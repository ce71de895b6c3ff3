package com.scholary.wordclip.cache;

import com.scholary.wordclip.exception.NotFoundException;
import java.nio.file.Path;

/** Thrown when a cached artifact does not exist on disk. */
public class ArtifactNotFoundException extends NotFoundException {

  public ArtifactNotFoundException(Path path) {
    super("Cached artifact not found: " + path);
  }
}

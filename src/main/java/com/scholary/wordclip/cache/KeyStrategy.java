package com.scholary.wordclip.cache;

/** How an input file is mapped to its cache key. */
public enum KeyStrategy {
  /** File name without its last extension. Two files with the same name share artifacts. */
  FILE_STEM,
  /** File stem plus the first 12 hex characters of the file's SHA-256. */
  CONTENT_HASH
}

package com.scholary.wordclip.embedding;

import com.scholary.wordclip.exception.ExternalToolException;

/** Exception thrown when the embedding service fails or returns an unusable response. */
public class EmbeddingException extends ExternalToolException {

  public EmbeddingException(String message) {
    super(message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}

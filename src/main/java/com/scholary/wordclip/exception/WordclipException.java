package com.scholary.wordclip.exception;

/**
 * Base exception for all wordclip errors.
 *
 * <p>Every domain failure extends this so the CLI runner and the REST layer can handle them in one
 * place.
 */
public class WordclipException extends RuntimeException {

  public WordclipException(String message) {
    super(message);
  }

  public WordclipException(String message, Throwable cause) {
    super(message, cause);
  }
}

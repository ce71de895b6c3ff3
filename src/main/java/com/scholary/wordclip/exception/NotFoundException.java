package com.scholary.wordclip.exception;

/**
 * Something the caller asked for does not exist.
 *
 * <p>Recoverable: callers usually fall back to recomputing the missing value.
 */
public class NotFoundException extends WordclipException {

  public NotFoundException(String message) {
    super(message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.wordclip.exception;

/**
 * Thrown when run settings are invalid: missing input, unknown model, empty track or keyword list.
 *
 * <p>Raised before any pipeline stage runs, so no artifacts exist when this is thrown. Not
 * retryable.
 */
public class ValidationException extends WordclipException {

  public ValidationException(String message) {
    super(message);
  }
}

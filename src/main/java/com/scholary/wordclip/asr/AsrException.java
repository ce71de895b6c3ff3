package com.scholary.wordclip.asr;

import com.scholary.wordclip.exception.ExternalToolException;

/**
 * Exception thrown when speech recognition calls fail.
 *
 * <p>This could be due to network issues, service unavailability, or invalid responses.
 */
public class AsrException extends ExternalToolException {

  public AsrException(String message) {
    super(message);
  }

  public AsrException(String message, Throwable cause) {
    super(message, cause);
  }
}

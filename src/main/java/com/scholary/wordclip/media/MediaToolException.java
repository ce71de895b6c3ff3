package com.scholary.wordclip.media;

import com.scholary.wordclip.exception.ExternalToolException;

/** Exception thrown when ffmpeg is missing or exits with an error. */
public class MediaToolException extends ExternalToolException {

  public MediaToolException(String message) {
    super(message);
  }

  public MediaToolException(String message, Throwable cause) {
    super(message, cause);
  }
}

package com.scholary.wordclip.exception;

/**
 * A collaborator outside the JVM failed: the speech recognizer, the embedder or ffmpeg.
 *
 * <p>A call-level failure aborts the current run. Nothing is retried at this level; the clients
 * do their own retries before giving up.
 */
public class ExternalToolException extends WordclipException {

  public ExternalToolException(String message) {
    super(message);
  }

  public ExternalToolException(String message, Throwable cause) {
    super(message, cause);
  }
}

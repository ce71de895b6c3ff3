package com.scholary.wordclip.cache;

import com.scholary.wordclip.exception.WordclipException;

/** Unexpected I/O failure while reading or writing the artifact cache. */
public class CacheIoException extends WordclipException {

  public CacheIoException(String message, Throwable cause) {
    super(message, cause);
  }
}

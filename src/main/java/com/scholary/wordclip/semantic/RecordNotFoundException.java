package com.scholary.wordclip.semantic;

import com.scholary.wordclip.exception.NotFoundException;

/** Thrown when a record id is not present in a {@link SemanticIndex}. */
public class RecordNotFoundException extends NotFoundException {

  public RecordNotFoundException(long id) {
    super("No embedding record with id " + id);
  }
}

package com.scholary.wordclip.semantic;

import com.scholary.wordclip.exception.WordclipException;

/**
 * Thrown when an embedding vector does not have the dimension declared by its index.
 *
 * <p>Fatal for the run: mixing vector spaces makes every distance meaningless.
 */
public class DimensionMismatchException extends WordclipException {

  private final int expected;
  private final int actual;

  public DimensionMismatchException(int expected, int actual) {
    super(String.format("Embedding dimension mismatch: expected %d, got %d", expected, actual));
    this.expected = expected;
    this.actual = actual;
  }

  public int getExpected() {
    return expected;
  }

  public int getActual() {
    return actual;
  }
}

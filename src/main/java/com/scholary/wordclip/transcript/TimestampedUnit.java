package com.scholary.wordclip.transcript;

/**
 * A word or phrase with its position in the audio, in seconds.
 *
 * <p>Units from one source are kept in non-decreasing {@code start} order.
 */
public record TimestampedUnit(double start, double end, String text) {

  public TimestampedUnit {
    if (text == null) {
      throw new IllegalArgumentException("Unit text cannot be null");
    }
    if (!(start >= 0)) {
      throw new IllegalArgumentException("Unit start must be a non-negative number: " + start);
    }
    if (!(end >= start)) {
      throw new IllegalArgumentException(
          String.format("Unit end %s must not be before start %s", end, start));
    }
  }
}

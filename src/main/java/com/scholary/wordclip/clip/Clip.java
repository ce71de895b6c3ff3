package com.scholary.wordclip.clip;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A time window to cut from the input, with the keyword(s) or moment text(s) that produced it.
 *
 * <p>The label is serialized as {@code keyword} so cached clip lists stay readable by older
 * tooling.
 */
public record Clip(double start, double end, @JsonProperty("keyword") String label) {

  public Clip {
    if (label == null) {
      throw new IllegalArgumentException("Clip label cannot be null");
    }
    if (!(start >= 0)) {
      throw new IllegalArgumentException("Clip start must be a non-negative number: " + start);
    }
    if (!(end >= start)) {
      throw new IllegalArgumentException(
          String.format("Clip end %s must not be before start %s", end, start));
    }
  }

  public double duration() {
    return end - start;
  }
}

package com.scholary.wordclip.asr;

import com.scholary.wordclip.exception.ValidationException;
import java.util.Arrays;
import java.util.stream.Collectors;

/** Speech recognition model sizes accepted by the ASR service. */
public enum ModelName {
  TINY("tiny"),
  TINY_EN("tiny.en"),
  BASE("base"),
  BASE_EN("base.en"),
  SMALL("small"),
  SMALL_EN("small.en"),
  MEDIUM("medium"),
  MEDIUM_EN("medium.en"),
  LARGE("large");

  private final String id;

  ModelName(String id) {
    this.id = id;
  }

  /** The name the ASR service and the model cache use, e.g. {@code base.en}. */
  public String id() {
    return id;
  }

  /**
   * Parse a model name as written in configuration or on the command line.
   *
   * @throws ValidationException if the name is not a known model
   */
  public static ModelName fromId(String value) {
    if (value != null) {
      String normalized = value.trim();
      for (ModelName model : values()) {
        if (model.id.equalsIgnoreCase(normalized)) {
          return model;
        }
      }
    }
    throw new ValidationException(
        String.format(
            "Invalid model name: %s. Valid models are: %s",
            value,
            Arrays.stream(values()).map(ModelName::id).collect(Collectors.joining(", "))));
  }

  @Override
  public String toString() {
    return id;
  }
}

package com.scholary.wordclip.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Run defaults for the clip pipeline.
 *
 * <p>These map to the "wordclip.*" keys in application.yml or in the file passed with {@code
 * --config}. CLI options and REST requests override them through {@link RunSettingsResolver}.
 *
 * <p>The model name is kept as a plain string on purpose: an unknown model is reported as a
 * validation error when a run starts, not as a startup failure.
 */
@ConfigurationProperties(prefix = "wordclip")
@Validated
public record WordclipProperties(
    String model,
    MatchMode mode,
    List<Integer> tracks,
    @Valid List<KeywordProperties> keywords,
    @Valid List<MomentProperties> moments,
    String outputDirectory,
    @Valid NeighborProperties neighbors,
    @Valid SemanticProperties semantic) {

  public WordclipProperties {
    if (model == null) {
      model = "base";
    }
    if (mode == null) {
      mode = MatchMode.KEYWORD;
    }
    if (tracks == null) {
      tracks = List.of(1);
    }
    if (keywords == null) {
      keywords = List.of();
    }
    if (moments == null) {
      moments = List.of();
    }
    if (outputDirectory == null) {
      outputDirectory = "output";
    }
    if (neighbors == null) {
      neighbors = new NeighborProperties(5, 5);
    }
    if (semantic == null) {
      semantic = new SemanticProperties(3, 64);
    }
  }

  /** A literal keyword and the seconds of context to keep around each hit. */
  public record KeywordProperties(
      @NotBlank String text,
      @PositiveOrZero Integer paddingBefore,
      @PositiveOrZero Integer paddingAfter) {

    public KeywordProperties {
      if (paddingBefore == null) {
        paddingBefore = 30;
      }
      if (paddingAfter == null) {
        paddingAfter = 30;
      }
    }
  }

  /**
   * A semantic moment. Neighbor counts are optional and fall back to {@link #neighbors()}.
   */
  public record MomentProperties(
      @NotBlank String text,
      @PositiveOrZero Integer paddingBefore,
      @PositiveOrZero Integer paddingAfter,
      @PositiveOrZero Integer neighborsBefore,
      @PositiveOrZero Integer neighborsAfter) {

    public MomentProperties {
      if (paddingBefore == null) {
        paddingBefore = 0;
      }
      if (paddingAfter == null) {
        paddingAfter = 0;
      }
    }
  }

  /** Number of transcript units kept before and after a semantic hit. */
  public record NeighborProperties(@Min(0) int before, @Min(0) int after) {}

  public record SemanticProperties(@Positive int topK, @Positive int batchSize) {}
}

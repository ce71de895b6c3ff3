package com.scholary.wordclip.api;

import com.scholary.wordclip.config.MatchMode;
import com.scholary.wordclip.config.RunOverrides;
import com.scholary.wordclip.config.WordclipProperties.KeywordProperties;
import com.scholary.wordclip.config.WordclipProperties.MomentProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import java.nio.file.Path;
import java.util.List;

/**
 * Request to clip a media file on the server's file system.
 *
 * <p>Everything except {@code inputPath} is optional and falls back to the configured defaults.
 */
public record ClipRequest(
    @NotBlank String inputPath,
    MatchMode mode,
    @Valid List<KeywordProperties> keywords,
    @Valid List<MomentProperties> moments,
    List<Integer> tracks,
    String model,
    String outputDirectory,
    @PositiveOrZero Integer neighborsBefore,
    @PositiveOrZero Integer neighborsAfter,
    Boolean reuseTranscript,
    Boolean cleanupAfterRun) {

  public RunOverrides toOverrides() {
    return new RunOverrides(
        Path.of(inputPath),
        model,
        mode,
        tracks,
        null,
        keywords,
        moments,
        outputDirectory != null ? Path.of(outputDirectory) : null,
        neighborsBefore,
        neighborsAfter,
        Boolean.TRUE.equals(reuseTranscript),
        cleanupAfterRun);
  }
}

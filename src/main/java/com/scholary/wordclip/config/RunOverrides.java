package com.scholary.wordclip.config;

import com.scholary.wordclip.config.WordclipProperties.KeywordProperties;
import com.scholary.wordclip.config.WordclipProperties.MomentProperties;
import java.nio.file.Path;
import java.util.List;

/**
 * Values supplied for a single run, by the command line or by a REST request.
 *
 * <p>Every field except {@code input} is optional; null means "use the configured value".
 *
 * @param input the media file to clip
 * @param model ASR model name
 * @param mode keyword or semantic matching
 * @param tracks 1-based audio track indices
 * @param clips plain keyword or moment texts, interpreted according to the resolved mode
 * @param keywords fully configured keywords (take precedence over {@code clips})
 * @param moments fully configured moments (take precedence over {@code clips})
 * @param outputDirectory where clip files are written
 * @param neighborsBefore default neighbor window before a semantic hit
 * @param neighborsAfter default neighbor window after a semantic hit
 * @param reuseTranscript load a cached transcript instead of transcribing when one exists
 * @param cleanupAfterRun remove the input's cached artifacts after a successful run
 */
public record RunOverrides(
    Path input,
    String model,
    MatchMode mode,
    List<Integer> tracks,
    List<String> clips,
    List<KeywordProperties> keywords,
    List<MomentProperties> moments,
    Path outputDirectory,
    Integer neighborsBefore,
    Integer neighborsAfter,
    boolean reuseTranscript,
    Boolean cleanupAfterRun) {

  public static RunOverrides forInput(Path input) {
    return new RunOverrides(
        input, null, null, null, null, null, null, null, null, null, false, null);
  }
}

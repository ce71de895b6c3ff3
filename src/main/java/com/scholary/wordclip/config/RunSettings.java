package com.scholary.wordclip.config;

import com.scholary.wordclip.asr.ModelName;
import com.scholary.wordclip.match.MatchConfig;
import com.scholary.wordclip.semantic.Moment;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved and validated settings of one pipeline run.
 *
 * <p>Produced by {@link RunSettingsResolver}; collections are unmodifiable and keyword order is
 * preserved.
 */
public record RunSettings(
    Path input,
    ModelName model,
    MatchMode mode,
    List<Integer> tracks,
    Map<String, MatchConfig> keywords,
    List<Moment> moments,
    Path outputDirectory,
    int neighborsBefore,
    int neighborsAfter,
    boolean reuseTranscript,
    boolean cleanupAfterRun) {}

package com.scholary.wordclip.service;

import com.scholary.wordclip.clip.Clip;
import java.util.List;

/**
 * Outcome of one pipeline run.
 *
 * @param inputId cache key of the input
 * @param transcriptUnits number of units in the combined transcript
 * @param clips the merged clip list, sorted by start
 * @param clipFiles paths of the written clip files, in clip order
 */
public record ClipRunResult(
    String inputId, int transcriptUnits, List<Clip> clips, List<String> clipFiles) {}

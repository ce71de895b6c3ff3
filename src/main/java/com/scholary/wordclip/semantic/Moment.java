package com.scholary.wordclip.semantic;

import com.scholary.wordclip.match.MatchConfig;

/**
 * A natural-language query for semantic matching.
 *
 * @param text what to look for
 * @param padding seconds added around the expanded window
 * @param neighborsBefore units kept before each hit, or null for the run default
 * @param neighborsAfter units kept after each hit, or null for the run default
 */
public record Moment(
    String text, MatchConfig padding, Integer neighborsBefore, Integer neighborsAfter) {

  public Moment {
    if (padding == null) {
      padding = MatchConfig.NONE;
    }
  }

  public static Moment of(String text) {
    return new Moment(text, MatchConfig.NONE, null, null);
  }

  public int neighborsBeforeOr(int fallback) {
    return neighborsBefore != null ? neighborsBefore : fallback;
  }

  public int neighborsAfterOr(int fallback) {
    return neighborsAfter != null ? neighborsAfter : fallback;
  }
}

package com.scholary.wordclip.match;

/**
 * Seconds of context kept before and after a match.
 *
 * @param paddingBefore seconds before the matched unit, never below zero after clamping
 * @param paddingAfter seconds after the matched unit
 */
public record MatchConfig(int paddingBefore, int paddingAfter) {

  /** Padding given to keywords that come without their own configuration. */
  public static final MatchConfig DEFAULT_KEYWORD = new MatchConfig(30, 30);

  public static final MatchConfig NONE = new MatchConfig(0, 0);

  public MatchConfig {
    if (paddingBefore < 0 || paddingAfter < 0) {
      throw new IllegalArgumentException(
          String.format("Padding cannot be negative: before=%d, after=%d", paddingBefore, paddingAfter));
    }
  }
}

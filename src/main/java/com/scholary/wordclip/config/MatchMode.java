package com.scholary.wordclip.config;

/** How candidate moments are found in a transcript. */
public enum MatchMode {
  /** Literal, whole-word keyword hits. */
  KEYWORD,
  /** Nearest-neighbor search over embedded transcript units. */
  SEMANTIC
}

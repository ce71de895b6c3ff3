package com.scholary.wordclip.transcript;

/** Which timestamp a reconstructed word gets. */
public enum TokenTiming {
  /** Every word is stamped with the start of its segment. */
  SEGMENT_START,
  /** Every word is stamped with its first token's own approximate time. */
  TOKEN_TIME
}

package com.scholary.wordclip.media;

import java.nio.file.Path;

/** Audio extraction and clip cutting on the input media file. */
public interface MediaTool {

  /**
   * Fail fast when the tool cannot run at all.
   *
   * @throws MediaToolException if the tool is missing or broken
   */
  void checkAvailable();

  /**
   * Extract one audio track as 16-bit PCM mono WAV at the recognizer's sample rate.
   *
   * @param track 1-based audio track index
   * @throws MediaToolException if extraction fails, e.g. the track does not exist
   */
  void extractAudioTrack(Path input, Path output, int track);

  /**
   * Copy the {@code [start, end]} range of the input into a new file without re-encoding.
   *
   * @throws MediaToolException if cutting fails
   */
  void cut(Path input, Path output, double start, double end);
}

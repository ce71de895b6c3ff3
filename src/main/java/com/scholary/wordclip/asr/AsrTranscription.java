package com.scholary.wordclip.asr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * Response from the ASR service for one audio file.
 *
 * <p>Contains the segments in playback order and the detected language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsrTranscription(List<AsrSegment> segments, String language) {

  public AsrTranscription {
    if (segments == null) {
      segments = List.of();
    }
  }
}

package com.scholary.wordclip.asr;

import java.nio.file.Path;

/**
 * Interface for speech recognition services.
 *
 * <p>The pipeline only needs segments with token timing; which engine produces them is an
 * implementation detail.
 */
public interface AsrService {

  /**
   * Transcribe a 16 kHz mono WAV file.
   *
   * @param audioFile the audio file to transcribe
   * @param model the model size to use
   * @return segments with their tokens
   * @throws AsrException if transcription fails
   */
  AsrTranscription transcribe(Path audioFile, ModelName model);
}

package com.scholary.wordclip.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Stage events put their fields in the MDC for the duration of one log call, so a JSON encoder
 * or log shipper can index them. The run context ({@code runId}, {@code inputId}) stays in the MDC
 * for the whole run.
 */
public class StructuredLogger {

  private static final String RUN_ID = "runId";
  private static final String INPUT_ID = "inputId";

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log one transcribed audio track. */
  public void logTrackTranscribed(int track, int segments, int units, long transcribeMs) {
    try {
      MDC.put("event_type", "track_transcribed");
      MDC.put("track", String.valueOf(track));
      MDC.put("segments", String.valueOf(segments));
      MDC.put("units", String.valueOf(units));
      MDC.put("transcribeMs", String.valueOf(transcribeMs));

      logger.info(
          "Track transcribed: track={}, segments={}, units={}, transcribe={}ms",
          track,
          segments,
          units,
          transcribeMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log the candidate windows found by a matcher. */
  public void logCandidatesFound(String mode, int queries, int candidates) {
    try {
      MDC.put("event_type", "candidates_found");
      MDC.put("mode", mode);
      MDC.put("queries", String.valueOf(queries));
      MDC.put("candidates", String.valueOf(candidates));

      logger.info("Candidates found: mode={}, queries={}, candidates={}", mode, queries, candidates);
    } finally {
      clearEventFields();
    }
  }

  /** Log the result of interval merging. */
  public void logClipsAssembled(int candidates, int clips, double totalSeconds) {
    try {
      MDC.put("event_type", "clips_assembled");
      MDC.put("candidates", String.valueOf(candidates));
      MDC.put("clips", String.valueOf(clips));
      MDC.put("totalSeconds", String.valueOf(totalSeconds));

      logger.info(
          "Clips assembled: candidates={}, clips={}, total={}s", candidates, clips, totalSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log one clip file written. */
  public void logClipCut(int index, double start, double end, String file) {
    try {
      MDC.put("event_type", "clip_cut");
      MDC.put("clip_index", String.valueOf(index));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("file", file);

      logger.debug("Clip cut: index={}, range=[{}-{}], file={}", index, start, end, file);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info("Job progress: jobId={}, phase={}, progress={}%", jobId, phase, percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set run context in MDC. */
  public static void setRunContext(String runId, String inputId) {
    MDC.put(RUN_ID, runId);
    MDC.put(INPUT_ID, inputId);
  }

  /** Clear run context from MDC. */
  public static void clearRunContext() {
    MDC.remove(RUN_ID);
    MDC.remove(INPUT_ID);
  }

  private void clearEventFields() {
    for (String key :
        new String[] {
          "event_type",
          "track",
          "segments",
          "units",
          "transcribeMs",
          "mode",
          "queries",
          "candidates",
          "clips",
          "totalSeconds",
          "clip_index",
          "start",
          "end",
          "file",
          "jobId",
          "percentComplete",
          "phase"
        }) {
      MDC.remove(key);
    }
  }
}

package com.scholary.wordclip.transcript;

import com.scholary.wordclip.asr.AsrSegment;
import com.scholary.wordclip.asr.AsrToken;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Turns the segments of one audio source into an ordered list of timestamped words.
 *
 * <p>Segments with token data are split into words: tokens are concatenated until one ends in
 * whitespace or the segment runs out. Control tokens (ids at or above the special token threshold)
 * and whitespace-only tokens are ignored. Segments without tokens become a single unit, except
 * that a segment repeating the previous unit's text verbatim is dropped; the recognizer tends to
 * emit such repeats on silence.
 *
 * <p>Unreadable input never aborts reconstruction. A segment with missing text or timing is
 * skipped with a warning; a token with a missing field is skipped at debug level.
 */
@Component
public class TranscriptReconstructor {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptReconstructor.class);

  private static final Comparator<TimestampedUnit> BY_START =
      Comparator.comparingDouble(TimestampedUnit::start);

  private final int specialTokenThreshold;
  private final TokenTiming tokenTiming;

  public TranscriptReconstructor(
      @Value("${wordclip.transcript.special-token-threshold:50258}") int specialTokenThreshold,
      @Value("${wordclip.transcript.token-timing:SEGMENT_START}") TokenTiming tokenTiming) {
    this.specialTokenThreshold = specialTokenThreshold;
    this.tokenTiming = tokenTiming;
  }

  /**
   * Reconstruct the units of one source.
   *
   * @param segments segments in playback order, possibly containing unreadable entries
   * @return an unmodifiable list ordered by start time
   */
  public List<TimestampedUnit> reconstruct(List<AsrSegment> segments) {
    List<TimestampedUnit> units = new ArrayList<>();
    int skipped = 0;

    for (int i = 0; i < segments.size(); i++) {
      AsrSegment segment = segments.get(i);
      if (!isReadable(segment)) {
        LOGGER.warn("Skipping segment {}: missing or invalid text or timing", i);
        skipped++;
        continue;
      }

      List<AsrToken> tokens = segment.tokens() == null ? List.of() : segment.tokens();
      if (tokens.isEmpty()) {
        appendSegment(units, segment, i);
      } else {
        appendWords(units, segment, tokens, i);
      }
    }

    if (!isOrdered(units)) {
      LOGGER.warn("Token times went backwards, re-sorting {} units", units.size());
      units.sort(BY_START);
    }

    LOGGER.debug(
        "Reconstructed {} units from {} segments ({} skipped)",
        units.size(),
        segments.size(),
        skipped);
    return List.copyOf(units);
  }

  private void appendSegment(List<TimestampedUnit> units, AsrSegment segment, int index) {
    String text = segment.text();
    if (text.isBlank()) {
      return;
    }
    if (!units.isEmpty() && units.get(units.size() - 1).text().equals(text)) {
      LOGGER.debug("Dropping repeated segment {}: '{}'", index, text);
      return;
    }
    double start = segment.start();
    units.add(new TimestampedUnit(start, Math.max(start, segment.end()), text));
  }

  private void appendWords(
      List<TimestampedUnit> units, AsrSegment segment, List<AsrToken> tokens, int index) {
    StringBuilder word = new StringBuilder();
    Double wordStart = null;
    int lastToken = tokens.size() - 1;

    for (int t = 0; t <= lastToken; t++) {
      AsrToken token = tokens.get(t);
      if (token == null || token.text() == null || token.id() == null) {
        LOGGER.debug("Skipping unreadable token {} in segment {}", t, index);
        continue;
      }
      if (token.id() >= specialTokenThreshold || token.text().trim().isEmpty()) {
        continue;
      }
      Double time = tokenTime(segment, token);
      if (time == null) {
        LOGGER.debug("Skipping token {} in segment {}: no usable time", t, index);
        continue;
      }

      if (wordStart == null) {
        wordStart = time;
      }
      word.append(token.text());

      if (t == lastToken || token.text().endsWith(" ") || token.text().endsWith("\n")) {
        String text = word.toString().trim();
        if (!text.isEmpty()) {
          units.add(new TimestampedUnit(wordStart, Math.max(wordStart, time), text));
        }
        word.setLength(0);
        wordStart = null;
      }
    }

    String remaining = word.toString().trim();
    if (!remaining.isEmpty()) {
      double start = wordStart != null ? wordStart : segment.start();
      units.add(new TimestampedUnit(start, Math.max(start, segment.end()), remaining));
    }
  }

  private Double tokenTime(AsrSegment segment, AsrToken token) {
    if (tokenTiming == TokenTiming.SEGMENT_START) {
      return segment.start();
    }
    Double time = token.time();
    return time != null && Double.isFinite(time) && time >= 0 ? time : null;
  }

  private static boolean isReadable(AsrSegment segment) {
    return segment != null
        && segment.text() != null
        && segment.start() != null
        && segment.end() != null
        && Double.isFinite(segment.start())
        && Double.isFinite(segment.end())
        && segment.start() >= 0;
  }

  private static boolean isOrdered(List<TimestampedUnit> units) {
    for (int i = 1; i < units.size(); i++) {
      if (units.get(i).start() < units.get(i - 1).start()) {
        return false;
      }
    }
    return true;
  }
}

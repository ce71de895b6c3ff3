package com.scholary.wordclip.match;

import com.scholary.wordclip.clip.Clip;
import com.scholary.wordclip.transcript.TimestampedUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds literal keyword hits in a transcript and turns each into a padded window.
 *
 * <p>Matching is whole-word and case-insensitive. Unit text is split on whitespace and every word
 * loses its leading and trailing punctuation, so {@code "Hello,"} matches the keyword
 * {@code hello} but {@code "helloworld"} does not. A keyword of several words matches when the
 * same word sequence occurs inside one unit.
 *
 * <p>Each occurrence yields one window, so a unit saying the keyword twice yields two identical
 * windows. Overlaps are left for {@link com.scholary.wordclip.clip.ClipAssembler}.
 */
@Component
public class KeywordMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(KeywordMatcher.class);

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern EDGE_PUNCTUATION =
      Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

  /**
   * Find candidate windows for every keyword.
   *
   * @param units transcript units
   * @param keywords keyword to padding, iterated in map order
   * @return unmerged windows labeled with the keyword as configured
   */
  public List<Clip> findCandidates(List<TimestampedUnit> units, Map<String, MatchConfig> keywords) {
    List<Clip> candidates = new ArrayList<>();

    for (Map.Entry<String, MatchConfig> entry : keywords.entrySet()) {
      List<String> keywordWords = normalize(entry.getKey());
      if (keywordWords.isEmpty()) {
        LOGGER.warn("Ignoring keyword without letters or digits: '{}'", entry.getKey());
        continue;
      }
      MatchConfig padding = entry.getValue();
      int hits = 0;

      for (TimestampedUnit unit : units) {
        int occurrences = countOccurrences(normalize(unit.text()), keywordWords);
        for (int i = 0; i < occurrences; i++) {
          candidates.add(
              new Clip(
                  Math.max(0, unit.start() - padding.paddingBefore()),
                  unit.end() + padding.paddingAfter(),
                  entry.getKey()));
        }
        hits += occurrences;
      }
      LOGGER.debug("Keyword '{}': {} hits", entry.getKey(), hits);
    }

    return candidates;
  }

  static List<String> normalize(String text) {
    return Arrays.stream(WHITESPACE.split(text.trim()))
        .map(word -> EDGE_PUNCTUATION.matcher(word).replaceAll(""))
        .filter(word -> !word.isEmpty())
        .map(word -> word.toLowerCase(Locale.ROOT))
        .toList();
  }

  private static int countOccurrences(List<String> words, List<String> sequence) {
    int count = 0;
    for (int i = 0; i + sequence.size() <= words.size(); i++) {
      if (words.subList(i, i + sequence.size()).equals(sequence)) {
        count++;
      }
    }
    return count;
  }
}

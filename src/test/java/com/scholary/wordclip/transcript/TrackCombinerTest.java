package com.scholary.wordclip.transcript;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TrackCombinerTest {

  private final TrackCombiner combiner = new TrackCombiner();

  @Test
  void combine_shouldInterleaveTracksByStart() {
    List<TimestampedUnit> host =
        List.of(new TimestampedUnit(0, 1, "welcome"), new TimestampedUnit(4, 5, "thanks"));
    List<TimestampedUnit> guest =
        List.of(new TimestampedUnit(2, 3, "hello"), new TimestampedUnit(6, 7, "bye"));

    List<TimestampedUnit> combined = combiner.combine(List.of(host, guest));

    assertThat(combined)
        .extracting(TimestampedUnit::text)
        .containsExactly("welcome", "hello", "thanks", "bye");
  }

  @Test
  void combine_shouldKeepTrackOrderForEqualStarts() {
    List<TimestampedUnit> first = List.of(new TimestampedUnit(1, 2, "a"));
    List<TimestampedUnit> second = List.of(new TimestampedUnit(1, 2, "b"));

    assertThat(combiner.combine(List.of(first, second)))
        .extracting(TimestampedUnit::text)
        .containsExactly("a", "b");
  }

  @Test
  void combine_shouldReturnSingleTrackUnchanged() {
    List<TimestampedUnit> only = List.of(new TimestampedUnit(0, 1, "solo"));

    assertThat(combiner.combine(List.of(only))).isSameAs(only);
  }
}

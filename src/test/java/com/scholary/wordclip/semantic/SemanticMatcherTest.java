package com.scholary.wordclip.semantic;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.wordclip.clip.Clip;
import com.scholary.wordclip.embedding.BagOfWordsEmbedder;
import com.scholary.wordclip.match.MatchConfig;
import com.scholary.wordclip.transcript.TimestampedUnit;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SemanticMatcherTest {

  private BagOfWordsEmbedder embedder;
  private SemanticIndex index;
  private SemanticMatcher matcher;

  @BeforeEach
  void setUp() {
    embedder = new BagOfWordsEmbedder("weather", "rain", "football", "goal");
    index = new SemanticIndex(embedder.dimension());
    index.populate(
        List.of(
            new TimestampedUnit(0, 2, "good evening"),
            new TimestampedUnit(2, 4, "tomorrow brings rain"),
            new TimestampedUnit(4, 6, "and more rain"),
            new TimestampedUnit(6, 8, "now the football"),
            new TimestampedUnit(8, 10, "a late goal"),
            new TimestampedUnit(10, 12, "good night")),
        embedder);
    matcher = new SemanticMatcher();
  }

  @Test
  void findCandidates_shouldExpandHitToNeighborWindow() {
    List<Clip> clips =
        matcher.findCandidates(index, embedder, List.of(Moment.of("goal")), 1, 1, 1);

    assertThat(clips).containsExactly(new Clip(6, 12, "now the football\na late goal\ngood night"));
  }

  @Test
  void findCandidates_shouldReturnOneWindowPerHit() {
    List<Clip> clips =
        matcher.findCandidates(index, embedder, List.of(Moment.of("rain")), 2, 0, 0);

    assertThat(clips)
        .containsExactly(new Clip(2, 4, "tomorrow brings rain"), new Clip(4, 6, "and more rain"));
  }

  @Test
  void findCandidates_shouldPreferMomentNeighborsOverDefault() {
    Moment moment = new Moment("goal", MatchConfig.NONE, 0, 0);

    List<Clip> clips = matcher.findCandidates(index, embedder, List.of(moment), 1, 5, 5);

    assertThat(clips).containsExactly(new Clip(8, 10, "a late goal"));
  }

  @Test
  void findCandidates_shouldApplyPaddingAndClampAtZero() {
    Moment moment = new Moment("rain", new MatchConfig(10, 3), 1, 0);

    List<Clip> clips = matcher.findCandidates(index, embedder, List.of(moment), 1, 5, 5);

    assertThat(clips).containsExactly(new Clip(0, 7, "good evening\ntomorrow brings rain"));
  }
}

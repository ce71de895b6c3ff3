package com.scholary.wordclip.semantic;

import com.scholary.wordclip.clip.Clip;
import com.scholary.wordclip.embedding.Embedder;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds candidate windows for natural-language moments.
 *
 * <p>Each moment is searched with {@link SemanticIndex#query}; every hit is widened to its
 * chronological neighbors, and the window spans the first neighbor's start to the last
 * neighbor's end plus the moment's padding. The window label is the neighbors' text joined by
 * newlines.
 */
@Component
public class SemanticMatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(SemanticMatcher.class);

  public List<Clip> findCandidates(
      SemanticIndex index,
      Embedder embedder,
      List<Moment> moments,
      int topK,
      int defaultNeighborsBefore,
      int defaultNeighborsAfter) {

    List<Clip> candidates = new ArrayList<>();

    for (Moment moment : moments) {
      int before = moment.neighborsBeforeOr(defaultNeighborsBefore);
      int after = moment.neighborsAfterOr(defaultNeighborsAfter);
      List<EmbeddingRecord> hits = index.query(moment.text(), topK, embedder);

      for (EmbeddingRecord hit : hits) {
        List<EmbeddingRecord> window = index.neighbors(hit.id(), before, after);
        EmbeddingRecord first = window.get(0);
        EmbeddingRecord last = window.get(window.size() - 1);

        candidates.add(
            new Clip(
                Math.max(0, first.start() - moment.padding().paddingBefore()),
                last.end() + moment.padding().paddingAfter(),
                window.stream().map(EmbeddingRecord::text).collect(Collectors.joining("\n"))));
      }
      LOGGER.debug(
          "Moment '{}': {} hits, window {}/{}", moment.text(), hits.size(), before, after);
    }

    return candidates;
  }
}

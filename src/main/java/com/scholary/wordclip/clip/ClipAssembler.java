package com.scholary.wordclip.clip;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges overlapping candidate windows into the final clip list.
 *
 * <p>Candidates are stable-sorted by start and folded left to right. A candidate starting at or
 * before the running clip's end is absorbed: the end grows to cover it and its label is appended
 * with {@code ", "}. Touching windows ({@code next.start == acc.end}) merge.
 *
 * <p>The result is sorted and pairwise disjoint, covers exactly the union of the inputs, and is a
 * fixed point: merging it again returns an equal list.
 */
@Component
public class ClipAssembler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClipAssembler.class);

  public List<Clip> merge(Collection<Clip> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }

    List<Clip> sorted = new ArrayList<>(candidates);
    sorted.sort(Comparator.comparingDouble(Clip::start));

    List<Clip> merged = new ArrayList<>();
    Clip first = sorted.get(0);
    double start = first.start();
    double end = first.end();
    StringBuilder label = new StringBuilder(first.label());

    for (int i = 1; i < sorted.size(); i++) {
      Clip next = sorted.get(i);
      if (next.start() <= end) {
        end = Math.max(end, next.end());
        label.append(", ").append(next.label());
      } else {
        merged.add(new Clip(start, end, label.toString()));
        start = next.start();
        end = next.end();
        label = new StringBuilder(next.label());
      }
    }
    merged.add(new Clip(start, end, label.toString()));

    LOGGER.debug("Merged {} candidate windows into {} clips", candidates.size(), merged.size());
    return List.copyOf(merged);
  }
}

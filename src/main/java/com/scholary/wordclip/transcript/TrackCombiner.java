package com.scholary.wordclip.transcript;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines the unit lists of several audio tracks into one timeline.
 *
 * <p>Tracks overlap in time, so simple concatenation is not enough: the joined list is
 * stable-sorted by start time. Units with equal starts keep track order.
 */
@Component
public class TrackCombiner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TrackCombiner.class);

  public List<TimestampedUnit> combine(List<List<TimestampedUnit>> tracks) {
    if (tracks.size() == 1) {
      return tracks.get(0);
    }

    List<TimestampedUnit> combined = new ArrayList<>();
    for (List<TimestampedUnit> track : tracks) {
      combined.addAll(track);
    }
    combined.sort(Comparator.comparingDouble(TimestampedUnit::start));

    LOGGER.info("Combined {} tracks into {} units", tracks.size(), combined.size());
    return List.copyOf(combined);
  }
}

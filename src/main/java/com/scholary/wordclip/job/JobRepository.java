package com.scholary.wordclip.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for clip jobs.
 *
 * <p>Uses a Caffeine cache so finished jobs expire instead of accumulating. Jobs do not survive a
 * restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, ClipJob> cache;

  public JobRepository(
      @Value("${jobstore.max-size:500}") int maxSize,
      @Value("${jobstore.expire-after-minutes:120}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(ClipJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<ClipJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}

package com.scholary.wordclip.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Memoizes another embedder with a Caffeine cache keyed by text.
 *
 * <p>Transcripts repeat short words constantly ("yeah", "so", "the"), and repeated runs over the
 * same input embed the same units again. A batch only sends the texts the cache is missing,
 * each distinct text once.
 */
public class CachingEmbedder implements Embedder {

  private static final Logger LOGGER = LoggerFactory.getLogger(CachingEmbedder.class);

  private final Embedder delegate;
  private final Cache<String, float[]> cache;

  public CachingEmbedder(Embedder delegate, long maxSize, Duration ttl) {
    this.delegate = delegate;
    this.cache = Caffeine.newBuilder().maximumSize(maxSize).expireAfterAccess(ttl).recordStats().build();
    LOGGER.info("Embedding memo initialized: maxSize={}, ttl={}", maxSize, ttl);
  }

  @Override
  public float[] embed(String text) {
    return cache.get(text, delegate::embed);
  }

  @Override
  public List<float[]> batchEmbed(List<String> texts) {
    Map<String, float[]> found = new HashMap<>(cache.getAllPresent(texts));

    List<String> missing = new ArrayList<>(new LinkedHashSet<>(texts));
    missing.removeAll(found.keySet());

    if (!missing.isEmpty()) {
      List<float[]> vectors = delegate.batchEmbed(missing);
      if (vectors.size() != missing.size()) {
        throw new EmbeddingException(
            String.format("Embedder returned %d vectors for %d texts", vectors.size(), missing.size()));
      }
      for (int i = 0; i < missing.size(); i++) {
        found.put(missing.get(i), vectors.get(i));
        cache.put(missing.get(i), vectors.get(i));
      }
    }

    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(
          "Embedding batch: {} texts, {} sent to delegate. {}",
          texts.size(),
          missing.size(),
          getStats());
    }
    return texts.stream().map(found::get).toList();
  }

  /** Hit/miss counters of the memo. */
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "Embedding memo: size=%d, hits=%d, misses=%d, hitRate=%.2f%%",
        cache.estimatedSize(), stats.hitCount(), stats.missCount(), stats.hitRate() * 100);
  }
}

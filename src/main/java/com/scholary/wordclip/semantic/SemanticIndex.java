package com.scholary.wordclip.semantic;

import com.scholary.wordclip.embedding.Embedder;
import com.scholary.wordclip.embedding.EmbeddingException;
import com.scholary.wordclip.transcript.TimestampedUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory nearest-neighbor store over embedded transcript units.
 *
 * <p>Records get ids 1, 2, 3... in insertion order and are never removed. Every vector must have
 * the dimension given at construction.
 *
 * <p>One index belongs to one run. Population is single-writer; once a population call returns,
 * the records are published as an immutable snapshot and reads ({@link #query}, {@link
 * #neighbors}, {@link #get}) are safe from any thread.
 *
 * <p>Search is a linear scan ranked by cosine distance ({@code 1 - cos}). Transcripts hold a few
 * thousand units, so an approximate index would not pay for itself.
 */
public class SemanticIndex {

  private static final Logger LOGGER = LoggerFactory.getLogger(SemanticIndex.class);

  public static final int DEFAULT_BATCH_SIZE = 64;

  private static final Comparator<EmbeddingRecord> CHRONOLOGICAL =
      Comparator.comparingDouble(EmbeddingRecord::start).thenComparingLong(EmbeddingRecord::id);

  private final int dimension;
  private final List<EmbeddingRecord> pending = new ArrayList<>();
  private long nextId = 1;

  private volatile List<EmbeddingRecord> records = List.of();
  private volatile Map<Long, EmbeddingRecord> byId = Map.of();

  public SemanticIndex(int dimension) {
    if (dimension <= 0) {
      throw new IllegalArgumentException("Dimension must be positive: " + dimension);
    }
    this.dimension = dimension;
  }

  /** Embed and insert units in batches of {@value #DEFAULT_BATCH_SIZE}. */
  public void populate(List<TimestampedUnit> units, Embedder embedder) {
    populate(units, embedder, DEFAULT_BATCH_SIZE, Runnable::run);
  }

  /**
   * Embed units in batches, possibly concurrently, and insert them in input order.
   *
   * <p>Batches are submitted to the executor together; insertion waits for each batch in turn, so
   * ids still follow input order. A failed batch fails the whole call and nothing from it or
   * later batches is inserted.
   *
   * @throws DimensionMismatchException if any vector has the wrong length
   * @throws EmbeddingException if the embedder fails or returns the wrong number of vectors
   */
  public synchronized void populate(
      List<TimestampedUnit> units, Embedder embedder, int batchSize, Executor executor) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
    }
    long startTime = System.currentTimeMillis();

    List<List<TimestampedUnit>> batches = new ArrayList<>();
    for (int from = 0; from < units.size(); from += batchSize) {
      batches.add(units.subList(from, Math.min(units.size(), from + batchSize)));
    }

    List<CompletableFuture<List<float[]>>> futures = new ArrayList<>();
    for (List<TimestampedUnit> batch : batches) {
      List<String> texts = batch.stream().map(TimestampedUnit::text).toList();
      futures.add(CompletableFuture.supplyAsync(() -> embedder.batchEmbed(texts), executor));
    }

    try {
      for (int b = 0; b < batches.size(); b++) {
        insertBatch(batches.get(b), await(futures.get(b)));
      }
    } finally {
      publish();
    }

    LOGGER.info(
        "Indexed {} units in {} batches ({}ms), index size {}",
        units.size(),
        batches.size(),
        System.currentTimeMillis() - startTime,
        pending.size());
  }

  private void insertBatch(List<TimestampedUnit> batch, List<float[]> vectors) {
    if (vectors == null || vectors.size() != batch.size()) {
      throw new EmbeddingException(
          String.format(
              "Embedder returned %d vectors for %d texts",
              vectors == null ? 0 : vectors.size(), batch.size()));
    }
    for (float[] vector : vectors) {
      checkDimension(vector);
    }
    for (int i = 0; i < batch.size(); i++) {
      TimestampedUnit unit = batch.get(i);
      pending.add(
          new EmbeddingRecord(nextId++, unit.start(), unit.end(), unit.text(), vectors.get(i)));
    }
  }

  private void publish() {
    Map<Long, EmbeddingRecord> index = new HashMap<>();
    for (EmbeddingRecord record : pending) {
      index.put(record.id(), record);
    }
    byId = Map.copyOf(index);
    records = List.copyOf(pending);
  }

  /**
   * Find the records closest in meaning to a query.
   *
   * @return at most {@code k} records, nearest first, ties broken by lower id
   * @throws DimensionMismatchException if the query vector has the wrong length
   */
  public List<EmbeddingRecord> query(String text, int k, Embedder embedder) {
    List<EmbeddingRecord> snapshot = records;
    if (snapshot.isEmpty() || k <= 0) {
      return List.of();
    }

    float[] queryVector = embedder.embed(text);
    checkDimension(queryVector);

    List<Scored> ranked =
        snapshot.stream()
            .map(record -> new Scored(record, cosineDistance(queryVector, record.vector())))
            .sorted(
                Comparator.comparingDouble(Scored::distance)
                    .thenComparingLong(scored -> scored.record().id()))
            .limit(k)
            .toList();

    for (Scored hit : ranked) {
      LOGGER.debug(
          "Query '{}' hit id={} distance={} text='{}'",
          text,
          hit.record().id(),
          hit.distance(),
          hit.record().text());
    }
    return ranked.stream().map(Scored::record).toList();
  }

  /**
   * Chronological context around a record.
   *
   * <p>Returns up to {@code before} records starting strictly earlier than the target, the target,
   * then up to {@code after} records starting strictly later, all in chronological order. Records
   * sharing the target's start time are excluded. Fewer neighbors than requested is not an error.
   *
   * @throws RecordNotFoundException if {@code id} is unknown
   */
  public List<EmbeddingRecord> neighbors(long id, int before, int after) {
    if (before < 0 || after < 0) {
      throw new IllegalArgumentException(
          String.format("Neighbor counts cannot be negative: before=%d, after=%d", before, after));
    }
    EmbeddingRecord target = get(id);
    List<EmbeddingRecord> snapshot = records;

    List<EmbeddingRecord> earlier =
        new ArrayList<>(
            snapshot.stream()
                .filter(record -> record.start() < target.start())
                .sorted(CHRONOLOGICAL.reversed())
                .limit(before)
                .toList());
    Collections.reverse(earlier);

    List<EmbeddingRecord> later =
        snapshot.stream()
            .filter(record -> record.start() > target.start())
            .sorted(CHRONOLOGICAL)
            .limit(after)
            .toList();

    List<EmbeddingRecord> window = new ArrayList<>(earlier.size() + 1 + later.size());
    window.addAll(earlier);
    window.add(target);
    window.addAll(later);
    return window;
  }

  /** @throws RecordNotFoundException if {@code id} is unknown */
  public EmbeddingRecord get(long id) {
    EmbeddingRecord record = byId.get(id);
    if (record == null) {
      throw new RecordNotFoundException(id);
    }
    return record;
  }

  public int size() {
    return records.size();
  }

  public int dimension() {
    return dimension;
  }

  /** Cosine distance in [0, 2]; a zero vector is treated as unrelated to everything (1.0). */
  static double cosineDistance(float[] a, float[] b) {
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0 || normB == 0) {
      return 1.0;
    }
    return 1.0 - dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private void checkDimension(float[] vector) {
    int actual = vector == null ? 0 : vector.length;
    if (actual != dimension) {
      throw new DimensionMismatchException(dimension, actual);
    }
  }

  private record Scored(EmbeddingRecord record, double distance) {}

  private static List<float[]> await(CompletableFuture<List<float[]>> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw new EmbeddingException("Embedding batch failed", e.getCause());
    }
  }
}

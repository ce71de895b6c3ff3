package com.scholary.wordclip.embedding;

import java.util.List;

/**
 * Turns text into fixed-length vectors.
 *
 * <p>Implementations must be safe to call from several threads. Returned arrays are treated as
 * read-only by callers.
 */
public interface Embedder {

  /**
   * Embed a single text.
   *
   * @throws EmbeddingException if the embedding engine fails
   */
  float[] embed(String text);

  /**
   * Embed several texts in one call.
   *
   * @return one vector per text, in input order
   * @throws EmbeddingException if the embedding engine fails
   */
  List<float[]> batchEmbed(List<String> texts);
}

package com.scholary.wordclip.semantic;

/**
 * A transcript unit stored in a {@link SemanticIndex} with its embedding.
 *
 * <p>The vector array is shared, not copied; nobody writes to it after insertion.
 */
public record EmbeddingRecord(long id, double start, double end, String text, float[] vector) {}

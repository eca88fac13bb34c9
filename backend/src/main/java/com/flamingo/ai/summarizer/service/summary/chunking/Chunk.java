package com.flamingo.ai.summarizer.service.summary.chunking;

/**
 * A contiguous span of the source text produced by {@link TextChunker}.
 *
 * <p>Chunks are ephemeral: they are produced fresh for each summarization and never persisted.
 *
 * @param index 0-based position of the chunk in document order
 * @param text the chunk text, including any overlap carried over from the previous chunk
 * @param overlapLength number of leading characters of {@code text} repeated from the previous
 *     chunk; 0 for the first chunk
 * @param tokenEstimate {@link TokenEstimator} estimate of {@code text}
 */
public record Chunk(int index, String text, int overlapLength, int tokenEstimate) {

  /** Returns the chunk text with the carried-over overlap removed. */
  public String withoutOverlap() {
    return text.substring(overlapLength);
  }
}

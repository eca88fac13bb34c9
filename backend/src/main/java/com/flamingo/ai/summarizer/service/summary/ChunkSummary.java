package com.flamingo.ai.summarizer.service.summary;

import java.util.Comparator;

/**
 * Summary of one chunk, tagged with the index of the chunk it came from.
 *
 * @param chunkIndex 0-based index of the originating chunk
 * @param text the generated summary text
 */
public record ChunkSummary(int chunkIndex, String text) {

  public static final Comparator<ChunkSummary> BY_CHUNK_INDEX =
      Comparator.comparingInt(ChunkSummary::chunkIndex);
}

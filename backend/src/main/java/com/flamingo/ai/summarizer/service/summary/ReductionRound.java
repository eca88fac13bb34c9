package com.flamingo.ai.summarizer.service.summary;

import java.util.ArrayList;
import java.util.List;

/**
 * The ordered chunk summaries merged in one reduce pass.
 *
 * @param round 1-based round number
 * @param summaries summaries sorted by chunk index
 */
public record ReductionRound(int round, List<ChunkSummary> summaries) {

  public ReductionRound {
    List<ChunkSummary> ordered = new ArrayList<>(summaries);
    ordered.sort(ChunkSummary.BY_CHUNK_INDEX);
    summaries = List.copyOf(ordered);
  }

  /**
   * Concatenates the summaries in chunk order, each under a {@code --- CHUNK i/n SUMMARY ---}
   * marker, separated by blank lines.
   */
  public String combined() {
    int total = summaries.size();
    StringBuilder combined = new StringBuilder();
    for (int i = 0; i < total; i++) {
      if (i > 0) {
        combined.append("\n\n");
      }
      combined
          .append("--- CHUNK ")
          .append(i + 1)
          .append('/')
          .append(total)
          .append(" SUMMARY ---\n")
          .append(summaries.get(i).text());
    }
    return combined.toString();
  }
}

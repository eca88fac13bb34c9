package com.flamingo.ai.summarizer.service.summary;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReductionRound Tests")
class ReductionRoundTest {

  @Test
  @DisplayName("should order summaries by chunk index regardless of completion order")
  void shouldOrderByChunkIndex() {
    ReductionRound round =
        new ReductionRound(
            1,
            List.of(
                new ChunkSummary(2, "third"),
                new ChunkSummary(0, "first"),
                new ChunkSummary(1, "second")));

    assertThat(round.summaries())
        .extracting(ChunkSummary::text)
        .containsExactly("first", "second", "third");
  }

  @Test
  @DisplayName("should join summaries under numbered section markers")
  void shouldCombineWithMarkers() {
    ReductionRound round =
        new ReductionRound(1, List.of(new ChunkSummary(1, "B"), new ChunkSummary(0, "A")));

    assertThat(round.combined())
        .isEqualTo("--- CHUNK 1/2 SUMMARY ---\nA\n\n--- CHUNK 2/2 SUMMARY ---\nB");
  }
}

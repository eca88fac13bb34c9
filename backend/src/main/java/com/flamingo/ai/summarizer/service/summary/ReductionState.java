package com.flamingo.ai.summarizer.service.summary;

/**
 * States of one summarization pipeline run.
 *
 * <p>{@code IDLE -> ESTIMATING -> (DIRECT_SUMMARIZING | CHUNKING -> MAP_SUMMARIZING ->
 * [REDUCE_MERGING -> MAP_SUMMARIZING]* -> FINAL_SUMMARIZING) -> DONE}. {@code FAILED} is reachable
 * from every non-terminal state.
 */
public enum ReductionState {
  IDLE,
  ESTIMATING,
  DIRECT_SUMMARIZING,
  CHUNKING,
  MAP_SUMMARIZING,
  REDUCE_MERGING,
  FINAL_SUMMARIZING,
  DONE,
  FAILED;

  public boolean isTerminal() {
    return this == DONE || this == FAILED;
  }
}

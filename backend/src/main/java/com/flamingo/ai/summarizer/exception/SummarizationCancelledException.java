package com.flamingo.ai.summarizer.exception;

import com.flamingo.ai.summarizer.service.summary.ReductionState;

/** Exception thrown when the caller cancels a running summarization. */
public class SummarizationCancelledException extends SummarizationException {

  public SummarizationCancelledException(ReductionState failedIn) {
    super(
        failedIn,
        "Summarization cancelled during " + failedIn,
        "Summarization was cancelled",
        null);
  }
}

package com.flamingo.ai.summarizer.exception;

import com.flamingo.ai.summarizer.service.summary.ReductionState;

/**
 * Exception thrown when a summarization pipeline ends in {@link ReductionState#FAILED}.
 *
 * <p>No partial summary accompanies this exception: a pipeline either returns a complete summary
 * or fails.
 */
public class SummarizationException extends RuntimeException {

  private final ReductionState failedIn;
  private final String userMessage;

  public SummarizationException(ReductionState failedIn, String message) {
    super(message);
    this.failedIn = failedIn;
    this.userMessage = "Failed to summarize document";
  }

  public SummarizationException(ReductionState failedIn, String message, Throwable cause) {
    super(message, cause);
    this.failedIn = failedIn;
    this.userMessage = "Failed to summarize document";
  }

  public SummarizationException(
      ReductionState failedIn, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.failedIn = failedIn;
    this.userMessage = userMessage;
  }

  /** The state the pipeline was in when it failed. */
  public ReductionState getFailedIn() {
    return failedIn;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

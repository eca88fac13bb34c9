package com.flamingo.ai.summarizer.exception;

/** Exception thrown when a single generation backend call fails or times out. */
public class LlmServiceException extends RuntimeException {

  private final boolean timedOut;
  private final String userMessage;

  public LlmServiceException(String message) {
    super(message);
    this.timedOut = false;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public LlmServiceException(String message, Throwable cause) {
    super(message, cause);
    this.timedOut = false;
    this.userMessage = "AI service is temporarily unavailable. Please try again later.";
  }

  public LlmServiceException(String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.timedOut = timedOut;
    this.userMessage =
        timedOut
            ? "AI service did not respond in time. Please try again later."
            : "AI service is temporarily unavailable. Please try again later.";
  }

  public boolean isTimedOut() {
    return timedOut;
  }

  public String getUserMessage() {
    return userMessage;
  }
}

package com.flamingo.ai.summarizer.service.summary.backend;

import com.flamingo.ai.summarizer.service.summary.CancellationSignal;

/**
 * External text generation service that turns one assembled prompt into one completion.
 *
 * <p>When no real service is configured, {@link SimulatedGenerationBackend} stands in for it.
 */
public interface GenerationBackend {

  /**
   * Generates a completion for {@code prompt}. Blocking; implementations should respond to thread
   * interruption where the underlying client allows it.
   *
   * @param prompt the fully assembled prompt
   * @param cancellation the pipeline's cancellation signal
   * @return the generated text
   */
  String generate(String prompt, CancellationSignal cancellation);

  /** Whether this backend returns canned output instead of calling a real service. */
  default boolean isSimulated() {
    return false;
  }

  /** Short description for logs and health output, e.g. the model name. */
  String description();
}

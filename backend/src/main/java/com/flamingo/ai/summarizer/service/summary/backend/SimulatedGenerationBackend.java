package com.flamingo.ai.summarizer.service.summary.backend;

import com.flamingo.ai.summarizer.service.summary.CancellationSignal;

/** Backend used when no generation service is configured; always returns {@link #SENTINEL}. */
public class SimulatedGenerationBackend implements GenerationBackend {

  public static final String SENTINEL = "[Simulated AI summary]";

  @Override
  public String generate(String prompt, CancellationSignal cancellation) {
    return SENTINEL;
  }

  @Override
  public boolean isSimulated() {
    return true;
  }

  @Override
  public String description() {
    return "simulated";
  }
}
